package io.agentloom.core.policy.security;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/// A rule granting or restricting access to capabilities.
///
/// Capability names and argument values are matched with simple globs: `*` matches any
/// run of characters and `?` a single one. A rule with an `argument` only applies when
/// the call carries that argument and its text matches `valuePattern`.
///
/// @param id rule id used for revocation, not null
/// @param capability capability name glob, not null
/// @param level level granted when the rule applies, not null
/// @param argument argument the rule constrains, or null for any call
/// @param valuePattern glob for the argument value, or null for any value
/// @param expiresAt instant after which the rule no longer applies, or null
public record PermissionRule(
        String id,
        String capability,
        PermissionLevel level,
        String argument,
        String valuePattern,
        Instant expiresAt) {

    public PermissionRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(level, "level must not be null");
    }

    public static PermissionRule of(String id, String capability, PermissionLevel level) {
        return new PermissionRule(id, capability, level, null, null, null);
    }

    /// Creates a rule that only applies when an argument value matches a glob,
    /// for example a `url` argument matching `*.bank.example/*`.
    public static PermissionRule forArgument(
            String id, String capability, String argument, String valuePattern, PermissionLevel level) {
        return new PermissionRule(id, capability, level, argument, valuePattern, null);
    }

    public PermissionRule expiringAt(Instant instant) {
        return new PermissionRule(id, capability, level, argument, valuePattern, instant);
    }

    /// Returns whether the rule applies to a call.
    ///
    /// @param name capability name, not null
    /// @param arguments call arguments, not null
    /// @param now evaluation time, not null
    /// @return `true` if the rule is live and matches
    public boolean appliesTo(String name, Map<String, Object> arguments, Instant now) {
        if (expiresAt != null && expiresAt.isBefore(now)) {
            return false;
        }
        if (!globMatches(capability, name)) {
            return false;
        }
        if (argument == null) {
            return true;
        }
        Object value = arguments.get(argument);
        return value != null && (valuePattern == null || globMatches(valuePattern, String.valueOf(value)));
    }

    static boolean globMatches(String glob, String text) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int literalStart = 0;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (i > literalStart) {
                    regex.append(Pattern.quote(glob.substring(literalStart, i)));
                }
                regex.append(c == '*' ? ".*" : ".");
                literalStart = i + 1;
            }
        }
        if (literalStart < glob.length()) {
            regex.append(Pattern.quote(glob.substring(literalStart)));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL).matcher(text).matches();
    }
}
