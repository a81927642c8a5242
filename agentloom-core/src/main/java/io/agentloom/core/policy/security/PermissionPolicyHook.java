package io.agentloom.core.policy.security;

import io.agentloom.core.policy.PolicyHook;
import io.agentloom.core.policy.PolicyOutcome;
import io.agentloom.core.reasoning.ToolCallRequest;
import io.agentloom.core.runtime.AgentContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/// Pre-invocation hook that checks each call against permission rules.
///
/// ### Evaluation
/// 1. Collect every live rule whose capability glob (and argument constraint, if any)
///    matches the call.
/// 2. No match: the configured default level applies.
/// 3. Otherwise the most restrictive matching level wins.
/// 4. A call that would be allowed but names a high-risk capability is raised to
///    {@link PermissionLevel#ASK}.
///
/// `DENY` becomes {@link PolicyOutcome.Block}, `ASK` becomes {@link PolicyOutcome.Escalate}
/// and `ALLOW` leaves the decision to later hooks.
///
/// @implNote Thread-safe. Rules may be added and revoked while agents run.
///
/// @see PermissionRule
public final class PermissionPolicyHook implements PolicyHook {

    private static final Logger logger = Logger.getLogger(PermissionPolicyHook.class.getName());

    private final List<PermissionRule> rules;
    private final List<String> highRiskCapabilities;
    private final PermissionLevel defaultLevel;
    private final Clock clock;

    private PermissionPolicyHook(Builder builder) {
        this.rules = new CopyOnWriteArrayList<>(builder.rules);
        this.highRiskCapabilities = List.copyOf(builder.highRiskCapabilities);
        this.defaultLevel = builder.defaultLevel;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public PolicyOutcome beforeInvocation(
            ToolCallRequest call, Map<String, Object> arguments, AgentContext context) {
        Evaluation evaluation = evaluate(call.name(), arguments);
        return switch (evaluation.level()) {
            case DENY -> {
                logger.warning("Agent " + context.agentId() + " denied " + call.name() + ": " + evaluation.reason());
                yield PolicyOutcome.block(evaluation.reason());
            }
            case ASK -> PolicyOutcome.escalate(evaluation.reason());
            case ALLOW -> null;
        };
    }

    /// Evaluates a call without running it.
    ///
    /// @param name capability name, not null
    /// @param arguments call arguments, not null
    /// @return effective level with its reason, never null
    public Evaluation evaluate(String name, Map<String, Object> arguments) {
        List<PermissionRule> matched = new ArrayList<>();
        for (PermissionRule rule : rules) {
            if (rule.appliesTo(name, arguments, clock.instant())) {
                matched.add(rule);
            }
        }

        if (matched.isEmpty()) {
            PermissionLevel level = raiseHighRisk(name, defaultLevel);
            return new Evaluation(level, reason(name, level, level != defaultLevel, null), matched);
        }

        PermissionRule deciding = matched.get(0);
        for (PermissionRule rule : matched) {
            if (rule.level().ordinal() > deciding.level().ordinal()) {
                deciding = rule;
            }
        }
        PermissionLevel level = raiseHighRisk(name, deciding.level());
        return new Evaluation(level, reason(name, level, level != deciding.level(), deciding), matched);
    }

    public void addRule(PermissionRule rule) {
        rules.add(Objects.requireNonNull(rule, "rule must not be null"));
        logger.fine("Added permission rule " + rule.id() + " for " + rule.capability());
    }

    /// Removes every rule with the given id.
    ///
    /// @return `true` if a rule was removed
    public boolean revokeRule(String id) {
        boolean removed = rules.removeIf(rule -> rule.id().equals(id));
        if (removed) {
            logger.fine("Revoked permission rule " + id);
        }
        return removed;
    }

    public List<PermissionRule> rules() {
        return List.copyOf(rules);
    }

    private PermissionLevel raiseHighRisk(String name, PermissionLevel level) {
        if (level != PermissionLevel.ALLOW) {
            return level;
        }
        for (String pattern : highRiskCapabilities) {
            if (PermissionRule.globMatches(pattern, name)) {
                return PermissionLevel.ASK;
            }
        }
        return level;
    }

    private static String reason(String name, PermissionLevel level, boolean highRisk, PermissionRule rule) {
        if (highRisk) {
            return "High-risk capability " + name + " requires approval";
        }
        String source = rule != null ? " by rule " + rule.id() : " by default";
        return switch (level) {
            case DENY -> "Capability " + name + " denied" + source;
            case ASK -> "Capability " + name + " requires approval" + source;
            case ALLOW -> "Capability " + name + " allowed" + source;
        };
    }

    /// Result of evaluating one call.
    ///
    /// @param level effective level, not null
    /// @param reason human-readable reason, not null
    /// @param matchedRules rules that applied, in registration order, not null
    public record Evaluation(PermissionLevel level, String reason, List<PermissionRule> matchedRules) {

        public Evaluation {
            matchedRules = List.copyOf(matchedRules);
        }
    }

    /// Builder for {@link PermissionPolicyHook}.
    ///
    /// Defaults: no rules, no high-risk capabilities, default level
    /// {@link PermissionLevel#ALLOW}, system UTC clock.
    public static final class Builder {
        private final List<PermissionRule> rules = new ArrayList<>();
        private final List<String> highRiskCapabilities = new ArrayList<>();
        private PermissionLevel defaultLevel = PermissionLevel.ALLOW;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder rule(PermissionRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder allow(String capability) {
            return rule(PermissionRule.of("allow:" + capability, capability, PermissionLevel.ALLOW));
        }

        public Builder ask(String capability) {
            return rule(PermissionRule.of("ask:" + capability, capability, PermissionLevel.ASK));
        }

        public Builder deny(String capability) {
            return rule(PermissionRule.of("deny:" + capability, capability, PermissionLevel.DENY));
        }

        /// Marks capabilities whose allowed calls still need approval.
        ///
        /// @param pattern capability name glob, not null
        public Builder highRisk(String pattern) {
            highRiskCapabilities.add(Objects.requireNonNull(pattern, "pattern must not be null"));
            return this;
        }

        /// Sets the level for calls no rule matches.
        public Builder defaultLevel(PermissionLevel level) {
            this.defaultLevel = Objects.requireNonNull(level, "level must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public PermissionPolicyHook build() {
            return new PermissionPolicyHook(this);
        }
    }
}
