package io.agentloom.core.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Decision of a pre-invocation policy hook.
///
/// ### Variants
/// - {@link Allow} - proceed, optionally with replaced arguments
/// - {@link Block} - do not invoke; the engine sees an error result
/// - {@link Skip} - do not invoke; the engine sees a neutral result
/// - {@link Escalate} - ask a human through the {@link ApprovalHandler}
public sealed interface PolicyOutcome {

    /// Proceed.
    ///
    /// @param modifiedArguments replacement arguments, or null to keep the originals
    record Allow(Map<String, Object> modifiedArguments) implements PolicyOutcome {}

    /// Refuse the call.
    ///
    /// @param reason shown to the reasoning engine, not null
    record Block(String reason) implements PolicyOutcome {}

    /// Silently skip the call.
    ///
    /// @param reason shown to the reasoning engine, not null
    record Skip(String reason) implements PolicyOutcome {}

    /// Require human approval.
    ///
    /// @param reason shown to the approver, not null
    record Escalate(String reason) implements PolicyOutcome {}

    static PolicyOutcome allow() {
        return new Allow(null);
    }

    static PolicyOutcome allowWith(Map<String, Object> arguments) {
        return new Allow(Collections.unmodifiableMap(new LinkedHashMap<>(arguments)));
    }

    static PolicyOutcome block(String reason) {
        return new Block(reason);
    }

    static PolicyOutcome skip(String reason) {
        return new Skip(reason);
    }

    static PolicyOutcome escalate(String reason) {
        return new Escalate(reason);
    }
}
