package io.agentloom.core.capability;

import java.util.Map;

/// A named, schema-described operation an agent can invoke.
///
/// Implementations are either local (built-in or supplied by the host
/// application) or remote, delegating to a {@link CapabilityClient}.
///
/// ### Contracts
/// - **Precondition**: `arguments` conform to the descriptor's input schema, as far as
///   the reasoning engine honours it
/// - **Postcondition**: provider-reported failures come back as an error-flagged result;
///   exceptions are reserved for failures to invoke at all
///
/// @see CapabilityTable for per-agent lookup
/// @see io.agentloom.core.policy.PolicyPipeline for the interception around each call
public interface Capability {

    /// Describes this capability to the reasoning engine.
    ///
    /// @return descriptor, never null
    CapabilityDescriptor describe();

    /// Executes the capability.
    ///
    /// @param arguments decoded arguments, not null
    /// @param context invoking agent and per-call cancellation, not null
    /// @return result, never null
    /// @throws Exception on any failure; routed to the policy pipeline's exception stage
    CapabilityResult invoke(Map<String, Object> arguments, InvocationContext context)
            throws Exception;

    /// Returns whether several calls of this capability may run at the same time.
    ///
    /// @return `true` to opt into concurrent dispatch; defaults to `false`
    default boolean supportsConcurrentCalls() {
        return false;
    }

    /// Shortcut for `describe().name()`.
    ///
    /// @return capability name, never null
    default String name() {
        return describe().name();
    }
}
