package io.agentloom.core.policy;

import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.reasoning.ToolCallRequest;
import io.agentloom.core.runtime.AgentContext;
import java.util.Map;

/// Interception point around capability invocation.
///
/// All methods have neutral defaults, so a hook implements only the stages it
/// cares about. Hooks run in registration order.
///
/// ### Stages
/// 1. {@link #beforeInvocation} - may block, skip, escalate or rewrite the arguments
/// 2. {@link #onException} - chooses how a thrown failure is handled
/// 3. {@link #afterInvocation} - observes successful results
/// 4. {@link #onRecord} - observes the record of every attempt, whatever its outcome
///
/// ### Contracts
/// - **Invariant**: a hook that throws is logged and treated as having no opinion
///
/// @see PolicyPipeline
public interface PolicyHook {

    /// Decides whether the call may proceed.
    ///
    /// @param call the call, not null
    /// @param arguments current arguments, possibly rewritten by an earlier hook, not null
    /// @param context invoking agent, not null
    /// @return outcome, or null for no opinion
    default PolicyOutcome beforeInvocation(
            ToolCallRequest call, Map<String, Object> arguments, AgentContext context) {
        return null;
    }

    /// Chooses how a failed attempt is handled.
    ///
    /// @param call the call, not null
    /// @param error the failure, not null
    /// @param attempt zero-based attempt number
    /// @param context invoking agent, not null
    /// @return action, or null for no opinion
    default ErrorAction onException(
            ToolCallRequest call, Throwable error, int attempt, AgentContext context) {
        return null;
    }

    /// Observes a successful result.
    ///
    /// @param call the call, not null
    /// @param arguments arguments the capability ran with, not null
    /// @param result the result, not null
    /// @param context invoking agent, not null
    default void afterInvocation(
            ToolCallRequest call,
            Map<String, Object> arguments,
            CapabilityResult result,
            AgentContext context) {}

    /// Observes a finished attempt, including blocked, skipped and failed ones.
    ///
    /// @param record the completed record, not null
    /// @param context invoking agent, not null
    default void onRecord(CapabilityInvocationRecord record, AgentContext context) {}
}
