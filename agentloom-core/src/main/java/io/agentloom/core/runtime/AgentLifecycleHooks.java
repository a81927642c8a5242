package io.agentloom.core.runtime;

import io.agentloom.core.policy.ErrorAction;
import io.agentloom.core.policy.PolicyOutcome;

/// Host callbacks around each plan agent and the task as a whole.
///
/// All methods have no-op defaults; implement only what is needed. A hook that
/// throws is logged and treated as if it had returned its default.
///
/// ### Contracts
/// - `beforeAgentStart` returning {@link PolicyOutcome.Block} ends the agent in `error`
///   without running it
/// - `afterAgentComplete` returning `true` runs the agent again, at most
///   `maxAgentRetries` times
/// - `onAgentError` may answer {@link ErrorAction#RETRY} (bounded by `maxAgentRetries`),
///   {@link ErrorAction#SKIP} (agent ends `done` with a synthetic result) or anything
///   else, which fails the agent
/// - `onTaskComplete` sees every task outcome, including parallel-stage failures
public interface AgentLifecycleHooks {

    AgentLifecycleHooks NONE = new AgentLifecycleHooks() {};

    /// Called before an agent's first reasoning request.
    ///
    /// @param context fresh agent context, not null
    /// @return null or {@link PolicyOutcome.Allow} to proceed, {@link PolicyOutcome.Block} to refuse
    default PolicyOutcome beforeAgentStart(AgentContext context) {
        return null;
    }

    /// Called after an agent produced its result.
    ///
    /// @param context agent context, not null
    /// @param result agent result, not null
    /// @return `true` to run the agent again
    default boolean afterAgentComplete(AgentContext context, String result) {
        return false;
    }

    /// Called when an agent failed.
    ///
    /// @param context agent context, not null
    /// @param error failure, not null
    /// @param attempt zero-based attempt that failed
    /// @return recovery action, null to fail the agent
    default ErrorAction onAgentError(AgentContext context, Throwable error, int attempt) {
        return null;
    }

    /// Called once the task ended, whatever the outcome.
    ///
    /// @param task task context, not null
    /// @param result task outcome, not null
    default void onTaskComplete(TaskContext task, TaskResult result) {}
}
