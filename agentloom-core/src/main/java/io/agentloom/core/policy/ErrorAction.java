package io.agentloom.core.policy;

/// Decision of an on-exception policy hook.
public enum ErrorAction {
    /// Invoke again after a backoff, up to the configured retry budget.
    RETRY,
    /// Report a neutral "skipped" result.
    SKIP,
    /// Rethrow; the agent ends in error.
    ABORT,
    /// Report an error result asking for human assistance.
    ESCALATE,
    /// Report the exception as an error result.
    CONTINUE
}
