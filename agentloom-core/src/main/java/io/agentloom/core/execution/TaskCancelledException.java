package io.agentloom.core.execution;

import java.io.Serial;

/// Signals that a task or a single call was cancelled.
///
/// Cancellation is a distinguished failure kind: policy hooks, retry loops and
/// circuit breakers let it pass through unchanged.
public class TaskCancelledException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3021883754469230716L;

    public TaskCancelledException(String reason) {
        super(reason);
    }

    public TaskCancelledException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
