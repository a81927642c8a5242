package io.agentloom.core.runtime;

import java.util.Objects;

/// Outcome of running a whole plan.
///
/// @param taskId task identifier, not null
/// @param success whether every stage completed
/// @param stopReason why execution ended, not null
/// @param result result of the last stage, never null (empty on failure)
/// @param error failure that ended the task, null on success
public record TaskResult(
        String taskId, boolean success, StopReason stopReason, String result, Throwable error) {

    public TaskResult {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(stopReason, "stopReason must not be null");
        result = result != null ? result : "";
    }

    public static TaskResult done(String taskId, String result) {
        return new TaskResult(taskId, true, StopReason.DONE, result, null);
    }

    public static TaskResult failed(String taskId, Throwable error) {
        return new TaskResult(taskId, false, StopReason.ERROR, "", error);
    }

    public static TaskResult aborted(String taskId, Throwable error) {
        return new TaskResult(taskId, false, StopReason.ABORT, "", error);
    }

    /// Why a task stopped.
    public enum StopReason {
        DONE,
        ERROR,
        ABORT
    }
}
