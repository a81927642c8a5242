package io.agentloom.core.reasoning;

/// Why the reasoning engine stopped producing output.
public enum FinishReason {
    STOP,
    LENGTH,
    TOOL_CALLS,
    CONTENT_FILTER,
    OTHER;

    /// Returns whether the response must not be used and must not be retried.
    ///
    /// @return `true` for `CONTENT_FILTER` and `OTHER`
    public boolean isFatal() {
        return this == CONTENT_FILTER || this == OTHER;
    }
}
