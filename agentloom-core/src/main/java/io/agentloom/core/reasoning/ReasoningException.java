package io.agentloom.core.reasoning;

import java.io.Serial;

/// Failure of the reasoning engine.
///
/// Transient failures are retried by the {@link ReasoningGateway}; fatal ones (a
/// content-filter or unexplained finish) abort the agent immediately.
public class ReasoningException extends RuntimeException {

    @Serial private static final long serialVersionUID = -4467130839905121387L;

    private final boolean fatal;

    public ReasoningException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public ReasoningException(String message, Throwable cause, boolean fatal) {
        super(message, cause);
        this.fatal = fatal;
    }

    /// Returns whether the failure must not be retried.
    ///
    /// @return `true` for fatal failures
    public boolean isFatal() {
        return fatal;
    }

    /// @param reason finish reason reported by the engine
    /// @return fatal exception for an unusable finish
    public static ReasoningException unusableFinish(FinishReason reason) {
        return new ReasoningException("Reasoning engine finished with " + reason, true);
    }

    /// @param cause error carried in the response stream
    /// @return transient exception for a stream error
    public static ReasoningException streamError(Throwable cause) {
        return new ReasoningException("Reasoning engine error: " + cause.getMessage(), cause, false);
    }
}
