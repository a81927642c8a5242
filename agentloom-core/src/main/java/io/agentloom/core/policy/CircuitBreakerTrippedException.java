package io.agentloom.core.policy;

import java.io.Serial;

/// Thrown when an agent accumulates too many consecutive invocation failures.
///
/// The last failure is preserved as the cause.
public class CircuitBreakerTrippedException extends RuntimeException {

    @Serial private static final long serialVersionUID = 1937225081651309972L;

    private final int failures;

    public CircuitBreakerTrippedException(String agentId, int failures, Throwable cause) {
        super(
                "Agent " + agentId + " stopped after " + failures
                        + " consecutive capability failures: " + cause.getMessage(),
                cause);
        this.failures = failures;
    }

    public int getFailures() {
        return failures;
    }
}
