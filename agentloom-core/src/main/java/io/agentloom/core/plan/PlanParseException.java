package io.agentloom.core.plan;

import java.io.Serial;

/// Thrown when a final plan document is structurally invalid.
///
/// Partial (non-final) parses never throw this exception; they return the best
/// plan that can be recovered, or null.
public class PlanParseException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2214573318240871523L;

    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
