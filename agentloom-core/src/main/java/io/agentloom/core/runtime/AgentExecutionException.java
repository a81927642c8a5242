package io.agentloom.core.runtime;

import java.io.Serial;

/// Signals that a plan agent ended in the `error` state.
///
/// The triggering failure is preserved as the cause.
public class AgentExecutionException extends RuntimeException {

    @Serial private static final long serialVersionUID = -5840127736129014533L;

    private final String agentId;

    public AgentExecutionException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }

    public AgentExecutionException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    /// Creates an exception for a plan agent naming an unregistered provider.
    ///
    /// @param agentId failing agent, not null
    /// @param name unknown provider name
    /// @return new exception, never null
    public static AgentExecutionException unknownAgent(String agentId, String name) {
        return new AgentExecutionException(agentId, "Agent not found: " + name);
    }

    /// Creates an exception for an agent refused by a start hook.
    ///
    /// @param agentId refused agent, not null
    /// @param reason refusal reason, may be null
    /// @return new exception, never null
    public static AgentExecutionException blocked(String agentId, String reason) {
        return new AgentExecutionException(
                agentId, reason != null ? reason : "Agent blocked by start hook");
    }

    public String getAgentId() {
        return agentId;
    }
}
