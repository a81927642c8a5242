package io.agentloom.core.policy;

import java.util.Map;

/// Escalated capability call awaiting a human decision.
///
/// @param taskId owning task
/// @param agentId requesting agent
/// @param capabilityName capability to be invoked
/// @param arguments proposed arguments
/// @param reason why approval is required
public record ApprovalRequest(
        String taskId,
        String agentId,
        String capabilityName,
        Map<String, Object> arguments,
        String reason) {

    /// Returns the question shown to the approver.
    ///
    /// @return description, never null
    public String description() {
        return "Approve execution of capability \"" + capabilityName + "\"?";
    }
}
