package io.agentloom.core.reasoning;

import io.agentloom.core.capability.CapabilityDescriptor;
import java.util.List;
import java.util.Objects;

/// One "generate next step" request.
///
/// @param agentId requesting agent, not null
/// @param messages transcript snapshot, not null
/// @param capabilities offered capabilities, not null
/// @param toolChoice call policy, not null
public record ReasoningRequest(
        String agentId,
        List<Message> messages,
        List<CapabilityDescriptor> capabilities,
        ToolChoice toolChoice) {

    public ReasoningRequest {
        Objects.requireNonNull(agentId, "agentId must not be null");
        messages = List.copyOf(messages);
        capabilities = List.copyOf(capabilities);
        toolChoice = toolChoice != null ? toolChoice : ToolChoice.AUTO;
    }
}
