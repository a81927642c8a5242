package io.agentloom.core.reasoning;

import java.util.List;

/// Demultiplexed result of one reasoning request.
///
/// @param text accumulated answer text, may be null
/// @param toolCalls finalized calls in engine order, not null
/// @param finishReason how the response ended, not null
/// @param usage token usage, not null
public record StepOutput(
        String text, List<ToolCallRequest> toolCalls, FinishReason finishReason, Usage usage) {

    public StepOutput {
        toolCalls = List.copyOf(toolCalls);
    }

    /// Returns whether this output is a final answer: text without any calls.
    ///
    /// @return `true` if the agent may stop
    public boolean isFinalText() {
        return toolCalls.isEmpty() && text != null && !text.isBlank();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    /// Converts the output into the transcript entry recording it.
    ///
    /// @return assistant message, never null
    public Message.AssistantMessage toMessage() {
        return new Message.AssistantMessage(text, toolCalls);
    }
}
