package io.agentloom.core.reasoning;

import io.agentloom.core.capability.CapabilityResult;
import java.util.List;
import java.util.Objects;

/// One entry of an agent's transcript.
///
/// ### Variants
/// - {@link SystemMessage} - standing instructions
/// - {@link UserMessage} - task input or side-channel content
/// - {@link AssistantMessage} - engine output: text and/or capability calls
/// - {@link ToolResultMessage} - results answering the calls of the preceding assistant message
public sealed interface Message {

    /// Returns an approximate size in characters, used for token estimation.
    ///
    /// @return character count, never negative
    int length();

    /// Standing instructions.
    ///
    /// @param text instruction text, not null
    record SystemMessage(String text) implements Message {
        public SystemMessage {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public int length() {
            return text.length();
        }
    }

    /// Task input.
    ///
    /// @param text content, not null
    record UserMessage(String text) implements Message {
        public UserMessage {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public int length() {
            return text.length();
        }
    }

    /// Reasoning engine output.
    ///
    /// @param text text part, may be null when only calls were produced
    /// @param toolCalls capability calls in engine order, not null
    record AssistantMessage(String text, List<ToolCallRequest> toolCalls) implements Message {
        public AssistantMessage {
            toolCalls = List.copyOf(toolCalls);
        }

        public boolean hasToolCalls() {
            return !toolCalls.isEmpty();
        }

        @Override
        public int length() {
            int size = text != null ? text.length() : 0;
            for (ToolCallRequest call : toolCalls) {
                size += call.name().length() + call.rawArguments().length();
            }
            return size;
        }
    }

    /// Results answering capability calls, in call order.
    ///
    /// @param results one entry per call, not null
    record ToolResultMessage(List<ToolResult> results) implements Message {
        public ToolResultMessage {
            results = List.copyOf(results);
        }

        @Override
        public int length() {
            return results.stream().mapToInt(r -> r.result().text().length()).sum();
        }
    }

    /// Result of one call.
    ///
    /// @param callId id of the answered call, not null
    /// @param name capability name, not null
    /// @param result capability result, not null
    record ToolResult(String callId, String name, CapabilityResult result) {
        public ToolResult {
            Objects.requireNonNull(callId, "callId must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(result, "result must not be null");
        }
    }
}
