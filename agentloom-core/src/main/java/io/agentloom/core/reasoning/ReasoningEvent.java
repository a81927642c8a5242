package io.agentloom.core.reasoning;

import java.util.Objects;

/// Streamed output of a reasoning engine, in emission order.
///
/// ### Event Flow
/// ```
/// (TextDelta | ThinkingDelta | ToolInputStart → ToolInputDelta* → ToolCall)* → Finish
///                               ↓
///                          StreamError (any time)
/// ```
///
/// @see ReasoningEngine
public sealed interface ReasoningEvent {

    /// Partial text.
    ///
    /// @param text the delta, not null
    record TextDelta(String text) implements ReasoningEvent {
        public TextDelta {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// End of the current text block.
    record TextEnd() implements ReasoningEvent {}

    /// Partial model reasoning, not part of the answer.
    ///
    /// @param text the delta, not null
    record ThinkingDelta(String text) implements ReasoningEvent {
        public ThinkingDelta {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// Start of a streamed capability call.
    ///
    /// @param callId call id, not null
    /// @param name capability name, not null
    record ToolInputStart(String callId, String name) implements ReasoningEvent {
        public ToolInputStart {
            Objects.requireNonNull(callId, "callId must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// Partial arguments of a streamed capability call.
    ///
    /// @param callId call id, not null
    /// @param delta argument text fragment, not null
    record ToolInputDelta(String callId, String delta) implements ReasoningEvent {
        public ToolInputDelta {
            Objects.requireNonNull(callId, "callId must not be null");
            Objects.requireNonNull(delta, "delta must not be null");
        }
    }

    /// Finalized capability call.
    ///
    /// @param callId call id, not null
    /// @param name capability name, not null
    /// @param arguments JSON arguments object, not null
    record ToolCall(String callId, String name, String arguments) implements ReasoningEvent {
        public ToolCall {
            Objects.requireNonNull(callId, "callId must not be null");
            Objects.requireNonNull(name, "name must not be null");
            arguments = arguments == null || arguments.isBlank() ? "{}" : arguments;
        }
    }

    /// Error reported inside the stream.
    ///
    /// @param error the failure, not null
    record StreamError(Throwable error) implements ReasoningEvent {
        public StreamError {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    /// End of the response.
    ///
    /// @param reason finish reason, not null
    /// @param usage token usage, not null
    record Finish(FinishReason reason, Usage usage) implements ReasoningEvent {
        public Finish {
            Objects.requireNonNull(reason, "reason must not be null");
            usage = usage != null ? usage : Usage.EMPTY;
        }
    }
}
