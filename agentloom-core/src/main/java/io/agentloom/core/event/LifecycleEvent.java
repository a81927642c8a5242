package io.agentloom.core.event;

import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.plan.AgentStatus;
import io.agentloom.core.reasoning.FinishReason;
import io.agentloom.core.reasoning.Usage;
import java.time.Instant;
import java.util.Map;

/// Events emitted while a task runs, for progress display and audit.
///
/// Per agent the events are ordered. Text, thinking and tool-call events share a
/// stream id: a later event with `done == true` (or a {@link ToolUse}) supersedes the
/// partial events carrying the same id.
///
/// ### Event Flow
/// ```
/// AgentStarted → (Text* | Thinking* | ToolStreaming* → ToolUse → ToolResult)* → Finish
///      ... → AgentFinished
///                     ↓
///              Failure (any time)
/// ```
///
/// @see LifecycleListener for event consumers
public sealed interface LifecycleEvent {

    /// Returns the task the event belongs to.
    ///
    /// @return task id, never null
    String taskId();

    /// Returns the agent the event belongs to.
    ///
    /// @return agent id, never null
    String agentId();

    /// Returns when the event occurred.
    ///
    /// @return event timestamp, never null
    Instant timestamp();

    /// Emitted when an agent starts running.
    record AgentStarted(String taskId, String agentId, String agentName, Instant timestamp)
            implements LifecycleEvent {

        public static AgentStarted now(String taskId, String agentId, String agentName) {
            return new AgentStarted(taskId, agentId, agentName, Instant.now());
        }
    }

    /// Accumulated answer text; `done` marks the final version of the stream.
    record Text(
            String taskId, String agentId, String streamId, String text, boolean done,
            Instant timestamp)
            implements LifecycleEvent {

        public static Text now(
                String taskId, String agentId, String streamId, String text, boolean done) {
            return new Text(taskId, agentId, streamId, text, done, Instant.now());
        }
    }

    /// Accumulated model reasoning; `done` marks the final version of the stream.
    record Thinking(
            String taskId, String agentId, String streamId, String text, boolean done,
            Instant timestamp)
            implements LifecycleEvent {

        public static Thinking now(
                String taskId, String agentId, String streamId, String text, boolean done) {
            return new Thinking(taskId, agentId, streamId, text, done, Instant.now());
        }
    }

    /// Partial arguments of a call still being generated.
    record ToolStreaming(
            String taskId, String agentId, String callId, String toolName, String partialArguments,
            Instant timestamp)
            implements LifecycleEvent {

        public static ToolStreaming now(
                String taskId, String agentId, String callId, String toolName, String partial) {
            return new ToolStreaming(taskId, agentId, callId, toolName, partial, Instant.now());
        }
    }

    /// Finalized call about to be dispatched.
    record ToolUse(
            String taskId, String agentId, String callId, String toolName,
            Map<String, Object> arguments, Instant timestamp)
            implements LifecycleEvent {

        public static ToolUse now(
                String taskId, String agentId, String callId, String toolName,
                Map<String, Object> arguments) {
            return new ToolUse(taskId, agentId, callId, toolName, arguments, Instant.now());
        }
    }

    /// Result of a dispatched call.
    record ToolResult(
            String taskId, String agentId, String callId, String toolName,
            Map<String, Object> arguments, CapabilityResult result, Instant timestamp)
            implements LifecycleEvent {

        public static ToolResult now(
                String taskId, String agentId, String callId, String toolName,
                Map<String, Object> arguments, CapabilityResult result) {
            return new ToolResult(
                    taskId, agentId, callId, toolName, arguments, result, Instant.now());
        }
    }

    /// Failure reported by the reasoning engine or the runtime.
    record Failure(String taskId, String agentId, Throwable error, Instant timestamp)
            implements LifecycleEvent {

        public static Failure now(String taskId, String agentId, Throwable error) {
            return new Failure(taskId, agentId, error, Instant.now());
        }
    }

    /// End of one reasoning response.
    record Finish(
            String taskId, String agentId, FinishReason reason, Usage usage, Instant timestamp)
            implements LifecycleEvent {

        public static Finish now(String taskId, String agentId, FinishReason reason, Usage usage) {
            return new Finish(taskId, agentId, reason, usage, Instant.now());
        }
    }

    /// Emitted when an agent reaches a terminal state.
    record AgentFinished(
            String taskId, String agentId, AgentStatus status, String result, Throwable error,
            Instant timestamp)
            implements LifecycleEvent {

        public static AgentFinished now(
                String taskId, String agentId, AgentStatus status, String result,
                Throwable error) {
            return new AgentFinished(taskId, agentId, status, result, error, Instant.now());
        }
    }
}
