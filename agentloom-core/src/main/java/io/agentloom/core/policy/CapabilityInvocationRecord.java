package io.agentloom.core.policy;

import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.reasoning.Message;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Audit record of one invocation attempt.
///
/// Every stage of the policy pipeline leaves a {@link StageOutcome}. A retry is a new
/// record with an incremented attempt number.
///
/// @param callId engine call id, not null
/// @param name capability name, not null
/// @param arguments arguments after policy rewriting, not null
/// @param attempt zero-based attempt number
/// @param result result shown to the reasoning engine, may be null when the attempt threw
/// @param error failure of the attempt, may be null
/// @param stages stage outcomes in order, not null
/// @param sideChannel extra transcript messages produced by the capability, not null
/// @param startedAt when the attempt began, not null
/// @param completedAt when the attempt ended, not null
public record CapabilityInvocationRecord(
        String callId,
        String name,
        Map<String, Object> arguments,
        int attempt,
        CapabilityResult result,
        Throwable error,
        List<StageOutcome> stages,
        List<Message> sideChannel,
        Instant startedAt,
        Instant completedAt) {

    public CapabilityInvocationRecord {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        stages = List.copyOf(stages);
        sideChannel = List.copyOf(sideChannel);
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    /// Returns whether the capability itself ran during this attempt.
    ///
    /// @return `true` if an {@link InvocationStage#INVOCATION} outcome is present
    public boolean invoked() {
        return stages.stream().anyMatch(s -> s.stage() == InvocationStage.INVOCATION);
    }

    /// Finds the outcome of a stage.
    ///
    /// @param stage stage to look up, not null
    /// @return outcome label, or null if the stage did not run
    public String outcomeOf(InvocationStage stage) {
        for (StageOutcome outcome : stages) {
            if (outcome.stage() == stage) {
                return outcome.outcome();
            }
        }
        return null;
    }

    /// Outcome of one pipeline stage.
    ///
    /// @param stage the stage, not null
    /// @param outcome short label such as `allow`, `block`, `success`, `retry`, not null
    /// @param detail reason or message, may be null
    public record StageOutcome(InvocationStage stage, String outcome, String detail) {}

    /// Mutable builder filled while an attempt passes the pipeline.
    static final class Builder {
        private final String callId;
        private final String name;
        private final int attempt;
        private final Instant startedAt = Instant.now();
        private final List<StageOutcome> stages = new ArrayList<>();
        private final List<Message> sideChannel = new ArrayList<>();
        private Map<String, Object> arguments;
        private CapabilityResult result;
        private Throwable error;

        Builder(String callId, String name, Map<String, Object> arguments, int attempt) {
            this.callId = callId;
            this.name = name;
            this.arguments = arguments;
            this.attempt = attempt;
        }

        Builder stage(InvocationStage stage, String outcome, String detail) {
            stages.add(new StageOutcome(stage, outcome, detail));
            return this;
        }

        Builder arguments(Map<String, Object> arguments) {
            this.arguments = arguments;
            return this;
        }

        Builder result(CapabilityResult result) {
            this.result = result;
            return this;
        }

        Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        Builder sideChannel(List<Message> messages) {
            sideChannel.addAll(messages);
            return this;
        }

        Map<String, Object> arguments() {
            return arguments;
        }

        CapabilityInvocationRecord build() {
            return new CapabilityInvocationRecord(
                    callId, name, arguments, attempt, result, error, stages, sideChannel,
                    startedAt, Instant.now());
        }
    }
}
