package io.agentloom.core.policy.security;

import io.agentloom.core.policy.CapabilityInvocationRecord;
import io.agentloom.core.policy.CapabilityInvocationRecord.StageOutcome;
import io.agentloom.core.policy.InvocationStage;
import java.time.Instant;
import java.util.List;

/// One audit log entry: a single invocation attempt with the task and agent it ran for.
///
/// @param id unique entry id, not null
/// @param taskId owning task, not null
/// @param agentId invoking plan agent id, not null
/// @param agentName invoking agent name, not null
/// @param capability capability name, not null
/// @param callId engine call id, not null
/// @param attempt zero-based attempt number
/// @param outcome classified outcome, not null
/// @param approval outcome of the approval stage, or null when no approval was requested
/// @param error failure message, or null
/// @param stages stage outcomes in order, not null
/// @param durationMillis attempt duration
/// @param loggedAt when the entry was written, not null
public record AuditEntry(
        String id,
        String taskId,
        String agentId,
        String agentName,
        String capability,
        String callId,
        int attempt,
        AuditOutcome outcome,
        String approval,
        String error,
        List<StageOutcome> stages,
        long durationMillis,
        Instant loggedAt) {

    public AuditEntry {
        stages = List.copyOf(stages);
    }

    public boolean approvalRequested() {
        return approval != null;
    }

    public boolean approved() {
        return "approved".equals(approval);
    }

    /// Classifies a completed record.
    ///
    /// @param record the record, not null
    /// @return outcome, never null
    public static AuditOutcome classify(CapabilityInvocationRecord record) {
        if (has(record, InvocationStage.PRE_INVOCATION, "block")) {
            return AuditOutcome.BLOCKED;
        }
        if (has(record, InvocationStage.PRE_INVOCATION, "skip")) {
            return AuditOutcome.SKIPPED;
        }
        String approval = lastOutcome(record, InvocationStage.APPROVAL);
        if (has(record, InvocationStage.PRE_INVOCATION, "escalate") && !"approved".equals(approval)) {
            return AuditOutcome.ESCALATED;
        }
        return "success".equals(record.outcomeOf(InvocationStage.INVOCATION))
                ? AuditOutcome.SUCCEEDED
                : AuditOutcome.FAILED;
    }

    static String lastOutcome(CapabilityInvocationRecord record, InvocationStage stage) {
        String last = null;
        for (StageOutcome outcome : record.stages()) {
            if (outcome.stage() == stage) {
                last = outcome.outcome();
            }
        }
        return last;
    }

    private static boolean has(CapabilityInvocationRecord record, InvocationStage stage, String outcome) {
        return record.stages().stream()
                .anyMatch(s -> s.stage() == stage && s.outcome().equals(outcome));
    }
}
