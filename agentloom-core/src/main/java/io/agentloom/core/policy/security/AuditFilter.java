package io.agentloom.core.policy.security;

import java.time.Instant;

/// Criteria for {@link AuditLogHook#query}. Null criteria match everything.
///
/// @param taskId required task id, or null
/// @param capability required capability name, or null
/// @param agentName required agent name, or null
/// @param outcome required outcome, or null
/// @param from earliest `loggedAt`, inclusive, or null
/// @param to latest `loggedAt`, inclusive, or null
/// @param limit maximum number of returned entries, positive
public record AuditFilter(
        String taskId,
        String capability,
        String agentName,
        AuditOutcome outcome,
        Instant from,
        Instant to,
        int limit) {

    /// Default result limit.
    public static final int DEFAULT_LIMIT = 100;

    public AuditFilter {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }

    public static AuditFilter any() {
        return new AuditFilter(null, null, null, null, null, null, DEFAULT_LIMIT);
    }

    public AuditFilter forTask(String taskId) {
        return new AuditFilter(taskId, capability, agentName, outcome, from, to, limit);
    }

    public AuditFilter forCapability(String capability) {
        return new AuditFilter(taskId, capability, agentName, outcome, from, to, limit);
    }

    public AuditFilter forAgent(String agentName) {
        return new AuditFilter(taskId, capability, agentName, outcome, from, to, limit);
    }

    public AuditFilter withOutcome(AuditOutcome outcome) {
        return new AuditFilter(taskId, capability, agentName, outcome, from, to, limit);
    }

    public AuditFilter between(Instant from, Instant to) {
        return new AuditFilter(taskId, capability, agentName, outcome, from, to, limit);
    }

    public AuditFilter limit(int limit) {
        return new AuditFilter(taskId, capability, agentName, outcome, from, to, limit);
    }

    boolean matches(AuditEntry entry) {
        return (taskId == null || taskId.equals(entry.taskId()))
                && (capability == null || capability.equals(entry.capability()))
                && (agentName == null || agentName.equals(entry.agentName()))
                && (outcome == null || outcome == entry.outcome())
                && (from == null || !entry.loggedAt().isBefore(from))
                && (to == null || !entry.loggedAt().isAfter(to));
    }
}
