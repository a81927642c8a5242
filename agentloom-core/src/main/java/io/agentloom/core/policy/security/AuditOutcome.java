package io.agentloom.core.policy.security;

/// Classification of an audited invocation attempt.
public enum AuditOutcome {
    SUCCEEDED,
    BLOCKED,
    SKIPPED,
    /// Escalated and not approved.
    ESCALATED,
    FAILED
}
