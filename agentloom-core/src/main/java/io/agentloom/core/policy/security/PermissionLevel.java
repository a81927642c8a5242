package io.agentloom.core.policy.security;

/// Access level granted by a permission rule, ordered from least to most restrictive.
public enum PermissionLevel {
    /// The call proceeds.
    ALLOW,
    /// The call waits for human approval.
    ASK,
    /// The call is refused.
    DENY
}
