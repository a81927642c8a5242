package io.agentloom.core.policy;

/// Stages of the policy pipeline recorded on each invocation.
public enum InvocationStage {
    PRE_INVOCATION,
    APPROVAL,
    INVOCATION,
    ON_EXCEPTION,
    POST_INVOCATION
}
