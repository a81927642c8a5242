package io.agentloom.core.policy;

import io.agentloom.core.runtime.AgentContext;

/// Routes escalated calls to a human.
///
/// Blocks the calling agent until a decision is available. Siblings in the same
/// parallel stage keep running.
@FunctionalInterface
public interface ApprovalHandler {

    /// Requests a decision.
    ///
    /// @param request the escalated call, not null
    /// @param context the requesting agent, not null
    /// @return decision, never null
    ApprovalDecision requestApproval(ApprovalRequest request, AgentContext context);
}
