package io.agentloom.core.policy;

/// Answer to an {@link ApprovalRequest}.
///
/// @param approved whether the call may proceed
/// @param feedback message forwarded to the reasoning engine on denial, may be null
/// @param approver who decided, may be null
public record ApprovalDecision(boolean approved, String feedback, String approver) {

    public static ApprovalDecision approve(String approver) {
        return new ApprovalDecision(true, null, approver);
    }

    public static ApprovalDecision deny(String feedback) {
        return new ApprovalDecision(false, feedback, null);
    }
}
