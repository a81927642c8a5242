package io.agentloom.core.capability;

import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.reasoning.Message;
import io.agentloom.core.runtime.AgentContext;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/// What a capability sees of its caller during one invocation.
///
/// Besides the agent state and the per-call cancellation token, a capability may
/// attach side-channel messages (for example a screenshot rendered as a user message)
/// that are appended to the transcript after the call's result.
public final class InvocationContext {

    private final AgentContext agentContext;
    private final String callId;
    private final CancellationToken cancellation;
    private final List<Message> sideChannel = new CopyOnWriteArrayList<>();

    /// @param agentContext state of the invoking agent, not null
    /// @param callId id of the reasoning engine's call, not null
    /// @param cancellation per-call token, cancelled with the task or on its own, not null
    public InvocationContext(
            AgentContext agentContext, String callId, CancellationToken cancellation) {
        this.agentContext = Objects.requireNonNull(agentContext, "agentContext must not be null");
        this.callId = Objects.requireNonNull(callId, "callId must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    public AgentContext agentContext() {
        return agentContext;
    }

    public String callId() {
        return callId;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /// Attaches a message to be appended to the transcript after this call's result.
    ///
    /// @param message message to append, not null
    public void addSideChannelMessage(Message message) {
        sideChannel.add(Objects.requireNonNull(message, "message must not be null"));
    }

    public List<Message> sideChannel() {
        return List.copyOf(sideChannel);
    }
}
