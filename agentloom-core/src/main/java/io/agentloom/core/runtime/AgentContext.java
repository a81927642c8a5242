package io.agentloom.core.runtime;

import io.agentloom.core.capability.CapabilityTable;
import io.agentloom.core.event.LifecycleEvent;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.plan.PlanAgent;
import io.agentloom.core.policy.CapabilityInvocationRecord;
import io.agentloom.core.reasoning.Transcript;
import io.agentloom.core.reasoning.Usage;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/// State of one running agent.
///
/// Lives from the agent's start until it reaches a terminal state. Holds the
/// transcript, a private variable store, the invocation history and the circuit
/// breaker counter; the task-wide state is reachable through {@link #task()}.
///
/// @implNote The transcript and capability table are confined to the agent's loop
/// thread. Variables, invocation records and the failure counter are also touched by
/// concurrently dispatched capabilities and are thread-safe.
public final class AgentContext {

    private final TaskContext task;
    private final PlanAgent agent;
    private final Transcript transcript = new Transcript();
    private final Map<String, Object> variables = new ConcurrentHashMap<>();
    private final List<CapabilityInvocationRecord> invocations = new CopyOnWriteArrayList<>();
    private final Set<String> usedCapabilities = ConcurrentHashMap.newKeySet();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Usage> usage = new AtomicReference<>(Usage.EMPTY);
    private final Map<String, CancellationToken> activeCalls = new ConcurrentHashMap<>();
    private CapabilityTable capabilities = new CapabilityTable();

    public AgentContext(TaskContext task, PlanAgent agent) {
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
    }

    public TaskContext task() {
        return task;
    }

    public PlanAgent agent() {
        return agent;
    }

    public String agentId() {
        return agent.getId();
    }

    public Transcript transcript() {
        return transcript;
    }

    /// Returns the agent-private variable store.
    ///
    /// @return live, thread-safe map, never null
    public Map<String, Object> variables() {
        return variables;
    }

    public CapabilityTable capabilities() {
        return capabilities;
    }

    public void setCapabilities(CapabilityTable capabilities) {
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
    }

    /// Appends a completed invocation record and remembers the capability as used.
    ///
    /// @param record completed record, not null
    public void addInvocation(CapabilityInvocationRecord record) {
        invocations.add(record);
        usedCapabilities.add(record.name());
    }

    /// Returns the invocation history, retries included.
    ///
    /// @return records in completion order, never null
    public List<CapabilityInvocationRecord> invocations() {
        return List.copyOf(invocations);
    }

    /// Returns the names of capabilities invoked so far.
    ///
    /// @return capability names, never null
    public Set<String> usedCapabilities() {
        return Set.copyOf(usedCapabilities);
    }

    /// Resets the circuit breaker after a successful invocation.
    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    /// Counts a failed invocation.
    ///
    /// @return consecutive failures including this one
    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    /// Opens the per-call cancellation token of a capability call.
    ///
    /// The token observes the task token. Close it when the call finishes.
    ///
    /// @param callId engine call id, not null
    /// @return child token, never null
    public CancellationToken openCall(String callId) {
        CancellationToken token = task.cancellation().child();
        activeCalls.put(callId, token);
        return token;
    }

    /// Releases the token returned by {@link #openCall(String)}.
    ///
    /// @param callId engine call id, not null
    public void closeCall(String callId) {
        CancellationToken token = activeCalls.remove(callId);
        if (token != null) {
            token.close();
        }
    }

    /// Cancels one running capability call without cancelling the task.
    ///
    /// @param callId engine call id, not null
    /// @param reason human readable reason, may be null
    /// @return `true` if a running call was cancelled
    public boolean cancelCall(String callId, String reason) {
        CancellationToken token = activeCalls.get(callId);
        return token != null && token.cancel(reason);
    }

    public void addUsage(Usage more) {
        usage.accumulateAndGet(more, Usage::plus);
    }

    public Usage usage() {
        return usage.get();
    }

    /// Emits an event through the task's listeners.
    ///
    /// @param event event to deliver, not null
    public void emit(LifecycleEvent event) {
        task.emit(event);
    }
}
