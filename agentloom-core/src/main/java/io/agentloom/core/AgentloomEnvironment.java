package io.agentloom.core;

import io.agentloom.core.plan.Plan;
import io.agentloom.core.plan.markup.PlanMarkupCodec;
import io.agentloom.core.runtime.AgentRegistry;
import io.agentloom.core.runtime.PlanExecutor;
import io.agentloom.core.runtime.TaskContext;
import io.agentloom.core.runtime.TaskResult;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/// Wired set of runtime components, created by {@link AgentloomFactory}.
///
/// Keeps the tasks currently running so that they can be looked up for cancellation
/// or pausing from another thread.
///
/// ### Contracts
/// - **Invariant**: component references are fixed at construction time
/// - **Postcondition**: {@link #close()} shuts down both thread pools
///
/// @implNote Thread-safe. Several tasks may run at once, each on its caller's thread.
///
/// @see AgentloomFactory#builder()
public final class AgentloomEnvironment implements AutoCloseable {

    private final PlanExecutor planExecutor;
    private final PlanMarkupCodec codec;
    private final AgentRegistry agentRegistry;
    private final ExecutorService agentPool;
    private final ExecutorService capabilityPool;
    private final Map<String, TaskContext> running = new ConcurrentHashMap<>();

    AgentloomEnvironment(
            PlanExecutor planExecutor,
            PlanMarkupCodec codec,
            AgentRegistry agentRegistry,
            ExecutorService agentPool,
            ExecutorService capabilityPool) {
        this.planExecutor = planExecutor;
        this.codec = codec;
        this.agentRegistry = agentRegistry;
        this.agentPool = agentPool;
        this.capabilityPool = capabilityPool;
    }

    /// Creates a task for a plan without starting it.
    ///
    /// Listeners can be attached to the returned context before {@link #execute(TaskContext)}.
    ///
    /// @param plan plan to run, not null
    /// @param mainTask overall goal the plan serves, not null
    /// @return new task context, never null
    public TaskContext newTask(Plan plan, String mainTask) {
        return TaskContext.forPlan(plan, mainTask);
    }

    /// Runs a task on the calling thread.
    ///
    /// @param task task created by {@link #newTask(Plan, String)}, not null
    /// @return task outcome, never null
    public TaskResult execute(TaskContext task) {
        running.put(task.getTaskId(), task);
        try {
            return planExecutor.execute(task);
        } finally {
            running.remove(task.getTaskId());
        }
    }

    /// Shortcut for `execute(newTask(plan, mainTask))`.
    ///
    /// @param plan plan to run, not null
    /// @param mainTask overall goal, not null
    /// @return task outcome, never null
    public TaskResult run(Plan plan, String mainTask) {
        return execute(newTask(plan, mainTask));
    }

    public Optional<TaskContext> findTask(String taskId) {
        return Optional.ofNullable(running.get(taskId));
    }

    /// Cancels a running task.
    ///
    /// @param taskId task to cancel, not null
    /// @param reason cancellation reason, may be null
    /// @return `true` if the task was running
    public boolean cancel(String taskId, String reason) {
        TaskContext task = running.get(taskId);
        if (task == null) {
            return false;
        }
        task.cancel(reason != null ? reason : "Cancelled");
        return true;
    }

    public PlanMarkupCodec getCodec() {
        return codec;
    }

    public AgentRegistry getAgentRegistry() {
        return agentRegistry;
    }

    public PlanExecutor getPlanExecutor() {
        return planExecutor;
    }

    /// Shuts down the thread pools.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not wait for running agents.
    @Override
    public void close() {
        agentPool.shutdown();
        capabilityPool.shutdown();
    }
}
