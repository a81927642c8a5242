package io.agentloom.core.runtime;

import io.agentloom.core.event.LifecycleEvent;
import io.agentloom.core.event.LifecycleListener;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.plan.Plan;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// State shared by every agent of one task.
///
/// ### Shared resources
/// - **Variables**: task-wide store, last write wins; see {@link #variables()}
/// - **Cancellation**: one token for the whole task; calls use child tokens
/// - **Pause**: agents wait at loop boundaries while the task is paused
/// - **Listeners**: lifecycle events of all agents
///
/// @implNote Thread-safe. Agents of a parallel stage use the same instance
/// concurrently.
public final class TaskContext {

    private static final Logger logger = Logger.getLogger(TaskContext.class.getName());

    /// Variable checked at loop boundaries; `true` ends the agent loop early.
    public static final String FORCE_STOP_VARIABLE = "forceStop";

    private final String taskId;
    private final Plan plan;
    private final String mainTask;
    private final Map<String, Object> variables = new ConcurrentHashMap<>();
    private final CancellationToken cancellation = CancellationToken.create();
    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock pauseLock = new ReentrantLock();
    private final Condition resumed = pauseLock.newCondition();
    private volatile boolean paused;

    /// Creates a task context.
    ///
    /// @param taskId task id, not null
    /// @param plan plan being executed, not null
    /// @param mainTask overall task description shown to every agent, not null
    public TaskContext(String taskId, Plan plan, String mainTask) {
        this.taskId = Objects.requireNonNull(taskId, "taskId must not be null");
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.mainTask = Objects.requireNonNull(mainTask, "mainTask must not be null");
        cancellation.onCancel(this::wakeUp);
    }

    /// Creates a context for a plan, using the plan id as task id.
    ///
    /// @param plan plan being executed, not null
    /// @param mainTask overall task description, not null
    /// @return new context, never null
    public static TaskContext forPlan(Plan plan, String mainTask) {
        return new TaskContext(plan.getId(), plan, mainTask);
    }

    public String getTaskId() {
        return taskId;
    }

    public Plan getPlan() {
        return plan;
    }

    public String getMainTask() {
        return mainTask;
    }

    /// Returns the task-wide variable store.
    ///
    /// No transactional semantics: concurrent writers race and the last write wins.
    /// Null values are not supported.
    ///
    /// @return live, thread-safe map, never null
    public Map<String, Object> variables() {
        return variables;
    }

    /// Returns the task cancellation token.
    ///
    /// @return token, never null
    public CancellationToken cancellation() {
        return cancellation;
    }

    /// Cancels the task. Running calls observe the token; agents stop at the next
    /// loop boundary.
    ///
    /// @param reason human readable reason, may be null
    public void cancel(String reason) {
        if (cancellation.cancel(reason)) {
            logger.info("Task " + taskId + " cancelled: " + reason);
        }
    }

    public void pause() {
        paused = true;
        logger.info("Task " + taskId + " paused");
    }

    public void resume() {
        paused = false;
        wakeUp();
        logger.info("Task " + taskId + " resumed");
    }

    public boolean isPaused() {
        return paused;
    }

    /// Loop-boundary check: waits while paused, then fails if cancelled.
    ///
    /// @throws TaskCancelledException if the task is cancelled
    public void checkpoint() {
        cancellation.throwIfCancelled();
        if (paused) {
            pauseLock.lock();
            try {
                while (paused && !cancellation.isCancelled()) {
                    resumed.await(500, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskCancelledException("Interrupted while paused", e);
            } finally {
                pauseLock.unlock();
            }
        }
        cancellation.throwIfCancelled();
    }

    /// Returns whether an agent or policy asked to stop the task early.
    ///
    /// @return `true` if the `forceStop` variable is `true`
    public boolean isForceStopped() {
        Object value = variables.get(FORCE_STOP_VARIABLE);
        return Boolean.TRUE.equals(value) || "true".equals(value);
    }

    public void addListener(LifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(LifecycleListener listener) {
        listeners.remove(listener);
    }

    /// Delivers an event to every listener. Listener failures are logged and ignored.
    ///
    /// @param event event to deliver, not null
    public void emit(LifecycleEvent event) {
        for (LifecycleListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warning("Lifecycle listener failed on " + event.getClass().getSimpleName()
                        + ": " + e.getMessage());
            }
        }
    }

    private void wakeUp() {
        pauseLock.lock();
        try {
            resumed.signalAll();
        } finally {
            pauseLock.unlock();
        }
    }
}
