package io.agentloom.core.runtime;

import io.agentloom.core.AgentloomConfig;
import io.agentloom.core.event.LifecycleEvent;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.graph.ExecutionGraphCompiler;
import io.agentloom.core.graph.ExecutionTreeNode;
import io.agentloom.core.plan.AgentStatus;
import io.agentloom.core.plan.PlanAgent;
import io.agentloom.core.policy.ErrorAction;
import io.agentloom.core.policy.PolicyOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Runs a plan: compiles its agents into stages and walks the stage list.
///
/// ### Stages
/// - `Normal` runs its agent on the calling thread
/// - `Parallel` runs its agents on the agent pool when `agentParallel` is enabled, one
///   after another otherwise; results are joined with a blank line
///
/// A stage completes, and the next one starts, only once every agent of the stage
/// reached a terminal state. If any of them failed, the first failure in stage order
/// ends the task with {@link TaskResult.StopReason#ERROR} once the stage has settled.
///
/// ### Agent lifecycle
/// `init → running → done | error`, with the {@link AgentLifecycleHooks} consulted at
/// start, completion and failure. Hook-requested re-runs and retries are bounded by
/// `maxAgentRetries`.
///
/// @implNote The agent pool is owned by the environment and never shut down here.
///
/// @see AgentRuntime for the per-agent loop
public class PlanExecutor {

    private static final Logger logger = Logger.getLogger(PlanExecutor.class.getName());

    private final AgentRuntime runtime;
    private final AgentRegistry registry;
    private final ExecutionGraphCompiler compiler;
    private final ExecutorService agentPool;
    private final AgentLifecycleHooks hooks;
    private final AgentloomConfig config;

    /// Creates an executor.
    ///
    /// @param runtime per-agent loop, not null
    /// @param registry resolves plan agent names, not null
    /// @param compiler stage compiler, not null
    /// @param agentPool runs parallel stages, not null
    /// @param hooks lifecycle callbacks, may be null for none
    /// @param config parallelism and retry limits, not null
    public PlanExecutor(
            AgentRuntime runtime,
            AgentRegistry registry,
            ExecutionGraphCompiler compiler,
            ExecutorService agentPool,
            AgentLifecycleHooks hooks,
            AgentloomConfig config) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.agentPool = Objects.requireNonNull(agentPool, "agentPool must not be null");
        this.hooks = hooks != null ? hooks : AgentLifecycleHooks.NONE;
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Executes the task's plan.
    ///
    /// Only agents still in `init` are compiled, so a partially executed plan resumes
    /// where it stopped.
    ///
    /// @param task task to run, not null
    /// @return task outcome, never null
    /// @throws io.agentloom.core.graph.GraphCompilationException if no agent can run
    public TaskResult execute(TaskContext task) {
        Objects.requireNonNull(task, "task must not be null");
        List<PlanAgent> pending =
                task.getPlan().getAgents().stream()
                        .filter(agent -> agent.getStatus() == AgentStatus.INIT)
                        .toList();
        ExecutionTreeNode stage = compiler.compile(pending);

        logger.info("Executing task " + task.getTaskId() + " with " + pending.size() + " agents");
        List<String> results = new ArrayList<>();
        TaskResult outcome;
        try {
            while (stage != null) {
                task.checkpoint();
                results.add(runStage(task, stage));
                stage = stage.next();
            }
            outcome = TaskResult.done(task.getTaskId(), results.isEmpty() ? "" : results.get(results.size() - 1));
        } catch (TaskCancelledException e) {
            logger.info("Task " + task.getTaskId() + " aborted: " + e.getMessage());
            outcome = TaskResult.aborted(task.getTaskId(), e);
        } catch (RuntimeException e) {
            logger.warning("Task " + task.getTaskId() + " failed: " + e.getMessage());
            outcome = TaskResult.failed(task.getTaskId(), e);
        }

        try {
            hooks.onTaskComplete(task, outcome);
        } catch (RuntimeException e) {
            logger.warning("Task completion hook failed: " + e);
        }
        return outcome;
    }

    private String runStage(TaskContext task, ExecutionTreeNode stage) {
        if (stage instanceof ExecutionTreeNode.Normal normal) {
            return runAgent(task, normal.agent());
        }
        List<PlanAgent> agents = stage.agents();
        List<String> results = new ArrayList<>(agents.size());
        RuntimeException failure = null;

        if (config.isAgentParallel()) {
            List<Future<String>> futures = new ArrayList<>(agents.size());
            for (PlanAgent agent : agents) {
                futures.add(agentPool.submit(() -> runAgent(task, agent)));
            }
            for (Future<String> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    failure = failure != null ? failure : asRuntime(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    task.cancel("Interrupted");
                    futures.forEach(f -> f.cancel(true));
                    throw new TaskCancelledException("Interrupted while awaiting parallel agents", e);
                }
            }
        } else {
            for (PlanAgent agent : agents) {
                try {
                    results.add(runAgent(task, agent));
                } catch (RuntimeException e) {
                    failure = failure != null ? failure : e;
                }
            }
        }

        if (failure != null) {
            throw failure;
        }
        return String.join("\n\n", results);
    }

    /// Runs one agent through its lifecycle.
    String runAgent(TaskContext task, PlanAgent agent) {
        AgentDefinition definition =
                registry.find(agent.getName())
                        .orElseThrow(() -> fail(task, agent,
                                AgentExecutionException.unknownAgent(agent.getId(), agent.getName())));

        int attempt = 0;
        while (true) {
            AgentContext context = new AgentContext(task, agent);
            agent.setStatus(AgentStatus.RUNNING);
            task.emit(LifecycleEvent.AgentStarted.now(task.getTaskId(), agent.getId(), agent.getName()));
            logger.info("Agent " + agent.getId() + " (" + agent.getName() + ") started");

            String result;
            try {
                checkStart(context);
                result = runtime.run(definition, context);
            } catch (TaskCancelledException e) {
                throw fail(task, agent, e);
            } catch (RuntimeException e) {
                ErrorAction action = errorAction(context, e, attempt);
                if (action == ErrorAction.RETRY && attempt < config.getMaxAgentRetries()) {
                    logger.info("Retrying agent " + agent.getId() + " after error: " + e.getMessage());
                    attempt++;
                    continue;
                }
                if (action == ErrorAction.SKIP) {
                    String skipped = "Skipped due to error: " + e.getMessage();
                    finish(task, agent, AgentStatus.DONE, skipped, null);
                    return skipped;
                }
                throw fail(task, agent, e);
            }

            agent.setStatus(AgentStatus.DONE);
            if (rerunRequested(context, result) && attempt < config.getMaxAgentRetries()) {
                logger.info("Re-running agent " + agent.getId() + " on completion hook request");
                attempt++;
                continue;
            }
            finish(task, agent, AgentStatus.DONE, result, null);
            return result;
        }
    }

    private void checkStart(AgentContext context) {
        PolicyOutcome outcome;
        try {
            outcome = hooks.beforeAgentStart(context);
        } catch (RuntimeException e) {
            logger.warning("Agent start hook failed: " + e);
            return;
        }
        if (outcome instanceof PolicyOutcome.Block block) {
            logger.warning("Agent " + context.agentId() + " blocked: " + block.reason());
            throw AgentExecutionException.blocked(context.agentId(), block.reason());
        }
    }

    private boolean rerunRequested(AgentContext context, String result) {
        try {
            return hooks.afterAgentComplete(context, result);
        } catch (RuntimeException e) {
            logger.warning("Agent completion hook failed: " + e);
            return false;
        }
    }

    private ErrorAction errorAction(AgentContext context, RuntimeException error, int attempt) {
        try {
            return hooks.onAgentError(context, error, attempt);
        } catch (RuntimeException e) {
            logger.warning("Agent error hook failed: " + e);
            return null;
        }
    }

    private RuntimeException fail(TaskContext task, PlanAgent agent, RuntimeException error) {
        finish(task, agent, AgentStatus.ERROR, null, error);
        if (error instanceof TaskCancelledException || error instanceof AgentExecutionException) {
            return error;
        }
        return new AgentExecutionException(
                agent.getId(), "Agent " + agent.getId() + " failed: " + error.getMessage(), error);
    }

    private static void finish(
            TaskContext task, PlanAgent agent, AgentStatus status, String result, Throwable error) {
        agent.setStatus(status);
        task.emit(LifecycleEvent.AgentFinished.now(
                task.getTaskId(), agent.getId(), status, result, error));
        if (error != null) {
            logger.warning("Agent " + agent.getId() + " ended " + status.wireName() + ": " + error.getMessage());
        } else {
            logger.info("Agent " + agent.getId() + " ended " + status.wireName());
        }
    }

    private static RuntimeException asRuntime(Throwable cause) {
        return cause instanceof RuntimeException runtime ? runtime : new IllegalStateException(cause);
    }
}
