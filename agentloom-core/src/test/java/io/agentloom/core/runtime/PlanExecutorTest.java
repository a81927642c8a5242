package io.agentloom.core.runtime;

import static io.agentloom.core.testing.TestPlans.agent;
import static io.agentloom.core.testing.TestPlans.plan;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.AgentloomConfig;
import io.agentloom.core.event.LifecycleEvent;
import io.agentloom.core.graph.ExecutionGraphCompiler;
import io.agentloom.core.plan.AgentStatus;
import io.agentloom.core.plan.Plan;
import io.agentloom.core.plan.PlanAgent;
import io.agentloom.core.plan.markup.PlanMarkupCodec;
import io.agentloom.core.policy.ErrorAction;
import io.agentloom.core.policy.PolicyOutcome;
import io.agentloom.core.policy.PolicyPipeline;
import io.agentloom.core.reasoning.FinishReason;
import io.agentloom.core.reasoning.ReasoningEvent;
import io.agentloom.core.reasoning.ReasoningGateway;
import io.agentloom.core.reasoning.SlidingWindowCompressor;
import io.agentloom.core.testing.ScriptedEngine;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlanExecutorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService agentPool = Executors.newFixedThreadPool(4);
    private final ExecutorService capabilityPool = Executors.newCachedThreadPool();
    private final ScriptedEngine engine = new ScriptedEngine();
    private final AgentloomConfig config =
            AgentloomConfig.builder()
                    .maxReasoningRetries(0)
                    .reasoningBackoffBase(Duration.ZERO)
                    .build();

    @AfterEach
    void tearDown() {
        agentPool.shutdownNow();
        capabilityPool.shutdownNow();
    }

    private PlanExecutor executor(AgentLifecycleHooks hooks) {
        AgentRuntime runtime = new AgentRuntime(
                new ReasoningGateway(engine, new SlidingWindowCompressor(), config, mapper),
                new CapabilityDispatcher(PolicyPipeline.permissive(config), capabilityPool, true),
                new PlanMarkupCodec(),
                config,
                mapper);
        AgentRegistry registry = new AgentRegistry(List.of(
                AgentDefinition.local("Browser", "Browses the web", List.of()),
                AgentDefinition.local("Analyst", "Compares data", List.of()),
                AgentDefinition.local("Writer", "Writes reports", List.of())));
        return new PlanExecutor(runtime, registry, new ExecutionGraphCompiler(), agentPool, hooks, config);
    }

    private PlanExecutor executor() {
        return executor(null);
    }

    private void answer(PlanAgent agent, String text) {
        engine.forAgent(agent.getId(), ScriptedEngine.text(text, FinishReason.STOP));
    }

    private void failing(PlanAgent agent, String message) {
        engine.forAgent(agent.getId(), (request, sink, token) -> {
            throw new IOException(message);
        });
    }

    /// Answers "together" only if both agents of the stage are reasoning at the same time.
    private void rendezvous(CountDownLatch latch, PlanAgent... agents) {
        for (PlanAgent agent : agents) {
            engine.forAgent(agent.getId(), (request, sink, token) -> {
                latch.countDown();
                boolean together = latch.await(5, TimeUnit.SECONDS);
                sink.accept(new ReasoningEvent.TextDelta(together ? "together" : "alone"));
            });
        }
    }

    @Nested
    class Stages {

        @Test
        void shouldRunChainAndReturnLastResult() {
            PlanAgent browser = agent(0, "Browser");
            PlanAgent writer = agent(1, "Writer", 0);
            answer(browser, "Flights found");
            answer(writer, "Report written");
            TaskContext task = TaskContext.forPlan(plan(browser, writer), "Plan a trip");
            List<LifecycleEvent> events = new ArrayList<>();
            task.addListener(events::add);

            TaskResult result = executor().execute(task);

            assertThat(result.success()).isTrue();
            assertThat(result.stopReason()).isEqualTo(TaskResult.StopReason.DONE);
            assertThat(result.result()).isEqualTo("Report written");
            assertThat(browser.getStatus()).isEqualTo(AgentStatus.DONE);
            assertThat(writer.getStatus()).isEqualTo(AgentStatus.DONE);
            assertThat(events.stream()
                            .filter(LifecycleEvent.AgentFinished.class::isInstance)
                            .map(event -> ((LifecycleEvent.AgentFinished) event).agentId()))
                    .containsExactly(browser.getId(), writer.getId());
        }

        @Test
        void shouldRunParallelStageConcurrently() {
            PlanAgent browser = agent(0, "Browser");
            PlanAgent analyst = agent(1, "Analyst");
            PlanAgent writer = agent(2, "Writer", 0, 1);
            rendezvous(new CountDownLatch(2), browser, analyst);
            answer(writer, "Report");

            TaskContext task = TaskContext.forPlan(plan(browser, analyst, writer), "Trip");
            List<String> stageResults = new ArrayList<>();
            task.addListener(event -> {
                if (event instanceof LifecycleEvent.AgentFinished finished
                        && !finished.agentId().equals(writer.getId())) {
                    synchronized (stageResults) {
                        stageResults.add(finished.result());
                    }
                }
            });

            TaskResult result = executor().execute(task);

            assertThat(result.result()).isEqualTo("Report");
            assertThat(stageResults).containsExactly("together", "together");
            assertThat(browser.getParallel()).isTrue();
            assertThat(analyst.getParallel()).isTrue();
        }

        @Test
        void shouldJoinResultsOfFinalParallelStage() {
            PlanAgent browser = agent(0, "Browser");
            PlanAgent analyst = agent(1, "Analyst");
            rendezvous(new CountDownLatch(2), browser, analyst);

            TaskResult result = executor().execute(TaskContext.forPlan(plan(browser, analyst), "Trip"));

            assertThat(result.result()).isEqualTo("together\n\ntogether");
        }

        @Test
        void shouldRunParallelStageSequentiallyWhenDisabled() {
            config.setAgentParallel(false);
            PlanAgent browser = agent(0, "Browser");
            PlanAgent analyst = agent(1, "Analyst");
            answer(browser, "first");
            answer(analyst, "second");

            TaskResult result = executor().execute(TaskContext.forPlan(plan(browser, analyst), "Trip"));

            assertThat(result.result()).isEqualTo("first\n\nsecond");
        }

        @Test
        void shouldSkipAgentsThatAlreadyFinished() {
            PlanAgent browser = agent(0, "Browser");
            PlanAgent writer = agent(1, "Writer", 0);
            browser.setStatus(AgentStatus.DONE);
            answer(writer, "Report");

            TaskResult result = executor().execute(TaskContext.forPlan(plan(browser, writer), "Trip"));

            assertThat(result.result()).isEqualTo("Report");
            assertThat(engine.requests()).extracting(request -> request.agentId()).containsExactly(writer.getId());
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldSettleParallelStageBeforeFailing() {
            PlanAgent browser = agent(0, "Browser");
            PlanAgent analyst = agent(1, "Analyst");
            PlanAgent writer = agent(2, "Writer", 0, 1);
            failing(browser, "site down");
            engine.forAgent(analyst.getId(), (request, sink, token) -> {
                Thread.sleep(100);
                sink.accept(new ReasoningEvent.TextDelta("compared"));
            });

            TaskResult result = executor().execute(TaskContext.forPlan(plan(browser, analyst, writer), "Trip"));

            assertThat(result.success()).isFalse();
            assertThat(result.stopReason()).isEqualTo(TaskResult.StopReason.ERROR);
            assertThat(result.error())
                    .isInstanceOf(AgentExecutionException.class)
                    .hasMessageContaining("Agent task-1-00 failed")
                    .hasMessageContaining("site down");
            assertThat(browser.getStatus()).isEqualTo(AgentStatus.ERROR);
            assertThat(analyst.getStatus()).isEqualTo(AgentStatus.DONE);
            assertThat(writer.getStatus()).isEqualTo(AgentStatus.INIT);
        }

        @Test
        void shouldFailForUnknownAgent() {
            PlanAgent ghost = agent(0, "Ghost");

            TaskResult result = executor().execute(TaskContext.forPlan(plan(ghost), "Trip"));

            assertThat(result.error()).hasMessage("Agent not found: Ghost");
            assertThat(ghost.getStatus()).isEqualTo(AgentStatus.ERROR);
        }

        @Test
        void shouldAbortCancelledTask() {
            PlanAgent browser = agent(0, "Browser");
            TaskContext task = TaskContext.forPlan(plan(browser), "Trip");
            task.cancel("user stop");

            TaskResult result = executor().execute(task);

            assertThat(result.stopReason()).isEqualTo(TaskResult.StopReason.ABORT);
            assertThat(result.error()).hasMessage("user stop");
            assertThat(engine.requests()).isEmpty();
        }
    }

    @Nested
    class Hooks {

        @Test
        void shouldFailAgentBlockedAtStart() {
            PlanAgent browser = agent(0, "Browser");
            AgentLifecycleHooks hooks = new AgentLifecycleHooks() {
                @Override
                public PolicyOutcome beforeAgentStart(AgentContext context) {
                    return PolicyOutcome.block("Browsing disabled");
                }
            };

            TaskResult result = executor(hooks).execute(TaskContext.forPlan(plan(browser), "Trip"));

            assertThat(result.error()).isInstanceOf(AgentExecutionException.class).hasMessage("Browsing disabled");
            assertThat(engine.requests()).isEmpty();
        }

        @Test
        void shouldRetryAgentOnHookRequest() {
            PlanAgent browser = agent(0, "Browser");
            failing(browser, "flaky");
            answer(browser, "Recovered");
            AgentLifecycleHooks hooks = new AgentLifecycleHooks() {
                @Override
                public ErrorAction onAgentError(AgentContext context, Throwable error, int attempt) {
                    return ErrorAction.RETRY;
                }
            };

            TaskResult result = executor(hooks).execute(TaskContext.forPlan(plan(browser), "Trip"));

            assertThat(result.result()).isEqualTo("Recovered");
        }

        @Test
        void shouldBoundHookRetries() {
            PlanAgent browser = agent(0, "Browser");
            for (int i = 0; i < 5; i++) {
                failing(browser, "down");
            }
            AgentLifecycleHooks hooks = new AgentLifecycleHooks() {
                @Override
                public ErrorAction onAgentError(AgentContext context, Throwable error, int attempt) {
                    return ErrorAction.RETRY;
                }
            };

            TaskResult result = executor(hooks).execute(TaskContext.forPlan(plan(browser), "Trip"));

            assertThat(result.success()).isFalse();
            assertThat(engine.requests()).hasSize(1 + config.getMaxAgentRetries());
        }

        @Test
        void shouldContinueAfterSkippedAgent() {
            PlanAgent browser = agent(0, "Browser");
            PlanAgent writer = agent(1, "Writer", 0);
            failing(browser, "site down");
            answer(writer, "Report without prices");
            AgentLifecycleHooks hooks = new AgentLifecycleHooks() {
                @Override
                public ErrorAction onAgentError(AgentContext context, Throwable error, int attempt) {
                    return ErrorAction.SKIP;
                }
            };

            TaskResult result = executor(hooks).execute(TaskContext.forPlan(plan(browser, writer), "Trip"));

            assertThat(result.result()).isEqualTo("Report without prices");
            assertThat(browser.getStatus()).isEqualTo(AgentStatus.DONE);
        }

        @Test
        void shouldRerunAgentOnCompletionHookRequestWithinBudget() {
            PlanAgent browser = agent(0, "Browser");
            for (int i = 0; i < 5; i++) {
                answer(browser, "answer " + i);
            }
            AtomicInteger completions = new AtomicInteger();
            AgentLifecycleHooks hooks = new AgentLifecycleHooks() {
                @Override
                public boolean afterAgentComplete(AgentContext context, String result) {
                    completions.incrementAndGet();
                    return true;
                }
            };

            TaskResult result = executor(hooks).execute(TaskContext.forPlan(plan(browser), "Trip"));

            assertThat(result.result()).isEqualTo("answer 2");
            assertThat(completions).hasValue(3);
        }

        @Test
        void shouldReportOutcomeToTaskCompletionHook() {
            PlanAgent browser = agent(0, "Browser");
            answer(browser, "done");
            AtomicReference<TaskResult> reported = new AtomicReference<>();
            AgentLifecycleHooks hooks = new AgentLifecycleHooks() {
                @Override
                public void onTaskComplete(TaskContext task, TaskResult result) {
                    reported.set(result);
                }
            };
            Plan plan = plan(browser);

            TaskResult result = executor(hooks).execute(TaskContext.forPlan(plan, "Trip"));

            assertThat(reported.get()).isEqualTo(result);
        }
    }
}
