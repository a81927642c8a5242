package io.agentloom.core.policy;

import static io.agentloom.core.testing.TestPlans.agentContext;
import static io.agentloom.core.testing.TestPlans.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.agentloom.core.AgentloomConfig;
import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.reasoning.ToolCallRequest;
import io.agentloom.core.runtime.AgentContext;
import io.agentloom.core.testing.StubCapability;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PolicyPipelineTest {

    private final AgentloomConfig config =
            AgentloomConfig.builder()
                    .maxCapabilityRetries(2)
                    .capabilityRetryBackoff(Duration.ZERO)
                    .build();

    private PolicyPipeline pipeline(PolicyHook... hooks) {
        return new PolicyPipeline(List.of(hooks), null, config);
    }

    private static PolicyHook before(PolicyOutcome outcome) {
        return new PolicyHook() {
            @Override
            public PolicyOutcome beforeInvocation(
                    ToolCallRequest call, Map<String, Object> arguments, AgentContext context) {
                return outcome;
            }
        };
    }

    private static PolicyHook onError(ErrorAction action) {
        return new PolicyHook() {
            @Override
            public ErrorAction onException(
                    ToolCallRequest call, Throwable error, int attempt, AgentContext context) {
                return action;
            }
        };
    }

    @Nested
    class PreInvocation {

        @Test
        void shouldInvokeWhenNoHookObjects() {
            StubCapability search = StubCapability.returning("search", "found");
            AgentContext context = agentContext(search);

            CapabilityInvocationRecord record =
                    PolicyPipeline.permissive(config).execute(call("c1", "search"), context);

            assertThat(record.result().text()).isEqualTo("found");
            assertThat(record.outcomeOf(InvocationStage.PRE_INVOCATION)).isEqualTo("allow");
            assertThat(record.outcomeOf(InvocationStage.INVOCATION)).isEqualTo("success");
            assertThat(context.invocations()).containsExactly(record);
            assertThat(context.usedCapabilities()).containsExactly("search");
        }

        @Test
        void shouldBlockWithoutInvoking() {
            StubCapability delete = StubCapability.returning("delete", "gone");
            AgentContext context = agentContext(delete);

            CapabilityInvocationRecord record =
                    pipeline(before(PolicyOutcome.block("destructive"))).execute(call("c1", "delete"), context);

            assertThat(record.result()).isEqualTo(CapabilityResult.error("Blocked: destructive"));
            assertThat(record.invoked()).isFalse();
            assertThat(delete.calls()).isEmpty();
        }

        @Test
        void shouldSkipWithoutInvoking() {
            StubCapability search = StubCapability.returning("search", "found");

            CapabilityInvocationRecord record = pipeline(before(PolicyOutcome.skip("cached")))
                    .execute(call("c1", "search"), agentContext(search));

            assertThat(record.result()).isEqualTo(CapabilityResult.text("Skipped: cached"));
            assertThat(search.calls()).isEmpty();
        }

        @Test
        void shouldPassRewrittenArgumentsToLaterHooksAndCapability() {
            StubCapability search = StubCapability.returning("search", "found");
            List<Map<String, Object>> seen = new ArrayList<>();
            PolicyHook observer = new PolicyHook() {
                @Override
                public PolicyOutcome beforeInvocation(
                        ToolCallRequest call, Map<String, Object> arguments, AgentContext context) {
                    seen.add(arguments);
                    return PolicyOutcome.allow();
                }
            };

            CapabilityInvocationRecord record = pipeline(
                            before(PolicyOutcome.allowWith(Map.of("query", "safe"))), observer)
                    .execute(call("c1", "search", Map.of("query", "raw")), agentContext(search));

            assertThat(seen).containsExactly(Map.of("query", "safe"));
            assertThat(search.calls()).containsExactly(Map.of("query", "safe"));
            assertThat(record.arguments()).isEqualTo(Map.of("query", "safe"));
        }

        @Test
        void shouldIgnoreFailingHook() {
            PolicyHook broken = new PolicyHook() {
                @Override
                public PolicyOutcome beforeInvocation(
                        ToolCallRequest call, Map<String, Object> arguments, AgentContext context) {
                    throw new IllegalStateException("hook bug");
                }
            };
            StubCapability search = StubCapability.returning("search", "found");

            CapabilityInvocationRecord record =
                    pipeline(broken).execute(call("c1", "search"), agentContext(search));

            assertThat(record.result().text()).isEqualTo("found");
        }
    }

    @Nested
    class Escalation {

        private final PolicyHook escalating = before(PolicyOutcome.escalate("payment"));

        @Test
        void shouldAskForHumanWhenNoHandlerIsConfigured() {
            StubCapability pay = StubCapability.returning("pay", "paid");

            CapabilityInvocationRecord record = pipeline(escalating).execute(call("c1", "pay"), agentContext(pay));

            assertThat(record.result().text())
                    .isEqualTo("Action requires human approval: payment. Please request human assistance.");
            assertThat(pay.calls()).isEmpty();
        }

        @Test
        void shouldInvokeWhenApproved() {
            ApprovalHandler handler = mock(ApprovalHandler.class);
            when(handler.requestApproval(any(), any())).thenReturn(ApprovalDecision.approve("alice"));
            StubCapability pay = StubCapability.returning("pay", "paid");

            CapabilityInvocationRecord record = new PolicyPipeline(List.of(escalating), handler, config)
                    .execute(call("c1", "pay"), agentContext(pay));

            assertThat(record.result().text()).isEqualTo("paid");
            assertThat(record.outcomeOf(InvocationStage.APPROVAL)).isEqualTo("approved");
        }

        @Test
        void shouldReturnFeedbackWhenDenied() {
            ApprovalHandler handler = (request, context) -> ApprovalDecision.deny("too expensive");
            StubCapability pay = StubCapability.returning("pay", "paid");

            CapabilityInvocationRecord record = new PolicyPipeline(List.of(escalating), handler, config)
                    .execute(call("c1", "pay"), agentContext(pay));

            assertThat(record.result().text()).isEqualTo("Action rejected: too expensive");
            assertThat(pay.calls()).isEmpty();
        }

        @Test
        void shouldTreatHandlerFailureAsAwaitingHuman() {
            ApprovalHandler handler = (request, context) -> {
                throw new IllegalStateException("queue down");
            };
            StubCapability pay = StubCapability.returning("pay", "paid");

            CapabilityInvocationRecord record = new PolicyPipeline(List.of(escalating), handler, config)
                    .execute(call("c1", "pay"), agentContext(pay));

            assertThat(record.result().text()).startsWith("Action requires human approval: payment");
            assertThat(record.outcomeOf(InvocationStage.APPROVAL)).isEqualTo("failed");
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldReportMissingCapabilityAsErrorResult() {
            CapabilityInvocationRecord record =
                    PolicyPipeline.permissive(config).execute(call("c1", "missing"), agentContext());

            assertThat(record.result())
                    .isEqualTo(CapabilityResult.error("Error: missing capability does not exist"));
        }

        @Test
        void shouldRetryUntilSuccess() {
            AtomicInteger attempts = new AtomicInteger();
            StubCapability flaky = new StubCapability("fetch", false, (arguments, context) -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new IOException("timeout");
                }
                return CapabilityResult.text("page");
            });
            AgentContext context = agentContext(flaky);

            CapabilityInvocationRecord record =
                    pipeline(onError(ErrorAction.RETRY)).execute(call("c1", "fetch"), context);

            assertThat(record.result().text()).isEqualTo("page");
            assertThat(record.attempt()).isEqualTo(2);
            assertThat(context.invocations()).extracting(CapabilityInvocationRecord::attempt)
                    .containsExactly(0, 1, 2);
            assertThat(context.consecutiveFailures()).isZero();
        }

        @Test
        void shouldStopRetryingWhenBudgetIsExhausted() {
            StubCapability broken = StubCapability.failing("fetch", new IOException("timeout"));
            AgentContext context = agentContext(broken);

            CapabilityInvocationRecord record =
                    pipeline(onError(ErrorAction.RETRY)).execute(call("c1", "fetch"), context);

            assertThat(broken.calls()).hasSize(3);
            assertThat(record.result()).isEqualTo(CapabilityResult.error("Error after 2 retries: timeout"));
            assertThat(context.consecutiveFailures()).isEqualTo(3);
        }

        @Test
        void shouldMapSkipAndEscalateToResults() {
            StubCapability broken = StubCapability.failing("fetch", new IOException("timeout"));

            assertThat(pipeline(onError(ErrorAction.SKIP))
                            .execute(call("c1", "fetch"), agentContext(broken)).result())
                    .isEqualTo(CapabilityResult.text("Skipped due to error: timeout"));
            assertThat(pipeline(onError(ErrorAction.ESCALATE))
                            .execute(call("c2", "fetch"), agentContext(broken)).result())
                    .isEqualTo(CapabilityResult.error("Error requires human assistance: timeout."));
        }

        @Test
        void shouldRethrowOnAbort() {
            IllegalStateException failure = new IllegalStateException("fatal");
            StubCapability broken = StubCapability.failing("fetch", failure);
            AgentContext context = agentContext(broken);

            assertThatThrownBy(() -> pipeline(onError(ErrorAction.ABORT)).execute(call("c1", "fetch"), context))
                    .isSameAs(failure);
            assertThat(context.invocations()).hasSize(1);
        }

        @Test
        void shouldWrapCheckedFailureOnAbort() {
            StubCapability broken = StubCapability.failing("fetch", new IOException("disk"));

            assertThatThrownBy(() -> pipeline(onError(ErrorAction.ABORT))
                            .execute(call("c1", "fetch"), agentContext(broken)))
                    .isInstanceOf(RuntimeException.class)
                    .hasMessage("disk")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void shouldTripCircuitBreakerAtThreshold() {
            AgentloomConfig strict = AgentloomConfig.builder().circuitBreakerThreshold(2).build();
            IOException failure = new IOException("down");
            AgentContext context = agentContext(StubCapability.failing("fetch", failure));
            context.recordFailure();

            assertThatThrownBy(() -> PolicyPipeline.permissive(strict).execute(call("c1", "fetch"), context))
                    .isInstanceOf(CircuitBreakerTrippedException.class)
                    .hasCause(failure);
        }

        @Test
        void shouldPropagateTaskCancellation() {
            StubCapability stopping = new StubCapability("fetch", false, (arguments, context) -> {
                context.agentContext().task().cancel("user stop");
                throw new TaskCancelledException("user stop");
            });

            assertThatThrownBy(() -> PolicyPipeline.permissive(config)
                            .execute(call("c1", "fetch"), agentContext(stopping)))
                    .isInstanceOf(TaskCancelledException.class);
        }

        @Test
        void shouldTreatCallOnlyCancellationAsFailure() {
            StubCapability aborted = StubCapability.failing("fetch", new TaskCancelledException("call aborted"));

            CapabilityInvocationRecord record =
                    PolicyPipeline.permissive(config).execute(call("c1", "fetch"), agentContext(aborted));

            assertThat(record.result()).isEqualTo(CapabilityResult.error("Error: call aborted"));
        }
    }

    @Test
    void shouldNotifyPostInvocationHooks() {
        List<CapabilityResult> observed = new ArrayList<>();
        PolicyHook audit = new PolicyHook() {
            @Override
            public void afterInvocation(
                    ToolCallRequest call,
                    Map<String, Object> arguments,
                    CapabilityResult result,
                    AgentContext context) {
                observed.add(result);
            }
        };

        CapabilityInvocationRecord record = pipeline(audit)
                .execute(call("c1", "search"), agentContext(StubCapability.returning("search", "found")));

        assertThat(observed).containsExactly(CapabilityResult.text("found"));
        assertThat(record.outcomeOf(InvocationStage.POST_INVOCATION)).isEqualTo("observed");
    }

    @Nested
    class Records {

        @Test
        void shouldHandEveryAttemptRecordToHooks() {
            AtomicInteger attempts = new AtomicInteger();
            StubCapability flaky = new StubCapability("fetch", false, (arguments, context) -> {
                if (attempts.incrementAndGet() < 2) {
                    throw new IOException("timeout");
                }
                return CapabilityResult.text("page");
            });
            List<CapabilityInvocationRecord> seen = new ArrayList<>();
            PolicyHook recorder = new PolicyHook() {
                @Override
                public ErrorAction onException(
                        ToolCallRequest call, Throwable error, int attempt, AgentContext context) {
                    return ErrorAction.RETRY;
                }

                @Override
                public void onRecord(CapabilityInvocationRecord record, AgentContext context) {
                    seen.add(record);
                }
            };
            AgentContext context = agentContext(flaky);

            pipeline(recorder).execute(call("c1", "fetch"), context);

            assertThat(seen).isEqualTo(context.invocations());
            assertThat(seen).extracting(CapabilityInvocationRecord::attempt).containsExactly(0, 1);
        }

        @Test
        void shouldHandBlockedRecordToHooks() {
            List<CapabilityInvocationRecord> seen = new ArrayList<>();
            PolicyHook recorder = new PolicyHook() {
                @Override
                public void onRecord(CapabilityInvocationRecord record, AgentContext context) {
                    seen.add(record);
                }
            };

            pipeline(before(PolicyOutcome.block("destructive")), recorder)
                    .execute(call("c1", "delete"), agentContext(StubCapability.returning("delete", "gone")));

            assertThat(seen).singleElement()
                    .extracting(r -> r.outcomeOf(InvocationStage.PRE_INVOCATION))
                    .isEqualTo("block");
        }

        @Test
        void shouldIgnoreFailingRecordHook() {
            PolicyHook failing = new PolicyHook() {
                @Override
                public void onRecord(CapabilityInvocationRecord record, AgentContext context) {
                    throw new IllegalStateException("log store down");
                }
            };

            CapabilityInvocationRecord record = pipeline(failing)
                    .execute(call("c1", "search"), agentContext(StubCapability.returning("search", "found")));

            assertThat(record.result().text()).isEqualTo("found");
        }
    }
}
