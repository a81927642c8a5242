package io.agentloom.core.runtime;

import static io.agentloom.core.testing.TestPlans.agent;
import static io.agentloom.core.testing.TestPlans.plan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentloom.core.event.LifecycleEvent;
import io.agentloom.core.execution.TaskCancelledException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TaskContextTest {

    private final TaskContext task = TaskContext.forPlan(plan(agent(0, "Browser")), "Main task");

    @Nested
    class ForceStop {

        @Test
        void shouldAcceptBooleanAndStringTrue() {
            assertThat(task.isForceStopped()).isFalse();

            task.variables().put(TaskContext.FORCE_STOP_VARIABLE, Boolean.TRUE);
            assertThat(task.isForceStopped()).isTrue();

            task.variables().put(TaskContext.FORCE_STOP_VARIABLE, "true");
            assertThat(task.isForceStopped()).isTrue();
        }

        @Test
        void shouldIgnoreOtherValues() {
            task.variables().put(TaskContext.FORCE_STOP_VARIABLE, "yes");

            assertThat(task.isForceStopped()).isFalse();
        }
    }

    @Nested
    class PauseAndCancel {

        @Test
        void shouldBlockCheckpointUntilResumed() throws Exception {
            task.pause();
            CompletableFuture<Void> waiting = CompletableFuture.runAsync(task::checkpoint);

            Thread.sleep(100);
            assertThat(waiting).isNotDone();

            task.resume();
            waiting.get(2, TimeUnit.SECONDS);
            assertThat(task.isPaused()).isFalse();
        }

        @Test
        void shouldReleasePausedCheckpointOnCancel() {
            task.pause();
            CompletableFuture<Void> waiting = CompletableFuture.runAsync(task::checkpoint);

            task.cancel("user stop");

            assertThatThrownBy(() -> waiting.get(2, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(TaskCancelledException.class);
        }

        @Test
        void shouldFailCheckpointOnceCancelled() {
            task.cancel("user stop");

            assertThatThrownBy(task::checkpoint)
                    .isInstanceOf(TaskCancelledException.class)
                    .hasMessage("user stop");
            assertThat(task.cancellation().isCancelled()).isTrue();
        }
    }

    @Test
    void shouldKeepDeliveringAfterListenerFailure() {
        List<LifecycleEvent> received = new ArrayList<>();
        task.addListener(event -> {
            throw new IllegalStateException("broken listener");
        });
        task.addListener(received::add);
        LifecycleEvent event = new LifecycleEvent.AgentStarted("task-1", "task-1-00", "Browser", Instant.now());

        task.emit(event);

        assertThat(received).containsExactly(event);
    }

    @Test
    void shouldUsePlanIdAsTaskId() {
        assertThat(task.getTaskId()).isEqualTo("task-1");
        assertThat(task.getMainTask()).isEqualTo("Main task");
    }
}
