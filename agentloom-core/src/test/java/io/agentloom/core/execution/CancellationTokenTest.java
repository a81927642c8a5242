package io.agentloom.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CancellationTokenTest {

    @Nested
    class Cancel {

        @Test
        void shouldCancelOnlyOnce() {
            CancellationToken token = CancellationToken.create();

            assertThat(token.cancel("first")).isTrue();
            assertThat(token.cancel("second")).isFalse();
            assertThat(token.reason()).isEqualTo("first");
        }

        @Test
        void shouldUseDefaultReasonForNull() {
            CancellationToken token = CancellationToken.create();

            token.cancel(null);

            assertThat(token.reason()).isEqualTo("Cancelled");
        }

        @Test
        void shouldThrowWithReasonWhenCancelled() {
            CancellationToken token = CancellationToken.create();
            token.throwIfCancelled();
            token.cancel("user stop");

            assertThatThrownBy(token::throwIfCancelled)
                    .isInstanceOf(TaskCancelledException.class)
                    .hasMessage("user stop");
        }

        @Test
        void shouldRunListenersOnceAndImmediatelyWhenLate() {
            CancellationToken token = CancellationToken.create();
            AtomicInteger calls = new AtomicInteger();
            token.onCancel(calls::incrementAndGet);

            token.cancel("stop");
            token.cancel("again");
            token.onCancel(calls::incrementAndGet);

            assertThat(calls).hasValue(2);
        }

        @Test
        void shouldIgnoreFailingListener() {
            CancellationToken token = CancellationToken.create();
            AtomicInteger calls = new AtomicInteger();
            token.onCancel(() -> {
                throw new IllegalStateException("boom");
            });
            token.onCancel(calls::incrementAndGet);

            token.cancel("stop");

            assertThat(calls).hasValue(1);
        }
    }

    @Nested
    class Children {

        @Test
        void shouldPropagateParentCancellationToChild() {
            CancellationToken parent = CancellationToken.create();
            CancellationToken child = parent.child();

            parent.cancel("task stopped");

            assertThat(child.isCancelled()).isTrue();
            assertThat(child.reason()).isEqualTo("task stopped");
        }

        @Test
        void shouldNotPropagateChildCancellationToParent() {
            CancellationToken parent = CancellationToken.create();
            CancellationToken child = parent.child();

            child.cancel("call aborted");

            assertThat(parent.isCancelled()).isFalse();
        }

        @Test
        void shouldDetachClosedChild() {
            CancellationToken parent = CancellationToken.create();
            CancellationToken child = parent.child();

            child.close();
            parent.cancel("stop");

            assertThat(child.isCancelled()).isFalse();
        }

        @Test
        void shouldCreateCancelledChildOfCancelledParent() {
            CancellationToken parent = CancellationToken.create();
            parent.cancel("gone");

            assertThat(parent.child().isCancelled()).isTrue();
        }
    }

    @Nested
    class Sleep {

        @Test
        void shouldReturnAfterDuration() {
            CancellationToken token = CancellationToken.create();

            token.sleep(Duration.ofMillis(10));

            assertThat(token.isCancelled()).isFalse();
        }

        @Test
        void shouldWakeUpWhenCancelled() {
            CancellationToken token = CancellationToken.create();
            CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS).execute(() -> token.cancel("stop"));
            long start = System.nanoTime();

            assertThatThrownBy(() -> token.sleep(Duration.ofSeconds(30)))
                    .isInstanceOf(TaskCancelledException.class)
                    .hasMessage("stop");
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
        }
    }
}
