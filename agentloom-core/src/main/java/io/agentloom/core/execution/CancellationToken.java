package io.agentloom.core.execution;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/// Cooperative cancellation signal.
///
/// One token exists per task. Individual slow calls get a disposable
/// {@linkplain #child() child} token: cancelling the child aborts that call only,
/// while cancelling the task token cancels every live child as well.
///
/// ```
/// task token ──cancel──> child(call 1), child(call 2) ...
/// child ──cancel──> (nothing upstream)
/// ```
///
/// ### Contracts
/// - **Invariant**: once cancelled, a token stays cancelled
/// - **Postcondition**: listeners registered after cancellation run immediately
///
/// @implNote Thread-safe. Listener failures are logged and ignored.
public final class CancellationToken implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(CancellationToken.class.getName());

    private final CancellationToken parent;
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Runnable parentListener;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
        if (parent != null) {
            this.parentListener = () -> cancel(parent.reason());
            parent.onCancel(parentListener);
        } else {
            this.parentListener = null;
        }
    }

    /// Creates an independent root token.
    ///
    /// @return new token, never null
    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /// Creates a token cancelled whenever this one is.
    ///
    /// Close the child when the call it guards finishes, so the parent does not keep
    /// a reference to it.
    ///
    /// @return new child token, never null
    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /// Cancels this token and all of its children.
    ///
    /// @param reason human readable reason, may be null
    /// @return `true` if this call performed the cancellation
    public boolean cancel(String reason) {
        if (!this.reason.compareAndSet(null, reason != null ? reason : "Cancelled")) {
            return false;
        }
        latch.countDown();
        for (Runnable listener : listeners) {
            runSafely(listener);
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /// Returns the cancellation reason.
    ///
    /// @return reason, or null while not cancelled
    public String reason() {
        return reason.get();
    }

    /// @throws TaskCancelledException if this token is cancelled
    public void throwIfCancelled() {
        String current = reason.get();
        if (current != null) {
            throw new TaskCancelledException(current);
        }
    }

    /// Registers a callback invoked once on cancellation.
    ///
    /// @param listener callback, not null
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            runSafely(listener);
        }
    }

    /// Removes a callback registered with {@link #onCancel(Runnable)}.
    ///
    /// @param listener callback to remove
    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    /// Sleeps for the given duration unless cancelled first.
    ///
    /// @param duration time to wait, not null
    /// @throws TaskCancelledException if the token is cancelled before or during the wait
    public void sleep(Duration duration) {
        throwIfCancelled();
        try {
            if (latch.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while waiting", e);
        }
    }

    /// Detaches this token from its parent. Has no effect on a root token.
    @Override
    public void close() {
        if (parent != null) {
            parent.removeListener(parentListener);
        }
    }

    private static void runSafely(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.warning("Cancellation listener failed: " + e.getMessage());
        }
    }
}
