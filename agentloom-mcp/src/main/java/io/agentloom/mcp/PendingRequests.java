package io.agentloom.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/// Correlates JSON-RPC responses with the requests awaiting them.
///
/// A request is registered before it is sent, so a response racing the send is
/// never lost. The waiting thread blocks on the returned future until the response
/// arrives, the timeout elapses, the request's token is cancelled or the connection
/// fails every pending request.
///
/// A registration lives until {@link #await} returns or {@link #discard} drops it.
/// Completing a request does not remove it, so a response that arrives before the
/// owner starts waiting is still delivered.
///
/// @implNote Thread-safe. Responses are completed from the transport's reader thread.
public final class PendingRequests {

    private final Map<String, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();

    /// Registers a request id.
    ///
    /// @param id request id, not null
    /// @return future completed with the response message, never null
    public CompletableFuture<JsonNode> register(String id) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.put(id, future);
        return future;
    }

    /// Completes the request with the given id.
    ///
    /// @param id response id, not null
    /// @param message response message, not null
    /// @return `true` if the request was registered and not yet completed
    public boolean complete(String id, JsonNode message) {
        CompletableFuture<JsonNode> future = pending.get(id);
        return future != null && future.complete(message);
    }

    /// Waits for a registered response.
    ///
    /// @param id registered id, not null
    /// @param method method name for error messages, not null
    /// @param timeout maximum wait, not null
    /// @param cancellation aborts the wait, not null
    /// @return the response message, never null
    /// @throws McpException on timeout or connection failure
    /// @throws TaskCancelledException if the token is cancelled while waiting
    public JsonNode await(
            String id, String method, Duration timeout, CancellationToken cancellation) {
        CompletableFuture<JsonNode> future = pending.get(id);
        if (future == null) {
            throw new IllegalStateException("Request " + id + " is not registered");
        }
        Runnable onCancel =
                () -> future.completeExceptionally(new TaskCancelledException(cancellation.reason()));
        cancellation.onCancel(onCancel);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw McpException.timeout(method, timeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TaskCancelledException cancelled) {
                throw new TaskCancelledException(cancelled.getMessage(), cancelled);
            }
            if (cause instanceof McpException failure) {
                throw new McpException(method, failure.getMessage());
            }
            throw new McpException(method, String.valueOf(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while awaiting " + method, e);
        } finally {
            cancellation.removeListener(onCancel);
            pending.remove(id);
        }
    }

    /// Drops a registration without waiting, e.g. when the send failed.
    ///
    /// @param id registered id
    public void discard(String id) {
        pending.remove(id);
    }

    /// Fails every registered request, including those whose owner has not started
    /// waiting yet.
    ///
    /// @param error failure delivered to the waiters, not null
    public void failAll(Throwable error) {
        pending.values().forEach(future -> future.completeExceptionally(error));
    }

    public int size() {
        return pending.size();
    }
}
