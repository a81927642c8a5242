package io.agentloom.mcp;

import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/// MCP client over the server-sent events transport.
///
/// ### Protocol
/// ```
/// +--------------+                              +--------------+
/// │ SseMcpClient │---- GET (event stream) ---->│  MCP server  │
/// │              │<--- event: endpoint --------│              │
/// │              │---- POST request ---------->│              │
/// │              │<--- "Accepted" -------------│              │
/// │              │<--- event: message ---------│              │
/// +--------------+                              +--------------+
/// ```
///
/// The first `endpoint` event supplies the POST target, resolved against the stream
/// URL. Every request is POSTed on its own and answered on the stream, correlated by
/// id. A ping every `heartbeatInterval` keeps the session alive. When the stream
/// fails, waiting requests fail and one reconnect is attempted after `reconnectDelay`.
///
/// @implNote Thread-safe. One daemon thread reads the stream, a scheduler thread
/// runs pings and the reconnect.
public class SseMcpClient extends AbstractMcpClient {

    private static final Logger LOG = Logger.getLogger(SseMcpClient.class);

    /// Body a server answers a valid POST with.
    static final String ACCEPTED = "Accepted";

    private final URI streamUri;
    private final HttpClient http;
    private final ScheduledExecutorService scheduler;
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean();
    private volatile URI messageUri;
    private volatile InputStream stream;
    private volatile boolean connected;
    private volatile boolean closed;
    private ScheduledFuture<?> heartbeat;

    /// Creates a client; nothing is opened before {@link #connect(CancellationToken)}.
    ///
    /// @param streamUri event stream URL, not null
    /// @param jsonRpc message helper, not null
    /// @param config timeouts and headers, not null
    public SseMcpClient(URI streamUri, JsonRpc jsonRpc, McpClientConfig config) {
        super(jsonRpc, config);
        this.streamUri = Objects.requireNonNull(streamUri, "streamUri must not be null");
        this.http = HttpClient.newBuilder().connectTimeout(config.getConnectTimeout()).build();
        this.scheduler =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "mcp-sse-scheduler");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    @Override
    public synchronized void connect(CancellationToken cancellation) {
        if (closed) {
            throw new McpException("initialize", "client is closed");
        }
        LOG.infov("MCP client connecting to {0}", streamUri);
        connected = false;
        openStream(cancellation);
        try {
            handshake(cancellation);
        } catch (RuntimeException e) {
            generation.incrementAndGet();
            closeStream();
            throw e;
        }
        connected = true;
        startHeartbeat();
        LOG.infov("MCP client connected to {0}, posting to {1}", streamUri, messageUri);
    }

    @Override
    public boolean isConnected() {
        return connected && !closed;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            if (connected) {
                try {
                    sendNotification(
                            "notifications/cancelled",
                            Map.of("requestId", UUID.randomUUID().toString(), "reason", "Client closed"),
                            CancellationToken.create());
                } catch (RuntimeException e) {
                    LOG.debugv("Cancel notification failed: {0}", e.getMessage());
                }
            }
            closed = true;
            connected = false;
            generation.incrementAndGet();
        }
        scheduler.shutdownNow();
        closeStream();
        pending.failAll(new McpException("connection closed"));
        LOG.infov("MCP client closed {0}", streamUri);
    }

    /// Returns the POST target announced by the server.
    ///
    /// @return message URL, or null before the endpoint event
    public URI getMessageUri() {
        return messageUri;
    }

    @Override
    protected void send(String method, String message, CancellationToken cancellation) {
        URI target = messageUri;
        if (target == null) {
            throw new McpException(method, "not connected");
        }
        HttpRequest.Builder builder =
                HttpRequest.newBuilder(target)
                        .timeout(config.getRequestTimeout())
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(message));
        config.getHeaders().forEach(builder::header);

        CompletableFuture<HttpResponse<String>> response =
                http.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString());
        Runnable onCancel = () -> response.cancel(true);
        cancellation.onCancel(onCancel);
        try {
            String body = response.get().body();
            if (body == null || !ACCEPTED.equals(body.trim())) {
                throw new McpException(method, body);
            }
        } catch (CancellationException e) {
            throw new TaskCancelledException(cancellation.reason(), e);
        } catch (ExecutionException e) {
            throw new McpException(method, String.valueOf(e.getCause().getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while sending " + method, e);
        } finally {
            cancellation.removeListener(onCancel);
        }
    }

    private void openStream(CancellationToken cancellation) {
        int current = generation.incrementAndGet();
        closeStream();
        messageUri = null;

        HttpRequest.Builder builder =
                HttpRequest.newBuilder(streamUri)
                        .header("Accept", "text/event-stream")
                        .header("Cache-Control", "no-cache")
                        .GET();
        config.getHeaders().forEach(builder::header);

        CompletableFuture<URI> endpoint = new CompletableFuture<>();
        http.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofInputStream())
                .whenComplete(
                        (response, error) -> {
                            if (error != null) {
                                endpoint.completeExceptionally(error);
                            } else if (response.statusCode() != 200) {
                                closeQuietly(response.body());
                                endpoint.completeExceptionally(
                                        new McpException("Event stream returned HTTP " + response.statusCode()));
                            } else {
                                startReader(response.body(), endpoint, current);
                            }
                        });

        Runnable onCancel =
                () -> endpoint.completeExceptionally(new TaskCancelledException(cancellation.reason()));
        cancellation.onCancel(onCancel);
        try {
            messageUri =
                    endpoint.get(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            closeStream();
            throw McpException.connectionFailed(streamUri.toString(), e);
        } catch (ExecutionException e) {
            closeStream();
            if (e.getCause() instanceof TaskCancelledException cancelled) {
                throw cancelled;
            }
            throw McpException.connectionFailed(streamUri.toString(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeStream();
            throw new TaskCancelledException("Interrupted while connecting", e);
        } finally {
            cancellation.removeListener(onCancel);
        }
    }

    private void startReader(InputStream body, CompletableFuture<URI> endpoint, int current) {
        stream = body;
        Thread reader = new Thread(() -> readStream(body, endpoint, current), "mcp-sse-reader");
        reader.setDaemon(true);
        reader.start();
    }

    private void readStream(InputStream body, CompletableFuture<URI> endpoint, int current) {
        SseFrameParser parser = new SseFrameParser();
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(body, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                for (SseFrame frame : parser.feed(CharBuffer.wrap(buffer, 0, read))) {
                    onFrame(frame, endpoint);
                }
            }
            streamEnded(current, endpoint, null);
        } catch (IOException e) {
            streamEnded(current, endpoint, e);
        }
    }

    private void onFrame(SseFrame frame, CompletableFuture<URI> endpoint) {
        switch (frame.event()) {
            case "endpoint" -> endpoint.complete(streamUri.resolve(frame.data().trim()));
            case "message" -> onMessage(frame.data());
            default -> LOG.debugv("Ignoring {0} event", frame.event());
        }
    }

    private void streamEnded(int streamGeneration, CompletableFuture<URI> endpoint, IOException error) {
        if (closed || streamGeneration != generation.get()) {
            return;
        }
        connected = false;
        endpoint.completeExceptionally(
                error != null ? error : new McpException("Event stream ended"));
        LOG.warnv(
                "MCP event stream {0} lost: {1}",
                streamUri,
                error != null ? error.getMessage() : "end of stream");
        pending.failAll(new McpException("event stream lost"));
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        scheduler.schedule(
                () -> {
                    try {
                        connect(CancellationToken.create());
                        reconnectScheduled.set(false);
                    } catch (RuntimeException e) {
                        LOG.warnv("MCP reconnect to {0} failed: {1}", streamUri, e.getMessage());
                    }
                },
                config.getReconnectDelay().toMillis(),
                TimeUnit.MILLISECONDS);
    }

    private void startHeartbeat() {
        if (heartbeat != null) {
            return;
        }
        long interval = config.getHeartbeatInterval().toMillis();
        heartbeat =
                scheduler.scheduleAtFixedRate(this::ping, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void ping() {
        if (!isConnected()) {
            return;
        }
        try {
            request("ping", Map.of(), CancellationToken.create());
        } catch (RuntimeException e) {
            LOG.debugv("MCP ping failed: {0}", e.getMessage());
        }
    }

    private void closeStream() {
        InputStream current = stream;
        stream = null;
        if (current != null) {
            closeQuietly(current);
        }
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            LOG.debugv("Closing event stream failed: {0}", e.getMessage());
        }
    }
}
