package io.agentloom.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SseMcpClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> methods = new CopyOnWriteArrayList<>();
    private final List<String> authorizations = new CopyOnWriteArrayList<>();
    private final AtomicInteger streams = new AtomicInteger();
    private final Object streamLock = new Object();
    private ExecutorService serverPool;
    private HttpServer server;
    private HttpExchange streamExchange;
    private SseMcpClient client;

    @BeforeEach
    void startServer() throws IOException {
        serverPool = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(serverPool);
        server.createContext("/sse", this::openStream);
        server.createContext("/message", this::handleMessage);
        server.start();
        client = client("/sse", Duration.ofSeconds(2));
    }

    @AfterEach
    void stopServer() {
        client.close();
        server.stop(0);
        serverPool.shutdownNow();
    }

    private SseMcpClient client(String path, Duration requestTimeout) {
        McpClientConfig config = McpClientConfig.builder()
                .connectTimeout(Duration.ofSeconds(2))
                .requestTimeout(requestTimeout)
                .heartbeatInterval(Duration.ofMinutes(1))
                .reconnectDelay(Duration.ofMillis(50))
                .header("Authorization", "Bearer test-token")
                .build();
        return new SseMcpClient(URI.create(baseUrl() + path), new JsonRpc(mapper), config);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    // --- fake MCP server -----------------------------------------------------

    private void openStream(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "text/event-stream");
        exchange.sendResponseHeaders(200, 0);
        int session = streams.incrementAndGet();
        synchronized (streamLock) {
            streamExchange = exchange;
            pushEvent("endpoint", "/message?sessionId=" + session);
        }
    }

    private void handleMessage(HttpExchange exchange) throws IOException {
        JsonNode message = mapper.readTree(exchange.getRequestBody().readAllBytes());
        methods.add(message.path("method").asText());
        authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));

        byte[] accepted = "Accepted".getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(202, accepted.length);
        try (OutputStream body = exchange.getResponseBody()) {
            body.write(accepted);
        }

        JsonNode result = result(message);
        if (message.has("id") && result != null) {
            ObjectNode response = mapper.createObjectNode();
            response.put("jsonrpc", "2.0");
            response.set("id", message.get("id"));
            response.set("result", result);
            synchronized (streamLock) {
                pushEvent("message", response.toString());
            }
        }
    }

    private JsonNode result(JsonNode message) throws IOException {
        String tool = message.path("params").path("name").asText();
        switch (message.path("method").asText()) {
            case "initialize":
                return mapper.readTree("{\"protocolVersion\":\"2024-11-05\",\"capabilities\":{}}");
            case "tools/list":
                return mapper.readTree("{\"tools\":[{\"name\":\"search\",\"description\":\"Searches the web\","
                        + "\"inputSchema\":{\"type\":\"object\",\"properties\":{\"q\":{\"type\":\"string\"}}}}]}");
            case "tools/call":
                if ("silent".equals(tool)) {
                    return null;
                }
                if ("broken".equals(tool)) {
                    return mapper.readTree("{\"isError\":true,\"content\":[{\"type\":\"text\",\"text\":\"boom\"}]}");
                }
                String query = message.path("params").path("arguments").path("q").asText();
                return mapper.readTree("{\"content\":[{\"type\":\"text\",\"text\":\"results for " + query + "\"}]}");
            default:
                return mapper.createObjectNode();
        }
    }

    private void pushEvent(String event, String data) {
        try {
            OutputStream body = streamExchange.getResponseBody();
            body.write(("event: " + event + "\ndata: " + data + "\n\n").getBytes(StandardCharsets.UTF_8));
            body.flush();
        } catch (IOException e) {
            throw new IllegalStateException("event stream closed", e);
        }
    }

    private void dropStream() {
        synchronized (streamLock) {
            streamExchange.close();
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    // --- tests ---------------------------------------------------------------

    @Nested
    class Connect {

        @Test
        void shouldHandshakeAndResolveEndpoint() {
            client.connect(CancellationToken.create());

            assertThat(client.isConnected()).isTrue();
            assertThat(client.getMessageUri()).isEqualTo(URI.create(baseUrl() + "/message?sessionId=1"));
            assertThat(methods).containsExactly("initialize", "notifications/initialized");
        }

        @Test
        void shouldSendConfiguredHeaders() {
            client.connect(CancellationToken.create());

            assertThat(authorizations).containsOnly("Bearer test-token");
        }

        @Test
        void shouldFailWhenStreamIsRejected() {
            SseMcpClient missing = client("/missing", Duration.ofSeconds(2));
            try {
                assertThatThrownBy(() -> missing.connect(CancellationToken.create()))
                        .isInstanceOf(McpException.class)
                        .hasMessageStartingWith("Failed to connect to MCP server at");
                assertThat(missing.isConnected()).isFalse();
            } finally {
                missing.close();
            }
        }
    }

    @Nested
    class Requests {

        @BeforeEach
        void connect() {
            client.connect(CancellationToken.create());
        }

        @Test
        void shouldListCapabilities() {
            List<CapabilityDescriptor> descriptors = client.listCapabilities(Map.of(), CancellationToken.create());

            assertThat(descriptors).singleElement().satisfies(descriptor -> {
                assertThat(descriptor.name()).isEqualTo("search");
                assertThat(descriptor.description()).isEqualTo("Searches the web");
            });
        }

        @Test
        void shouldInvokeCapability() {
            String text = client.invoke("search", Map.of("q", "lisbon"), CancellationToken.create()).text();

            assertThat(text).isEqualTo("results for lisbon");
        }

        @Test
        void shouldRaiseProviderErrorResult() {
            assertThatThrownBy(() -> client.invoke("broken", Map.of(), CancellationToken.create()))
                    .isInstanceOf(McpException.class)
                    .hasMessage("MCP tools/call error: boom");
        }

        @Test
        void shouldStopWaitingWhenCancelled() {
            CancellationToken token = CancellationToken.create();
            CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS).execute(() -> token.cancel("user stop"));

            assertThatThrownBy(() -> client.invoke("silent", Map.of(), token))
                    .isInstanceOf(TaskCancelledException.class)
                    .hasMessage("user stop");
        }

        @Test
        void shouldTimeOutWithoutResponse() {
            SseMcpClient impatient = client("/sse", Duration.ofMillis(300));
            try {
                impatient.connect(CancellationToken.create());

                assertThatThrownBy(() -> impatient.invoke("silent", Map.of(), CancellationToken.create()))
                        .isInstanceOf(McpException.class)
                        .hasMessage("MCP tools/call error: no response after 300ms");
            } finally {
                impatient.close();
            }
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldReconnectAfterStreamLoss() throws Exception {
            client.connect(CancellationToken.create());

            dropStream();
            awaitCondition(() -> streams.get() == 2 && client.isConnected());

            assertThat(client.getMessageUri()).isEqualTo(URI.create(baseUrl() + "/message?sessionId=2"));
            assertThat(client.invoke("search", Map.of("q", "porto"), CancellationToken.create()).text())
                    .isEqualTo("results for porto");
        }

        @Test
        void shouldNotifyServerOnClose() {
            client.connect(CancellationToken.create());

            client.close();

            assertThat(client.isConnected()).isFalse();
            assertThat(methods).endsWith("notifications/cancelled");
            assertThatThrownBy(() -> client.connect(CancellationToken.create()))
                    .isInstanceOf(McpException.class)
                    .hasMessage("MCP initialize error: client is closed");
        }
    }
}
