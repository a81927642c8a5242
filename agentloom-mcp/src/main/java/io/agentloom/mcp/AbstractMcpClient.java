package io.agentloom.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentloom.core.capability.CapabilityClient;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.execution.CancellationToken;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.jboss.logging.Logger;

/// Transport-independent part of an MCP client.
///
/// Implements request/response correlation, the `initialize` handshake and the
/// `tools/list` / `tools/call` mapping. Subclasses only deliver outgoing messages
/// ({@link #send}) and feed incoming ones to {@link #onMessage(String)}.
///
/// ### Request flow
/// ```
/// request(method) ─register id─> PendingRequests
///        │ send(message)                 ^
///        v                               │ complete(id)
///    transport ─────response────> onMessage(raw)
/// ```
///
/// @implNote Thread-safe. Requests from several threads share one connection.
public abstract class AbstractMcpClient implements CapabilityClient {

    private static final Logger LOG = Logger.getLogger(AbstractMcpClient.class);

    protected final JsonRpc jsonRpc;
    protected final McpClientConfig config;
    protected final PendingRequests pending = new PendingRequests();

    protected AbstractMcpClient(JsonRpc jsonRpc, McpClientConfig config) {
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public List<CapabilityDescriptor> listCapabilities(
            Map<String, Object> filter, CancellationToken cancellation) {
        return jsonRpc.toDescriptors(request("tools/list", filter, cancellation));
    }

    @Override
    public CapabilityResult invoke(
            String name, Map<String, Object> arguments, CancellationToken cancellation) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());
        return jsonRpc.toCapabilityResult(request("tools/call", params, cancellation));
    }

    /// Sends a request and waits for its result.
    ///
    /// @param method JSON-RPC method, not null
    /// @param params parameters, may be null
    /// @param cancellation aborts the wait, not null
    /// @return the `result` object, never null
    /// @throws McpException on transport failure, timeout or provider error
    protected JsonNode request(String method, Object params, CancellationToken cancellation) {
        cancellation.throwIfCancelled();
        String id = UUID.randomUUID().toString();
        pending.register(id);
        LOG.debugv("MCP request {0} {1}", method, id);
        try {
            send(method, jsonRpc.createRequest(id, method, params), cancellation);
        } catch (RuntimeException e) {
            pending.discard(id);
            throw e;
        }
        JsonNode response = pending.await(id, method, config.getRequestTimeout(), cancellation);
        return jsonRpc.result(method, response);
    }

    /// Sends a notification; no response is expected.
    ///
    /// @param method JSON-RPC method, not null
    /// @param params parameters, may be null
    /// @param cancellation aborts the send, not null
    protected void sendNotification(String method, Object params, CancellationToken cancellation) {
        send(method, jsonRpc.createNotification(method, params), cancellation);
    }

    /// Performs the MCP handshake: `initialize`, then `notifications/initialized`.
    ///
    /// @param cancellation aborts the handshake, not null
    protected void handshake(CancellationToken cancellation) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", config.getProtocolVersion());
        params.put("capabilities", Map.of("tools", Map.of("listChanged", true), "sampling", Map.of()));
        params.put("clientInfo", Map.of("name", config.getClientName(), "version", "1.0.0"));
        request("initialize", params, cancellation);
        try {
            sendNotification("notifications/initialized", Map.of(), cancellation);
        } catch (McpException e) {
            LOG.debugv("initialized notification rejected: {0}", e.getMessage());
        }
    }

    /// Routes one incoming message to the request awaiting it.
    ///
    /// @param raw raw JSON message
    protected void onMessage(String raw) {
        JsonNode message = jsonRpc.parse(raw);
        if (message == null) {
            LOG.debugv("Ignoring non-JSON message: {0}", raw);
            return;
        }
        String id = jsonRpc.responseId(message);
        if (id == null) {
            LOG.debugv("Ignoring server message: {0}", raw);
            return;
        }
        if (!pending.complete(id, message)) {
            LOG.debugv("No pending request for response {0}", id);
        }
    }

    /// Delivers one serialized message to the provider.
    ///
    /// @param method method of the message, for error reporting
    /// @param message serialized JSON-RPC message
    /// @param cancellation aborts the send, not null
    /// @throws McpException if the provider does not accept the message
    protected abstract void send(String method, String message, CancellationToken cancellation);
}
