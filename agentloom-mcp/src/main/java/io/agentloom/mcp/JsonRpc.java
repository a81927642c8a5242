package io.agentloom.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.capability.CapabilityResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// JSON-RPC 2.0 helper for MCP protocol messages.
///
/// Creates outgoing messages and interprets responses. Both transports use the
/// same message shape and differ only in framing.
///
/// ### Message Types
/// - **Request**: Has `id`, `method`, `params` - expects a response
/// - **Notification**: Has `method`, `params` - no response expected
/// - **Response**: Has `id`, `result` or `error`
///
/// @see SseMcpClient
/// @see StdioMcpClient
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
public class JsonRpc {

    private static final Logger LOG = Logger.getLogger(JsonRpc.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /// Creates a JSON-RPC request (expects a response).
    ///
    /// @param id unique request identifier for response correlation
    /// @param method the method to invoke (e.g., "tools/call")
    /// @param params method parameters
    /// @return JSON-RPC request string
    public String createRequest(String id, String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("id", id);
        root.put("method", method);
        root.set("params", mapper.valueToTree(params != null ? params : Map.of()));
        return root.toString();
    }

    /// Creates a JSON-RPC notification (no response expected).
    ///
    /// @param method the method to invoke
    /// @param params method parameters
    /// @return JSON-RPC notification string
    public String createNotification(String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("method", method);
        root.set("params", mapper.valueToTree(params != null ? params : Map.of()));
        return root.toString();
    }

    /// Parses one incoming message.
    ///
    /// @param json raw message
    /// @return the message tree, or null if it is not a JSON object
    public JsonNode parse(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /// Extracts the correlation id of a response.
    ///
    /// @param message parsed message, not null
    /// @return the id as text, or null for notifications and server requests
    public String responseId(JsonNode message) {
        if (message.has("method")) {
            return null;
        }
        JsonNode id = message.get("id");
        return id != null && !id.isNull() ? id.asText() : null;
    }

    /// Extracts the result of a response, failing on protocol and tool errors.
    ///
    /// @param method method the response answers, used in error messages
    /// @param message parsed response, not null
    /// @return the `result` object, never null (empty when absent)
    /// @throws McpException if the response carries an `error`, or a result with `isError: true`
    public JsonNode result(String method, JsonNode message) {
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            String detail =
                    error.isTextual()
                            ? error.asText()
                            : error.path("message").asText("Unknown error");
            throw new McpException(method, detail);
        }
        JsonNode result = message.get("result");
        if (result == null || result.isNull()) {
            return mapper.createObjectNode();
        }
        if (result.path("isError").asBoolean(false)) {
            JsonNode content = result.get("content");
            String detail;
            if (content == null || content.isNull()) {
                detail = result.toString();
            } else if (content.isTextual()) {
                detail = content.asText();
            } else {
                detail = content.path(0).path("text").asText(content.toString());
            }
            throw new McpException(method, detail);
        }
        return result;
    }

    /// Converts a `tools/list` result into descriptors.
    ///
    /// Entries without a name are skipped.
    ///
    /// @param result the result object, not null
    /// @return descriptors in provider order, never null
    public List<CapabilityDescriptor> toDescriptors(JsonNode result) {
        List<CapabilityDescriptor> descriptors = new ArrayList<>();
        for (JsonNode tool : result.path("tools")) {
            try {
                descriptors.add(CapabilityDescriptor.fromMap(mapper.convertValue(tool, MAP_TYPE)));
            } catch (IllegalArgumentException e) {
                LOG.warnv("Skipping tool without name: {0}", tool);
            }
        }
        return descriptors;
    }

    /// Converts a `tools/call` result into a capability result.
    ///
    /// Text parts stay text, `image` parts become media, any other part is kept as
    /// its JSON text.
    ///
    /// @param result the result object, not null
    /// @return converted result, never null
    public CapabilityResult toCapabilityResult(JsonNode result) {
        List<CapabilityResult.Content> parts = new ArrayList<>();
        JsonNode content = result.get("content");
        if (content != null && content.isTextual()) {
            parts.add(new CapabilityResult.Content.Text(content.asText()));
        } else if (content != null) {
            for (JsonNode part : content) {
                String type = part.path("type").asText();
                if ("text".equals(type)) {
                    parts.add(new CapabilityResult.Content.Text(part.path("text").asText()));
                } else if ("image".equals(type)) {
                    parts.add(new CapabilityResult.Content.Media(
                            part.path("mimeType").asText("image/png"),
                            part.path("data").asText()));
                } else {
                    parts.add(new CapabilityResult.Content.Text(part.toString()));
                }
            }
        }
        return new CapabilityResult(parts, false);
    }
}
