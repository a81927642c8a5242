package io.agentloom.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.capability.CapabilityResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonRpcTest {

    private final JsonRpc jsonRpc = new JsonRpc(new ObjectMapper());

    private JsonNode parse(String json) {
        return jsonRpc.parse(json);
    }

    @Nested
    class Outgoing {

        @Test
        void shouldCreateRequestWithIdFirst() {
            String request = jsonRpc.createRequest("r1", "tools/call", Map.of("name", "search"));

            assertThat(request)
                    .isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":\"r1\",\"method\":\"tools/call\",\"params\":{\"name\":\"search\"}}");
        }

        @Test
        void shouldCreateNotificationWithEmptyParams() {
            String notification = jsonRpc.createNotification("notifications/initialized", null);

            assertThat(parse(notification).has("id")).isFalse();
            assertThat(parse(notification).get("params").isEmpty()).isTrue();
        }
    }

    @Nested
    class Incoming {

        @Test
        void shouldIgnoreNonObjectMessages() {
            assertThat(parse("not json")).isNull();
            assertThat(parse("[1, 2]")).isNull();
        }

        @Test
        void shouldReadResponseIdOnlyFromResponses() {
            assertThat(jsonRpc.responseId(parse("{\"id\":7,\"result\":{}}"))).isEqualTo("7");
            assertThat(jsonRpc.responseId(parse("{\"id\":\"s1\",\"method\":\"sampling/createMessage\"}"))).isNull();
            assertThat(jsonRpc.responseId(parse("{\"method\":\"notifications/progress\"}"))).isNull();
        }

        @Test
        void shouldFailOnProtocolError() {
            JsonNode response = parse("{\"id\":\"1\",\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}");

            assertThatThrownBy(() -> jsonRpc.result("tools/list", response))
                    .isInstanceOf(McpException.class)
                    .hasMessage("MCP tools/list error: Method not found")
                    .extracting(e -> ((McpException) e).getMethod())
                    .isEqualTo("tools/list");
        }

        @Test
        void shouldFailOnToolErrorResult() {
            JsonNode response = parse(
                    "{\"id\":\"1\",\"result\":{\"isError\":true,\"content\":[{\"type\":\"text\",\"text\":\"page not found\"}]}}");

            assertThatThrownBy(() -> jsonRpc.result("tools/call", response))
                    .isInstanceOf(McpException.class)
                    .hasMessage("MCP tools/call error: page not found");
        }

        @Test
        void shouldTreatMissingResultAsEmpty() {
            assertThat(jsonRpc.result("ping", parse("{\"id\":\"1\"}")).isEmpty()).isTrue();
        }
    }

    @Nested
    class Conversion {

        @Test
        void shouldConvertToolList() {
            JsonNode result = parse("{\"tools\":["
                    + "{\"name\":\"navigate\",\"description\":\"Opens a page\","
                    + "\"inputSchema\":{\"type\":\"object\",\"properties\":{\"url\":{\"type\":\"string\"}}}},"
                    + "{\"name\":\"screenshot\"}]}");

            List<CapabilityDescriptor> descriptors = jsonRpc.toDescriptors(result);

            assertThat(descriptors).extracting(CapabilityDescriptor::name).containsExactly("navigate", "screenshot");
            assertThat(descriptors.get(0).inputSchema()).containsKey("properties");
            assertThat(descriptors.get(1).description()).isEmpty();
        }

        @Test
        void shouldSkipToolsWithoutName() {
            JsonNode result = parse("{\"tools\":["
                    + "{\"name\":\"navigate\"},"
                    + "{\"description\":\"nameless\"},"
                    + "{\"name\":\"  \"},"
                    + "{\"name\":\"screenshot\"}]}");

            List<CapabilityDescriptor> descriptors = jsonRpc.toDescriptors(result);

            assertThat(descriptors).extracting(CapabilityDescriptor::name).containsExactly("navigate", "screenshot");
        }

        @Test
        void shouldConvertContentParts() {
            JsonNode result = parse("{\"content\":["
                    + "{\"type\":\"text\",\"text\":\"captured\"},"
                    + "{\"type\":\"image\",\"mimeType\":\"image/jpeg\",\"data\":\"aGk=\"},"
                    + "{\"type\":\"resource\",\"uri\":\"file:///a\"}]}");

            CapabilityResult converted = jsonRpc.toCapabilityResult(result);

            assertThat(converted.content()).hasSize(3);
            assertThat(converted.content().get(1)).isEqualTo(new CapabilityResult.Content.Media("image/jpeg", "aGk="));
            assertThat(converted.text()).startsWith("captured\n").contains("file:///a");
            assertThat(converted.error()).isFalse();
        }

        @Test
        void shouldAcceptPlainTextContent() {
            assertThat(jsonRpc.toCapabilityResult(parse("{\"content\":\"done\"}")).text()).isEqualTo("done");
        }
    }
}
