package io.agentloom.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.reasoning.Message;
import io.agentloom.core.reasoning.ToolCallRequest;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LangChain4jMessagesTest {

    private static ToolCallRequest call(String id, String name, String json) {
        return new ToolCallRequest(id, name, Map.of(), json);
    }

    @Nested
    class Transcript {

        @Test
        void shouldConvertSystemAndUserMessages() {
            List<ChatMessage> converted = LangChain4jMessages.toChatMessages(List.of(
                    new Message.SystemMessage("rules"), new Message.UserMessage("task")));

            assertThat(converted).hasSize(2);
            assertThat(((SystemMessage) converted.get(0)).text()).isEqualTo("rules");
            assertThat(((UserMessage) converted.get(1)).singleText()).isEqualTo("task");
        }

        @Test
        void shouldConvertAssistantCallsToExecutionRequests() {
            Message.AssistantMessage assistant = new Message.AssistantMessage(
                    "looking", List.of(call("c1", "search", "{\"q\":\"x\"}")));

            AiMessage converted = LangChain4jMessages.toAiMessage(assistant);

            assertThat(converted.text()).isEqualTo("looking");
            assertThat(converted.toolExecutionRequests()).singleElement().satisfies(request -> {
                assertThat(request.id()).isEqualTo("c1");
                assertThat(request.name()).isEqualTo("search");
                assertThat(request.arguments()).isEqualTo("{\"q\":\"x\"}");
            });
        }

        @Test
        void shouldConvertCallOnlyAssistantMessage() {
            AiMessage converted = LangChain4jMessages.toAiMessage(
                    new Message.AssistantMessage(null, List.of(call("c1", "search", "{}"))));

            assertThat(converted.text()).isNull();
            assertThat(converted.hasToolExecutionRequests()).isTrue();
        }

        @Test
        void shouldEmitOneResultMessagePerCall() {
            Message.ToolResultMessage results = new Message.ToolResultMessage(List.of(
                    new Message.ToolResult("c1", "search", CapabilityResult.text("found")),
                    new Message.ToolResult("c2", "fetch", CapabilityResult.text(""))));

            List<ChatMessage> converted = LangChain4jMessages.toChatMessages(List.of(results));

            assertThat(converted).hasSize(2);
            ToolExecutionResultMessage first = (ToolExecutionResultMessage) converted.get(0);
            assertThat(first.id()).isEqualTo("c1");
            assertThat(first.toolName()).isEqualTo("search");
            assertThat(first.text()).isEqualTo("found");
            assertThat(((ToolExecutionResultMessage) converted.get(1)).text())
                    .isEqualTo(LangChain4jMessages.EMPTY_RESULT);
        }

        @Test
        void shouldAppendMediaAsUserMessage() {
            CapabilityResult screenshot = new CapabilityResult(
                    List.of(new CapabilityResult.Content.Text("shot"),
                            new CapabilityResult.Content.Media("image/png", "aGVsbG8=")),
                    false);

            List<ChatMessage> converted = LangChain4jMessages.toChatMessages(List.of(
                    new Message.ToolResultMessage(
                            List.of(new Message.ToolResult("c1", "screenshot", screenshot)))));

            assertThat(converted).hasSize(2);
            UserMessage media = (UserMessage) converted.get(1);
            assertThat(media.contents()).hasSize(2);
            assertThat(media.contents().get(1)).isInstanceOf(ImageContent.class);
        }
    }

    @Nested
    class Capabilities {

        @Test
        void shouldConvertSchemaProperties() {
            Map<String, Object> schema = Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "operation", Map.of("type", "string", "enum", List.of("read", "write")),
                            "name", Map.of("type", "string", "description", "variable name"),
                            "count", Map.of("type", "integer"),
                            "tags", Map.of("type", "array", "items", Map.of("type", "string"))),
                    "required", List.of("operation", "missing"));

            List<ToolSpecification> specifications = LangChain4jMessages.toToolSpecifications(
                    List.of(new CapabilityDescriptor("variable_storage", "Stores", schema)));

            JsonObjectSchema parameters = specifications.get(0).parameters();
            assertThat(parameters.properties().get("operation")).isInstanceOf(JsonEnumSchema.class);
            assertThat(((JsonEnumSchema) parameters.properties().get("operation")).enumValues())
                    .containsExactly("read", "write");
            assertThat(parameters.properties().get("name")).isInstanceOf(JsonStringSchema.class);
            assertThat(parameters.properties().get("count")).isInstanceOf(JsonIntegerSchema.class);
            assertThat(((JsonArraySchema) parameters.properties().get("tags")).items())
                    .isInstanceOf(JsonStringSchema.class);
            assertThat(parameters.required()).containsExactly("operation");
        }

        @Test
        void shouldConvertNestedObjectProperties() {
            Map<String, Object> schema = Map.of(
                    "type", "object",
                    "properties", Map.of("viewport", Map.of(
                            "type", "object",
                            "properties", Map.of("width", Map.of("type", "integer")))));

            JsonObjectSchema converted = JsonSchemaConverter.toObjectSchema(schema);

            JsonObjectSchema viewport = (JsonObjectSchema) converted.properties().get("viewport");
            assertThat(viewport.properties().get("width")).isInstanceOf(JsonIntegerSchema.class);
        }

        @Test
        void shouldUseFirstNonNullTypeOfUnion() {
            assertThat(JsonSchemaConverter.toElement(
                            Map.of("type", List.of("null", "integer"))))
                    .isInstanceOf(JsonIntegerSchema.class);
        }

        @Test
        void shouldFallBackToEmptyObjectForNonObjectSchema() {
            JsonObjectSchema schema = JsonSchemaConverter.toObjectSchema(Map.of("type", "string"));

            assertThat(schema.properties()).isEmpty();
        }
    }
}
