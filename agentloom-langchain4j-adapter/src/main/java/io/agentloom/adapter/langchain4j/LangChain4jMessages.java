package io.agentloom.adapter.langchain4j;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.reasoning.Message;
import io.agentloom.core.reasoning.ToolCallRequest;
import java.util.ArrayList;
import java.util.List;

/// Translates agent transcripts and capability descriptors into LangChain4j types.
///
/// ### Mapping
/// | Agentloom | LangChain4j |
/// |---|---|
/// | `SystemMessage` | `SystemMessage` |
/// | `UserMessage` | `UserMessage` |
/// | `AssistantMessage` | `AiMessage` with `ToolExecutionRequest`s |
/// | `ToolResultMessage` | one `ToolExecutionResultMessage` per result |
///
/// Media parts of capability results cannot travel inside a tool result message;
/// they follow the results as one `UserMessage` of image contents.
public final class LangChain4jMessages {

    static final String EMPTY_RESULT = "(no output)";

    private LangChain4jMessages() {}

    /// Converts a transcript.
    ///
    /// @param messages transcript in order, not null
    /// @return chat messages in order, never null
    public static List<ChatMessage> toChatMessages(List<Message> messages) {
        List<ChatMessage> converted = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (message instanceof Message.SystemMessage system) {
                converted.add(SystemMessage.from(system.text()));
            } else if (message instanceof Message.UserMessage user) {
                converted.add(UserMessage.from(user.text()));
            } else if (message instanceof Message.AssistantMessage assistant) {
                converted.add(toAiMessage(assistant));
            } else if (message instanceof Message.ToolResultMessage results) {
                addToolResults(results, converted);
            }
        }
        return converted;
    }

    /// Converts capability descriptors to tool specifications.
    ///
    /// @param capabilities descriptors, not null
    /// @return specifications in the same order, never null
    public static List<ToolSpecification> toToolSpecifications(
            List<CapabilityDescriptor> capabilities) {
        List<ToolSpecification> specifications = new ArrayList<>(capabilities.size());
        for (CapabilityDescriptor capability : capabilities) {
            specifications.add(
                    ToolSpecification.builder()
                            .name(capability.name())
                            .description(capability.description())
                            .parameters(JsonSchemaConverter.toObjectSchema(capability.inputSchema()))
                            .build());
        }
        return specifications;
    }

    static AiMessage toAiMessage(Message.AssistantMessage assistant) {
        String text = assistant.text();
        if (!assistant.hasToolCalls()) {
            return AiMessage.from(text != null ? text : "");
        }
        List<ToolExecutionRequest> requests = new ArrayList<>(assistant.toolCalls().size());
        for (ToolCallRequest call : assistant.toolCalls()) {
            requests.add(
                    ToolExecutionRequest.builder()
                            .id(call.id())
                            .name(call.name())
                            .arguments(call.rawArguments())
                            .build());
        }
        return text == null || text.isEmpty()
                ? AiMessage.from(requests)
                : AiMessage.from(text, requests);
    }

    private static void addToolResults(
            Message.ToolResultMessage message, List<ChatMessage> converted) {
        List<Content> media = new ArrayList<>();
        for (Message.ToolResult result : message.results()) {
            String text = result.result().text();
            converted.add(
                    ToolExecutionResultMessage.from(
                            result.callId(), result.name(), text.isEmpty() ? EMPTY_RESULT : text));
            for (CapabilityResult.Content part : result.result().content()) {
                if (part instanceof CapabilityResult.Content.Media image) {
                    media.add(ImageContent.from(image.data(), image.mimeType()));
                }
            }
        }
        if (!media.isEmpty()) {
            media.add(0, TextContent.from("Media returned by the previous capability calls:"));
            converted.add(UserMessage.from(media));
        }
    }
}
