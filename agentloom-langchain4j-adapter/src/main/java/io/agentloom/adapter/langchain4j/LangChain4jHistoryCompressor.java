package io.agentloom.adapter.langchain4j;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.reasoning.HistoryCompressor;
import io.agentloom.core.reasoning.Message;
import io.agentloom.core.reasoning.SlidingWindowCompressor;
import io.agentloom.core.reasoning.ToolCallRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link HistoryCompressor} that replaces the middle of a transcript with a summary
/// written by a LangChain4j {@link ChatModel}.
///
/// The system message, the first user message and the `keepRecent` latest messages
/// are kept as they are. Everything in between is rendered as plain text and
/// summarized. When the model fails or returns nothing, the
/// {@link SlidingWindowCompressor} is used instead.
///
/// ### Contracts
/// - **Postcondition**: the kept tail never starts with tool results, so every result
///   keeps its call
/// - **Postcondition**: the summary is at most `maxSummaryChars` characters
///
/// @implNote Thread-safe if the wrapped model is.
public class LangChain4jHistoryCompressor implements HistoryCompressor {

    private static final Logger logger =
            Logger.getLogger(LangChain4jHistoryCompressor.class.getName());

    static final int DEFAULT_KEEP_RECENT = 6;
    static final int DEFAULT_MAX_SUMMARY_CHARS = 2000;
    static final int MAX_RENDERED_RESULT_CHARS = 1000;
    static final String SUMMARY_PREFIX = "Summary of the earlier conversation:\n";

    private static final String SUMMARY_INSTRUCTIONS =
            "You compress the working history of an autonomous agent. Summarize what was"
                    + " attempted, which capabilities were called with which outcome, and which"
                    + " facts were learned. Keep names, ids, numbers and unresolved problems."
                    + " Answer with the summary only.";

    private final ChatModel model;
    private final int keepRecent;
    private final int maxSummaryChars;
    private final HistoryCompressor fallback;

    public LangChain4jHistoryCompressor(ChatModel model) {
        this(model, DEFAULT_KEEP_RECENT, DEFAULT_MAX_SUMMARY_CHARS);
    }

    /// @param model summarizing model, not null
    /// @param keepRecent latest messages kept verbatim, must be positive
    /// @param maxSummaryChars summary length cap, must be positive
    public LangChain4jHistoryCompressor(ChatModel model, int keepRecent, int maxSummaryChars) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        if (keepRecent < 1 || maxSummaryChars < 1) {
            throw new IllegalArgumentException("keepRecent and maxSummaryChars must be positive");
        }
        this.keepRecent = keepRecent;
        this.maxSummaryChars = maxSummaryChars;
        this.fallback = new SlidingWindowCompressor(keepRecent);
    }

    @Override
    public List<Message> compress(
            String agentId,
            List<Message> messages,
            List<CapabilityDescriptor> capabilities,
            CancellationToken cancellation) {
        int head = headSize(messages);
        int start = Math.max(head, messages.size() - keepRecent);
        while (start > head && messages.get(start) instanceof Message.ToolResultMessage) {
            start--;
        }
        if (start <= head) {
            return List.copyOf(messages);
        }

        cancellation.throwIfCancelled();
        String summary;
        try {
            summary = summarize(messages.subList(head, start));
        } catch (TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warning("Summarizing history of agent " + agentId
                    + " failed, falling back to a sliding window: " + e.getMessage());
            return fallback.compress(agentId, messages, capabilities, cancellation);
        }
        cancellation.throwIfCancelled();
        if (summary == null || summary.isBlank()) {
            logger.warning("Empty summary for agent " + agentId + ", using a sliding window");
            return fallback.compress(agentId, messages, capabilities, cancellation);
        }

        List<Message> compressed = new ArrayList<>(messages.subList(0, head));
        compressed.add(new Message.UserMessage(SUMMARY_PREFIX + truncate(summary.trim())));
        compressed.addAll(messages.subList(start, messages.size()));
        logger.fine("Summarized " + (start - head) + " messages of agent " + agentId);
        return compressed;
    }

    private String summarize(List<Message> middle) {
        List<ChatMessage> request = List.of(
                SystemMessage.from(SUMMARY_INSTRUCTIONS), UserMessage.from(render(middle)));
        ChatResponse response = model.chat(request);
        if (response == null || response.aiMessage() == null) {
            return null;
        }
        return response.aiMessage().text();
    }

    /// Renders messages as a plain dialogue for the summarizer.
    static String render(List<Message> messages) {
        var sb = new StringBuilder();
        for (Message message : messages) {
            if (message instanceof Message.SystemMessage system) {
                sb.append("system: ").append(system.text()).append('\n');
            } else if (message instanceof Message.UserMessage user) {
                sb.append("user: ").append(user.text()).append('\n');
            } else if (message instanceof Message.AssistantMessage assistant) {
                if (assistant.text() != null && !assistant.text().isEmpty()) {
                    sb.append("assistant: ").append(assistant.text()).append('\n');
                }
                for (ToolCallRequest call : assistant.toolCalls()) {
                    sb.append("call ").append(call.name()).append(' ')
                            .append(call.rawArguments()).append('\n');
                }
            } else if (message instanceof Message.ToolResultMessage results) {
                for (Message.ToolResult result : results.results()) {
                    sb.append("result of ").append(result.name())
                            .append(result.result().error() ? " (error)" : "").append(": ")
                            .append(clip(result.result().text(), MAX_RENDERED_RESULT_CHARS))
                            .append('\n');
                }
            }
        }
        return sb.toString();
    }

    private String truncate(String summary) {
        return clip(summary, maxSummaryChars);
    }

    private static String clip(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    private static int headSize(List<Message> messages) {
        int head = 0;
        if (!messages.isEmpty() && messages.get(0) instanceof Message.SystemMessage) {
            head++;
        }
        if (messages.size() > head && messages.get(head) instanceof Message.UserMessage) {
            head++;
        }
        return head;
    }
}
