package io.agentloom.adapter.langchain4j;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.reasoning.FinishReason;
import io.agentloom.core.reasoning.ReasoningEngine;
import io.agentloom.core.reasoning.ReasoningEvent;
import io.agentloom.core.reasoning.ReasoningRequest;
import io.agentloom.core.reasoning.ToolChoice;
import io.agentloom.core.reasoning.Usage;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// {@link ReasoningEngine} over a LangChain4j {@link StreamingChatModel}.
///
/// The model reports on its own threads. Its callbacks only enqueue events; the
/// calling thread drains the queue into the sink, so the sink sees events in order
/// and never after {@link #stream} returns.
///
/// ### Event mapping
/// - `onPartialResponse` → {@link ReasoningEvent.TextDelta}
/// - `onCompleteResponse` → `TextEnd`, one `ToolCall` per tool execution request, `Finish`
/// - `onError` → {@link ReasoningEvent.StreamError}
///
/// Cancellation is checked between events. A cancelled request is abandoned; the
/// model may still finish in the background, but its output is discarded.
///
/// @implNote Thread-safe. Each {@link #stream} call owns its own queue.
///
/// @see LangChain4jModelFactory for model creation
public class LangChain4jReasoningEngine implements ReasoningEngine {

    private static final Logger logger =
            Logger.getLogger(LangChain4jReasoningEngine.class.getName());

    static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofMinutes(10);

    private final StreamingChatModel model;
    private final Duration responseTimeout;

    public LangChain4jReasoningEngine(StreamingChatModel model) {
        this(model, DEFAULT_RESPONSE_TIMEOUT);
    }

    /// @param model streaming chat model, not null
    /// @param responseTimeout longest silence tolerated between two events, not null
    public LangChain4jReasoningEngine(StreamingChatModel model, Duration responseTimeout) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.responseTimeout =
                Objects.requireNonNull(responseTimeout, "responseTimeout must not be null");
    }

    @Override
    public void stream(
            ReasoningRequest request,
            Consumer<ReasoningEvent> sink,
            CancellationToken cancellation)
            throws Exception {
        cancellation.throwIfCancelled();
        BlockingQueue<ReasoningEvent> queue = new LinkedBlockingQueue<>();
        logger.fine("Streaming " + request.messages().size() + " messages for agent "
                + request.agentId());

        model.chat(toChatRequest(request), new QueueingHandler(queue));

        long idleLimit = responseTimeout.toNanos();
        long idle = 0;
        while (true) {
            if (cancellation.isCancelled()) {
                throw new TaskCancelledException(cancellation.reason());
            }
            ReasoningEvent event;
            try {
                event = queue.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskCancelledException("Interrupted while streaming", e);
            }
            if (event == null) {
                idle += POLL_INTERVAL.toNanos();
                if (idle >= idleLimit) {
                    throw new TimeoutException(
                            "No response from model within " + responseTimeout.toSeconds() + "s");
                }
                continue;
            }
            idle = 0;
            sink.accept(event);
            if (event instanceof ReasoningEvent.Finish
                    || event instanceof ReasoningEvent.StreamError) {
                return;
            }
        }
    }

    static ChatRequest toChatRequest(ReasoningRequest request) {
        var builder =
                ChatRequest.builder().messages(LangChain4jMessages.toChatMessages(request.messages()));
        if (request.toolChoice() != ToolChoice.NONE && !request.capabilities().isEmpty()) {
            builder.toolSpecifications(
                    LangChain4jMessages.toToolSpecifications(request.capabilities()));
            if (request.toolChoice() == ToolChoice.REQUIRED) {
                builder.toolChoice(dev.langchain4j.model.chat.request.ToolChoice.REQUIRED);
            }
        }
        return builder.build();
    }

    static FinishReason toFinishReason(
            dev.langchain4j.model.output.FinishReason reason, boolean hasToolCalls) {
        if (reason == null) {
            return hasToolCalls ? FinishReason.TOOL_CALLS : FinishReason.STOP;
        }
        return switch (reason) {
            case STOP -> FinishReason.STOP;
            case LENGTH -> FinishReason.LENGTH;
            case TOOL_EXECUTION -> FinishReason.TOOL_CALLS;
            case CONTENT_FILTER -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.OTHER;
        };
    }

    static Usage toUsage(TokenUsage usage) {
        if (usage == null) {
            return Usage.EMPTY;
        }
        return new Usage(
                orZero(usage.inputTokenCount()),
                orZero(usage.outputTokenCount()),
                orZero(usage.totalTokenCount()));
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    /// Enqueues model callbacks for the draining thread.
    private static final class QueueingHandler implements StreamingChatResponseHandler {
        private final BlockingQueue<ReasoningEvent> queue;
        private final AtomicBoolean streamedText = new AtomicBoolean();

        QueueingHandler(BlockingQueue<ReasoningEvent> queue) {
            this.queue = queue;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (partialResponse != null && !partialResponse.isEmpty()) {
                streamedText.set(true);
                queue.add(new ReasoningEvent.TextDelta(partialResponse));
            }
        }

        @Override
        public void onCompleteResponse(ChatResponse response) {
            AiMessage message = response.aiMessage();
            String text = message != null ? message.text() : null;
            if (!streamedText.get() && text != null && !text.isEmpty()) {
                queue.add(new ReasoningEvent.TextDelta(text));
                streamedText.set(true);
            }
            if (streamedText.get()) {
                queue.add(new ReasoningEvent.TextEnd());
            }
            boolean hasToolCalls = message != null && message.hasToolExecutionRequests();
            if (hasToolCalls) {
                for (ToolExecutionRequest request : message.toolExecutionRequests()) {
                    String id = request.id() != null ? request.id() : UUID.randomUUID().toString();
                    queue.add(new ReasoningEvent.ToolCall(id, request.name(), request.arguments()));
                }
            }
            queue.add(
                    new ReasoningEvent.Finish(
                            toFinishReason(response.metadata().finishReason(), hasToolCalls),
                            toUsage(response.metadata().tokenUsage())));
        }

        @Override
        public void onError(Throwable error) {
            queue.add(new ReasoningEvent.StreamError(error));
        }
    }
}
