package io.agentloom.core.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.AgentloomConfig;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.event.LifecycleEvent;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.runtime.AgentContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/// Wraps the {@link ReasoningEngine} for one "generate next step" request.
///
/// ### Request flow
/// 1. Compress the transcript when it has `compressMessageThreshold` messages, or at least
///    `minMessagesForTokenCompression` messages and `compressTokenThreshold` estimated tokens
/// 2. Stream the response, translating engine events into ordered
///    {@link LifecycleEvent}s for the agent
/// 3. On a `LENGTH` finish with at least three messages, force compression and retry once
/// 4. On a transport failure, wait `reasoningBackoffBase × (retry + 1)²`, compress first
///    if the failure reports an oversized request, and retry up to `maxReasoningRetries`
///
/// A `CONTENT_FILTER` or `OTHER` finish is fatal and never retried.
///
/// @implNote Stateless apart from its collaborators; one gateway serves all agents.
///
/// @see ReasoningEngine for the streamed contract
/// @see HistoryCompressor for transcript compression
public class ReasoningGateway {

    private static final Logger logger = Logger.getLogger(ReasoningGateway.class.getName());

    /// Fragment of engine error messages indicating an oversized request.
    static final String OVERSIZED_REQUEST_MARKER = "is too long";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE =
            new TypeReference<>() {};

    private final ReasoningEngine engine;
    private final HistoryCompressor compressor;
    private final AgentloomConfig config;
    private final ObjectMapper mapper;

    /// Creates a gateway.
    ///
    /// @param engine reasoning engine, not null
    /// @param compressor transcript compressor, not null
    /// @param config thresholds and retry budget, not null
    /// @param mapper JSON mapper decoding call arguments, not null
    public ReasoningGateway(
            ReasoningEngine engine,
            HistoryCompressor compressor,
            AgentloomConfig config,
            ObjectMapper mapper) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.compressor = Objects.requireNonNull(compressor, "compressor must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Requests the agent's next step.
    ///
    /// @param context requesting agent, not null
    /// @param capabilities capabilities offered for this step, not null
    /// @param toolChoice call policy, may be null for {@link ToolChoice#AUTO}
    /// @return demultiplexed output, never null
    /// @throws ReasoningException if the engine fails fatally or retries are exhausted
    /// @throws TaskCancelledException if the task is cancelled
    public StepOutput generateStep(
            AgentContext context, List<CapabilityDescriptor> capabilities, ToolChoice toolChoice) {
        Transcript transcript = context.transcript();
        CancellationToken cancellation = context.task().cancellation();

        if (isOversized(transcript)) {
            compress(context, capabilities, "threshold exceeded");
        }

        int retry = 0;
        boolean lengthRetried = false;
        while (true) {
            cancellation.throwIfCancelled();
            try {
                StepOutput output = streamOnce(context, capabilities, toolChoice);
                if (output.finishReason() == FinishReason.LENGTH
                        && transcript.size() >= 3
                        && !lengthRetried) {
                    lengthRetried = true;
                    compress(context, capabilities, "response truncated by length");
                    continue;
                }
                return output;
            } catch (TaskCancelledException e) {
                throw e;
            } catch (ReasoningException e) {
                if (e.isFatal() || retry >= config.getMaxReasoningRetries()) {
                    throw e;
                }
                retry = backOff(context, capabilities, e, retry);
            } catch (Exception e) {
                if (cancellation.isCancelled()) {
                    throw new TaskCancelledException(cancellation.reason(), e);
                }
                if (retry >= config.getMaxReasoningRetries()) {
                    throw new ReasoningException(
                            "Reasoning engine failed after " + retry + " retries: " + e.getMessage(),
                            e,
                            false);
                }
                retry = backOff(context, capabilities, e, retry);
            }
        }
    }

    /// Returns whether the transcript has crossed a compression threshold.
    ///
    /// @param transcript transcript to measure, not null
    /// @return `true` if compression is due
    public boolean isOversized(Transcript transcript) {
        int size = transcript.size();
        if (size >= config.getCompressMessageThreshold()) {
            return true;
        }
        return size >= config.getMinMessagesForTokenCompression()
                && transcript.estimatedTokens() >= config.getCompressTokenThreshold();
    }

    private int backOff(
            AgentContext context,
            List<CapabilityDescriptor> capabilities,
            Exception error,
            int retry) {
        Duration delay = config.getReasoningBackoffBase().multipliedBy((long) (retry + 1) * (retry + 1));
        logger.warning(
                "Reasoning request of agent " + context.agentId() + " failed, retrying in "
                        + delay.toMillis() + "ms: " + error.getMessage());
        context.task().cancellation().sleep(delay);
        if (error.getMessage() != null && error.getMessage().contains(OVERSIZED_REQUEST_MARKER)) {
            compress(context, capabilities, "request too long");
        }
        return retry + 1;
    }

    private void compress(
            AgentContext context, List<CapabilityDescriptor> capabilities, String why) {
        Transcript transcript = context.transcript();
        int before = transcript.size();
        List<Message> compressed =
                compressor.compress(
                        context.agentId(),
                        transcript.messages(),
                        capabilities,
                        context.task().cancellation());
        transcript.replaceAll(compressed);
        logger.info(
                "Compressed transcript of agent " + context.agentId() + " (" + why + "): "
                        + before + " -> " + transcript.size() + " messages");
    }

    private StepOutput streamOnce(
            AgentContext context, List<CapabilityDescriptor> capabilities, ToolChoice toolChoice)
            throws Exception {
        ReasoningRequest request =
                new ReasoningRequest(
                        context.agentId(),
                        context.transcript().messages(),
                        capabilities,
                        toolChoice);
        StreamState state = new StreamState(context);
        engine.stream(request, state::accept, context.task().cancellation());
        return state.finish();
    }

    private Map<String, Object> decodeArguments(String name, String json) {
        try {
            Map<String, Object> decoded = mapper.readValue(json, ARGUMENTS_TYPE);
            return decoded != null ? decoded : Map.of();
        } catch (JsonProcessingException e) {
            logger.warning("Arguments of " + name + " are not a JSON object: " + e.getOriginalMessage());
            return Map.of();
        }
    }

    /// Demultiplexes one response. Lives for a single engine call.
    private final class StreamState {
        private final AgentContext context;
        private final String taskId;
        private final StringBuilder text = new StringBuilder();
        private final StringBuilder thinking = new StringBuilder();
        private final Map<String, PendingCall> pending = new LinkedHashMap<>();
        private final List<ToolCallRequest> calls = new ArrayList<>();
        private String textStreamId;
        private String thinkingStreamId;
        private boolean textDone;
        private ReasoningEvent.Finish finish;

        StreamState(AgentContext context) {
            this.context = context;
            this.taskId = context.task().getTaskId();
        }

        void accept(ReasoningEvent event) {
            if (event instanceof ReasoningEvent.TextDelta delta) {
                if (textStreamId == null) {
                    textStreamId = UUID.randomUUID().toString();
                }
                text.append(delta.text());
                textDone = false;
                emit(LifecycleEvent.Text.now(
                        taskId, context.agentId(), textStreamId, text.toString(), false));
            } else if (event instanceof ReasoningEvent.TextEnd) {
                closeText();
            } else if (event instanceof ReasoningEvent.ThinkingDelta delta) {
                if (thinkingStreamId == null) {
                    thinkingStreamId = UUID.randomUUID().toString();
                }
                thinking.append(delta.text());
                emit(LifecycleEvent.Thinking.now(
                        taskId, context.agentId(), thinkingStreamId, thinking.toString(), false));
            } else if (event instanceof ReasoningEvent.ToolInputStart start) {
                closeText();
                pending.put(start.callId(), new PendingCall(start.name()));
            } else if (event instanceof ReasoningEvent.ToolInputDelta delta) {
                PendingCall call = pending.get(delta.callId());
                if (call != null) {
                    call.arguments.append(delta.delta());
                    emit(LifecycleEvent.ToolStreaming.now(
                            taskId, context.agentId(), delta.callId(), call.name,
                            call.arguments.toString()));
                }
            } else if (event instanceof ReasoningEvent.ToolCall call) {
                closeText();
                pending.remove(call.callId());
                Map<String, Object> arguments = decodeArguments(call.name(), call.arguments());
                calls.add(new ToolCallRequest(call.callId(), call.name(), arguments, call.arguments()));
                emit(LifecycleEvent.ToolUse.now(
                        taskId, context.agentId(), call.callId(), call.name(), arguments));
            } else if (event instanceof ReasoningEvent.StreamError error) {
                emit(LifecycleEvent.Failure.now(taskId, context.agentId(), error.error()));
                throw ReasoningException.streamError(error.error());
            } else if (event instanceof ReasoningEvent.Finish done) {
                finish = done;
            }
        }

        StepOutput finish() {
            closeText();
            if (thinkingStreamId != null) {
                emit(LifecycleEvent.Thinking.now(
                        taskId, context.agentId(), thinkingStreamId, thinking.toString(), true));
            }
            ReasoningEvent.Finish done =
                    finish != null ? finish : new ReasoningEvent.Finish(FinishReason.STOP, Usage.EMPTY);
            if (done.reason().isFatal()) {
                ReasoningException error = ReasoningException.unusableFinish(done.reason());
                emit(LifecycleEvent.Failure.now(taskId, context.agentId(), error));
                throw error;
            }
            context.addUsage(done.usage());
            emit(LifecycleEvent.Finish.now(taskId, context.agentId(), done.reason(), done.usage()));
            return new StepOutput(
                    text.length() > 0 ? text.toString() : null, calls, done.reason(), done.usage());
        }

        private void closeText() {
            if (textStreamId != null && !textDone) {
                textDone = true;
                emit(LifecycleEvent.Text.now(
                        taskId, context.agentId(), textStreamId, text.toString(), true));
            }
        }

        private void emit(LifecycleEvent event) {
            context.emit(event);
        }
    }

    private static final class PendingCall {
        private final String name;
        private final StringBuilder arguments = new StringBuilder();

        PendingCall(String name) {
            this.name = name;
        }
    }
}
