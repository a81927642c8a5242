package io.agentloom.core.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.AgentloomConfig;
import io.agentloom.core.capability.Capability;
import io.agentloom.core.capability.CapabilityClient;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.capability.CapabilityTable;
import io.agentloom.core.capability.RemoteCapability;
import io.agentloom.core.capability.builtin.VariableStorageCapability;
import io.agentloom.core.plan.PlanAgent;
import io.agentloom.core.plan.markup.PlanMarkupCodec;
import io.agentloom.core.policy.CapabilityInvocationRecord;
import io.agentloom.core.reasoning.Message;
import io.agentloom.core.reasoning.ReasoningGateway;
import io.agentloom.core.reasoning.StepOutput;
import io.agentloom.core.reasoning.ToolChoice;
import io.agentloom.core.reasoning.Transcript;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Drives one plan agent through its reasoning/acting loop.
///
/// ### Loop
/// Each iteration, bounded by `maxIterations`:
/// 1. Wait while the task is paused, stop if it is cancelled
/// 2. Refresh discovered capabilities when the {@link DiscoveryPolicy} asks for it
/// 3. Truncate large tool results of earlier steps
/// 4. Request the next step from the {@link ReasoningGateway} (which compresses the transcript)
/// 5. A pure-text step is the answer, optionally after one completeness re-check
/// 6. Otherwise dispatch the calls through the {@link CapabilityDispatcher} and append
///    the results, then the side-channel messages, to the transcript
///
/// Running out of iterations yields {@link #UNFINISHED} rather than an error.
///
/// ### Contracts
/// - **Postcondition**: the provider connection, when there is one, is opened lazily
///   and closed before {@link #run} returns or throws
/// - **Invariant**: capability failures become error-flagged results; only an abort,
///   a tripped circuit breaker, a fatal reasoning failure or cancellation escapes
///
/// @implNote Stateless; one runtime serves every agent of every task. All per-agent
/// state lives in the {@link AgentContext}.
///
/// @see PlanExecutor for stage sequencing and status transitions
public class AgentRuntime {

    private static final Logger logger = Logger.getLogger(AgentRuntime.class.getName());

    /// Result of an agent that exhausted its iterations.
    public static final String UNFINISHED = "Unfinished";

    /// Result of an agent stopped through the `forceStop` variable without an answer.
    public static final String STOPPED = "Task stopped";

    static final String COMPLETENESS_PROMPT =
            "Check the task nodes against what has been done. If anything is missing, continue"
                    + " working on it; otherwise repeat the final answer.";

    private static final String TRUNCATION_SUFFIX = "...(content truncated)";

    private final ReasoningGateway gateway;
    private final CapabilityDispatcher dispatcher;
    private final PlanMarkupCodec codec;
    private final AgentloomConfig config;
    private final ObjectMapper mapper;

    /// Creates a runtime.
    ///
    /// @param gateway reasoning gateway, not null
    /// @param dispatcher capability dispatcher, not null
    /// @param codec renders the agent task document, not null
    /// @param config loop limits and discovery policy, not null
    /// @param mapper JSON mapper for the built-in capabilities, not null
    public AgentRuntime(
            ReasoningGateway gateway,
            CapabilityDispatcher dispatcher,
            PlanMarkupCodec codec,
            AgentloomConfig config,
            ObjectMapper mapper) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Runs the agent to completion.
    ///
    /// @param definition provider the agent is bound to, not null
    /// @param context fresh agent context, not null
    /// @return the agent's answer, never null
    /// @throws io.agentloom.core.execution.TaskCancelledException if the task is cancelled
    /// @throws RuntimeException on any failure that ends the agent in `error`
    public String run(AgentDefinition definition, AgentContext context) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(context, "context must not be null");

        CapabilityClient client = definition.hasProvider() ? definition.clientFactory().get() : null;
        try {
            seed(definition, context);
            return loop(definition, context, client);
        } finally {
            if (client != null) {
                closeQuietly(client, context);
            }
        }
    }

    private String loop(AgentDefinition definition, AgentContext context, CapabilityClient client) {
        TaskContext task = context.task();
        Transcript transcript = context.transcript();
        List<Capability> discovered = List.of();
        boolean completenessChecked = false;

        for (int iteration = 0; iteration < config.getMaxIterations(); iteration++) {
            task.checkpoint();

            if (client != null && config.getDiscoveryPolicy().shouldRefresh(iteration)) {
                discovered = discover(definition, client, context);
            }
            context.setCapabilities(buildTable(definition, context, discovered));
            trimLargeToolResults(transcript, config.getLargeTextThreshold());

            StepOutput step =
                    gateway.generateStep(context, context.capabilities().descriptors(), ToolChoice.AUTO);
            transcript.add(step.toMessage());

            if (!step.hasToolCalls()) {
                String answer = step.text() != null ? step.text() : "";
                if (config.isCompletenessCheck() && !completenessChecked) {
                    completenessChecked = true;
                    transcript.add(new Message.UserMessage(COMPLETENESS_PROMPT));
                    continue;
                }
                return answer;
            }

            List<CapabilityInvocationRecord> records = dispatcher.dispatch(step.toolCalls(), context);
            appendResults(transcript, records);

            if (task.isForceStopped()) {
                logger.info("Agent " + context.agentId() + " stopped by forceStop variable");
                return step.text() != null && !step.text().isBlank() ? step.text() : STOPPED;
            }
        }

        logger.warning(
                "Agent " + context.agentId() + " reached the iteration cap of "
                        + config.getMaxIterations());
        return UNFINISHED;
    }

    private void seed(AgentDefinition definition, AgentContext context) {
        PlanAgent agent = context.agent();
        StringBuilder system = new StringBuilder();
        system.append("Your name is ").append(definition.name()).append(".\n");
        system.append(definition.description());
        if (agent.usesVariables()) {
            system.append("\n\nUse the ")
                    .append(VariableStorageCapability.NAME)
                    .append(" capability to read the input and write the output variables"
                            + " declared by the task nodes.");
        }
        context.transcript().add(new Message.SystemMessage(system.toString()));
        context.transcript()
                .add(new Message.UserMessage(
                        codec.agentTaskDocument(agent, context.task().getMainTask())));
    }

    private List<Capability> discover(
            AgentDefinition definition, CapabilityClient client, AgentContext context) {
        if (!client.isConnected()) {
            client.connect(context.task().cancellation());
        }
        List<CapabilityDescriptor> descriptors =
                client.listCapabilities(definition.discoveryFilter(), context.task().cancellation());
        List<Capability> discovered = new ArrayList<>(descriptors.size());
        for (CapabilityDescriptor descriptor : descriptors) {
            discovered.add(new RemoteCapability(descriptor, client, definition.concurrentRemoteCalls()));
        }
        logger.fine("Agent " + context.agentId() + " discovered " + discovered.size() + " capabilities");
        return discovered;
    }

    /// Builds the table for the next step.
    ///
    /// Capabilities already used by the agent come first and survive a discovery that
    /// no longer lists them; then come the built-in, static and discovered ones, later
    /// sources replacing same-named earlier entries.
    private CapabilityTable buildTable(
            AgentDefinition definition, AgentContext context, List<Capability> discovered) {
        CapabilityTable table = new CapabilityTable();
        for (Capability previous : context.capabilities().all()) {
            if (context.usedCapabilities().contains(previous.name())) {
                table.put(previous);
            }
        }
        if (context.agent().usesVariables()) {
            table.put(new VariableStorageCapability(mapper));
        }
        table.merge(definition.capabilities());
        table.merge(discovered);
        return table;
    }

    private static void appendResults(
            Transcript transcript, List<CapabilityInvocationRecord> records) {
        List<Message.ToolResult> results = new ArrayList<>(records.size());
        List<Message> sideChannel = new ArrayList<>();
        for (CapabilityInvocationRecord record : records) {
            results.add(new Message.ToolResult(record.callId(), record.name(), record.result()));
            sideChannel.addAll(record.sideChannel());
        }
        transcript.add(new Message.ToolResultMessage(results));
        transcript.addAll(sideChannel);
    }

    /// Truncates text parts longer than `threshold` in every tool result message but the last.
    static void trimLargeToolResults(Transcript transcript, int threshold) {
        int last = -1;
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (transcript.get(i) instanceof Message.ToolResultMessage) {
                last = i;
                break;
            }
        }
        for (int i = 0; i < last; i++) {
            if (transcript.get(i) instanceof Message.ToolResultMessage message) {
                Message.ToolResultMessage trimmed = trim(message, threshold);
                if (trimmed != message) {
                    transcript.set(i, trimmed);
                }
            }
        }
    }

    private static Message.ToolResultMessage trim(Message.ToolResultMessage message, int threshold) {
        boolean changed = false;
        List<Message.ToolResult> results = new ArrayList<>(message.results().size());
        for (Message.ToolResult result : message.results()) {
            List<CapabilityResult.Content> parts = new ArrayList<>();
            for (CapabilityResult.Content part : result.result().content()) {
                if (part instanceof CapabilityResult.Content.Text text
                        && text.text().length() > threshold
                        && !text.text().endsWith(TRUNCATION_SUFFIX)) {
                    parts.add(new CapabilityResult.Content.Text(
                            text.text().substring(0, threshold) + TRUNCATION_SUFFIX));
                    changed = true;
                } else {
                    parts.add(part);
                }
            }
            results.add(new Message.ToolResult(
                    result.callId(),
                    result.name(),
                    new CapabilityResult(parts, result.result().error())));
        }
        return changed ? new Message.ToolResultMessage(results) : message;
    }

    private static void closeQuietly(CapabilityClient client, AgentContext context) {
        try {
            client.close();
        } catch (RuntimeException e) {
            logger.warning("Failed to close capability client of agent " + context.agentId() + ": " + e);
        }
    }
}
