package io.agentloom.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.graph.ExecutionGraphCompiler;
import io.agentloom.core.plan.markup.PlanMarkupCodec;
import io.agentloom.core.policy.ApprovalHandler;
import io.agentloom.core.policy.PolicyHook;
import io.agentloom.core.policy.PolicyPipeline;
import io.agentloom.core.reasoning.HistoryCompressor;
import io.agentloom.core.reasoning.ReasoningEngine;
import io.agentloom.core.reasoning.ReasoningGateway;
import io.agentloom.core.reasoning.SlidingWindowCompressor;
import io.agentloom.core.runtime.AgentDefinition;
import io.agentloom.core.runtime.AgentLifecycleHooks;
import io.agentloom.core.runtime.AgentRegistry;
import io.agentloom.core.runtime.AgentRuntime;
import io.agentloom.core.runtime.CapabilityDispatcher;
import io.agentloom.core.runtime.PlanExecutor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Wires {@link AgentloomEnvironment} instances.
///
/// {@snippet :
/// var env = AgentloomFactory.builder()
///     .config(AgentloomConfig.builder().maxIterations(50).build())
///     .reasoningEngine(new LangChain4jReasoningEngine(model))
///     .agent(AgentDefinition.remote("Browser", "Drives a browser", browserClients))
///     .policyHook(new AuditHook())
///     .build();
/// TaskResult result = env.run(plan, "Compare laptop prices");
/// }
///
/// Two pools are created: a fixed pool of `threadPoolSize` threads for parallel
/// stages and a cached pool for concurrent capability batches.
///
/// @see AgentloomEnvironment
/// @see AgentloomConfig
public final class AgentloomFactory {

    private AgentloomFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder. Only the reasoning engine is mandatory.
    public static class Builder {
        private AgentloomConfig config = new AgentloomConfig();
        private ReasoningEngine reasoningEngine;
        private HistoryCompressor historyCompressor;
        private final List<PolicyHook> policyHooks = new ArrayList<>();
        private ApprovalHandler approvalHandler;
        private AgentLifecycleHooks lifecycleHooks = AgentLifecycleHooks.NONE;
        private final List<AgentDefinition> agents = new ArrayList<>();
        private ObjectMapper objectMapper;

        private Builder() {}

        public Builder config(AgentloomConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder reasoningEngine(ReasoningEngine reasoningEngine) {
            this.reasoningEngine = reasoningEngine;
            return this;
        }

        /// Sets the transcript compressor.
        ///
        /// @param historyCompressor compressor, may be null for a {@link SlidingWindowCompressor}
        /// @return this builder for chaining, never null
        public Builder historyCompressor(HistoryCompressor historyCompressor) {
            this.historyCompressor = historyCompressor;
            return this;
        }

        /// Appends a policy hook; hooks run in registration order.
        ///
        /// @param hook the hook, not null
        /// @return this builder for chaining, never null
        public Builder policyHook(PolicyHook hook) {
            this.policyHooks.add(Objects.requireNonNull(hook, "hook must not be null"));
            return this;
        }

        /// Sets the escalation route.
        ///
        /// @param approvalHandler handler, may be null to answer escalations with
        ///     "requires human approval"
        /// @return this builder for chaining, never null
        public Builder approvalHandler(ApprovalHandler approvalHandler) {
            this.approvalHandler = approvalHandler;
            return this;
        }

        public Builder lifecycleHooks(AgentLifecycleHooks lifecycleHooks) {
            this.lifecycleHooks = lifecycleHooks;
            return this;
        }

        public Builder agent(AgentDefinition definition) {
            this.agents.add(Objects.requireNonNull(definition, "definition must not be null"));
            return this;
        }

        public Builder agents(List<AgentDefinition> definitions) {
            definitions.forEach(this::agent);
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /// Builds the environment.
        ///
        /// @return new environment owning two fresh thread pools, never null
        /// @throws IllegalStateException if no reasoning engine was set
        public AgentloomEnvironment build() {
            if (reasoningEngine == null) {
                throw new IllegalStateException("A reasoning engine is required");
            }
            ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
            HistoryCompressor compressor =
                    historyCompressor != null ? historyCompressor : new SlidingWindowCompressor();

            ExecutorService agentPool = Executors.newFixedThreadPool(config.getThreadPoolSize());
            ExecutorService capabilityPool = Executors.newCachedThreadPool();

            ExecutionGraphCompiler compiler = new ExecutionGraphCompiler();
            PlanMarkupCodec codec = new PlanMarkupCodec(compiler);
            PolicyPipeline pipeline = new PolicyPipeline(policyHooks, approvalHandler, config);
            ReasoningGateway gateway = new ReasoningGateway(reasoningEngine, compressor, config, mapper);
            CapabilityDispatcher dispatcher =
                    new CapabilityDispatcher(pipeline, capabilityPool, config.isConcurrentCapabilityCalls());
            AgentRuntime runtime = new AgentRuntime(gateway, dispatcher, codec, config, mapper);
            AgentRegistry registry = new AgentRegistry(agents);
            PlanExecutor executor =
                    new PlanExecutor(runtime, registry, compiler, agentPool, lifecycleHooks, config);

            return new AgentloomEnvironment(executor, codec, registry, agentPool, capabilityPool);
        }
    }
}
