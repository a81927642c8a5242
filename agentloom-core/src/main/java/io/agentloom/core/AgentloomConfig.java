package io.agentloom.core;

import io.agentloom.core.runtime.DiscoveryPolicy;
import java.time.Duration;

/// Configuration of the agent runtime.
///
/// Controls loop caps, retry budgets, transcript compression thresholds and
/// concurrency. The value is passed explicitly to {@link AgentloomFactory}; there is
/// no global configuration.
///
/// ### Default Values
/// - `maxIterations`: `500` reasoning/acting rounds per agent
/// - `maxReasoningRetries`: `3` retries of a failed reasoning request
/// - `maxCapabilityRetries`: `3` retries of a failed capability call (policy `RETRY`)
/// - `compressMessageThreshold`: `80` transcript messages
/// - `compressTokenThreshold`: `80000` estimated tokens, checked from
///   `minMessagesForTokenCompression` (`10`) messages on
/// - `concurrentCapabilityCalls`: `true`
/// - `agentParallel`: `true` (agents of a parallel stage run concurrently)
/// - `circuitBreakerThreshold`: `10` consecutive invocation failures
/// - `reasoningBackoffBase`: `300ms`, scaled by `(attempt + 1)²`
/// - `capabilityRetryBackoff`: `500ms`, doubled per attempt
/// - `threadPoolSize`: `10`
/// - `completenessCheck`: `false`
/// - `discoveryPolicy`: {@link DiscoveryPolicy#FIRST_ITERATION}
/// - `largeTextThreshold`: `5000` characters
/// - `maxAgentRetries`: `2` re-runs granted by lifecycle hooks
///
/// @implNote **Not thread-safe**. A mutable configuration object intended to be
/// configured before passing to {@link AgentloomFactory}. Do not modify after
/// environment creation.
///
/// @see Builder
public class AgentloomConfig {
    private int maxIterations = 500;
    private int maxReasoningRetries = 3;
    private int maxCapabilityRetries = 3;
    private int compressMessageThreshold = 80;
    private int compressTokenThreshold = 80_000;
    private int minMessagesForTokenCompression = 10;
    private boolean concurrentCapabilityCalls = true;
    private boolean agentParallel = true;
    private int circuitBreakerThreshold = 10;
    private Duration reasoningBackoffBase = Duration.ofMillis(300);
    private Duration capabilityRetryBackoff = Duration.ofMillis(500);
    private int threadPoolSize = 10;
    private boolean completenessCheck = false;
    private DiscoveryPolicy discoveryPolicy = DiscoveryPolicy.FIRST_ITERATION;
    private int largeTextThreshold = 5000;
    private int maxAgentRetries = 2;

    /// Creates a configuration with default values.
    public AgentloomConfig() {}

    public int getMaxIterations() {
        return maxIterations;
    }

    /// Sets the per-agent loop cap. Exceeding it yields an "unfinished" result.
    ///
    /// @param maxIterations maximum rounds, must be positive
    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public int getMaxReasoningRetries() {
        return maxReasoningRetries;
    }

    public void setMaxReasoningRetries(int maxReasoningRetries) {
        this.maxReasoningRetries = maxReasoningRetries;
    }

    public int getMaxCapabilityRetries() {
        return maxCapabilityRetries;
    }

    public void setMaxCapabilityRetries(int maxCapabilityRetries) {
        this.maxCapabilityRetries = maxCapabilityRetries;
    }

    public int getCompressMessageThreshold() {
        return compressMessageThreshold;
    }

    public void setCompressMessageThreshold(int compressMessageThreshold) {
        this.compressMessageThreshold = compressMessageThreshold;
    }

    public int getCompressTokenThreshold() {
        return compressTokenThreshold;
    }

    public void setCompressTokenThreshold(int compressTokenThreshold) {
        this.compressTokenThreshold = compressTokenThreshold;
    }

    public int getMinMessagesForTokenCompression() {
        return minMessagesForTokenCompression;
    }

    public void setMinMessagesForTokenCompression(int minMessagesForTokenCompression) {
        this.minMessagesForTokenCompression = minMessagesForTokenCompression;
    }

    /// Returns whether capabilities that opt into concurrency are dispatched as a batch.
    ///
    /// @return `true` if concurrent dispatch is enabled
    public boolean isConcurrentCapabilityCalls() {
        return concurrentCapabilityCalls;
    }

    public void setConcurrentCapabilityCalls(boolean concurrentCapabilityCalls) {
        this.concurrentCapabilityCalls = concurrentCapabilityCalls;
    }

    /// Returns whether agents of a parallel stage run concurrently. When disabled they
    /// run one after another in declaration order.
    ///
    /// @return `true` if parallel stages are concurrent
    public boolean isAgentParallel() {
        return agentParallel;
    }

    public void setAgentParallel(boolean agentParallel) {
        this.agentParallel = agentParallel;
    }

    public int getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public void setCircuitBreakerThreshold(int circuitBreakerThreshold) {
        this.circuitBreakerThreshold = circuitBreakerThreshold;
    }

    public Duration getReasoningBackoffBase() {
        return reasoningBackoffBase;
    }

    public void setReasoningBackoffBase(Duration reasoningBackoffBase) {
        this.reasoningBackoffBase = reasoningBackoffBase;
    }

    public Duration getCapabilityRetryBackoff() {
        return capabilityRetryBackoff;
    }

    public void setCapabilityRetryBackoff(Duration capabilityRetryBackoff) {
        this.capabilityRetryBackoff = capabilityRetryBackoff;
    }

    /// Returns the size of the pool running parallel stage agents.
    ///
    /// @return fixed thread pool size
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the thread pool size for parallel stages.
    ///
    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    ///
    /// @param threadPoolSize the number of threads in the fixed pool, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public boolean isCompletenessCheck() {
        return completenessCheck;
    }

    public void setCompletenessCheck(boolean completenessCheck) {
        this.completenessCheck = completenessCheck;
    }

    public DiscoveryPolicy getDiscoveryPolicy() {
        return discoveryPolicy;
    }

    public void setDiscoveryPolicy(DiscoveryPolicy discoveryPolicy) {
        this.discoveryPolicy = discoveryPolicy;
    }

    /// Returns the length above which older capability results are truncated in the
    /// transcript.
    ///
    /// @return character threshold
    public int getLargeTextThreshold() {
        return largeTextThreshold;
    }

    public void setLargeTextThreshold(int largeTextThreshold) {
        this.largeTextThreshold = largeTextThreshold;
    }

    public int getMaxAgentRetries() {
        return maxAgentRetries;
    }

    public void setMaxAgentRetries(int maxAgentRetries) {
        this.maxAgentRetries = maxAgentRetries;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link AgentloomConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final AgentloomConfig config = new AgentloomConfig();

        public Builder maxIterations(int maxIterations) {
            config.maxIterations = maxIterations;
            return this;
        }

        public Builder maxReasoningRetries(int maxReasoningRetries) {
            config.maxReasoningRetries = maxReasoningRetries;
            return this;
        }

        public Builder maxCapabilityRetries(int maxCapabilityRetries) {
            config.maxCapabilityRetries = maxCapabilityRetries;
            return this;
        }

        /// Sets both compression thresholds.
        ///
        /// @param messages message count threshold
        /// @param tokens estimated token threshold
        /// @return this builder for chaining, never null
        public Builder compressThresholds(int messages, int tokens) {
            config.compressMessageThreshold = messages;
            config.compressTokenThreshold = tokens;
            return this;
        }

        public Builder minMessagesForTokenCompression(int minMessages) {
            config.minMessagesForTokenCompression = minMessages;
            return this;
        }

        public Builder concurrentCapabilityCalls(boolean concurrentCapabilityCalls) {
            config.concurrentCapabilityCalls = concurrentCapabilityCalls;
            return this;
        }

        public Builder agentParallel(boolean agentParallel) {
            config.agentParallel = agentParallel;
            return this;
        }

        public Builder circuitBreakerThreshold(int circuitBreakerThreshold) {
            config.circuitBreakerThreshold = circuitBreakerThreshold;
            return this;
        }

        public Builder reasoningBackoffBase(Duration reasoningBackoffBase) {
            config.reasoningBackoffBase = reasoningBackoffBase;
            return this;
        }

        public Builder capabilityRetryBackoff(Duration capabilityRetryBackoff) {
            config.capabilityRetryBackoff = capabilityRetryBackoff;
            return this;
        }

        /// Sets the thread pool size for parallel stages.
        ///
        /// @param threadPoolSize the number of threads, must be positive
        /// @return this builder for chaining, never null
        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder completenessCheck(boolean completenessCheck) {
            config.completenessCheck = completenessCheck;
            return this;
        }

        public Builder discoveryPolicy(DiscoveryPolicy discoveryPolicy) {
            config.discoveryPolicy = discoveryPolicy;
            return this;
        }

        public Builder largeTextThreshold(int largeTextThreshold) {
            config.largeTextThreshold = largeTextThreshold;
            return this;
        }

        public Builder maxAgentRetries(int maxAgentRetries) {
            config.maxAgentRetries = maxAgentRetries;
            return this;
        }

        /// Builds and returns the configured {@link AgentloomConfig} instance.
        ///
        /// @return the configured instance, never null
        public AgentloomConfig build() {
            return config;
        }
    }
}
