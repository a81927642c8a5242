package io.agentloom.core.runtime;

import io.agentloom.core.capability.Capability;
import io.agentloom.core.event.LifecycleEvent;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.policy.CapabilityInvocationRecord;
import io.agentloom.core.policy.PolicyPipeline;
import io.agentloom.core.reasoning.ToolCallRequest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Dispatches the capability calls of one reasoning step.
///
/// Calls whose capability opts into concurrency form a batch submitted to the
/// executor; the remaining calls then run one after another on the agent's thread.
/// Every call passes through the {@link PolicyPipeline}.
///
/// ### Contracts
/// - **Postcondition**: records are returned in request order, whatever the completion order
/// - **Postcondition**: a concurrent batch is fully complete before the sequential
///   remainder starts and before this method returns
/// - **Invariant**: a failure escaping the pipeline (abort, breaker, cancellation) is
///   rethrown only after every batch member has finished
///
/// @implNote The executor is shared and owned by the environment; it is never
/// shut down here. It must be distinct from the pool running parallel agents, or a
/// full agent pool could starve its own capability batches.
public final class CapabilityDispatcher {

    private static final Logger logger = Logger.getLogger(CapabilityDispatcher.class.getName());

    private final PolicyPipeline pipeline;
    private final ExecutorService executor;
    private final boolean concurrentCalls;

    /// Creates a dispatcher.
    ///
    /// @param pipeline policy pipeline, not null
    /// @param executor runs concurrent batches, not null
    /// @param concurrentCalls `false` to dispatch everything sequentially
    public CapabilityDispatcher(
            PolicyPipeline pipeline, ExecutorService executor, boolean concurrentCalls) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.concurrentCalls = concurrentCalls;
    }

    /// Dispatches the calls.
    ///
    /// @param calls calls in engine order, not null
    /// @param context calling agent, not null
    /// @return final record of each call in request order, never null
    public List<CapabilityInvocationRecord> dispatch(
            List<ToolCallRequest> calls, AgentContext context) {
        CapabilityInvocationRecord[] records = new CapabilityInvocationRecord[calls.size()];
        List<Integer> batch = new ArrayList<>();
        List<Integer> sequential = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            if (concurrentCalls && isConcurrent(calls.get(i), context)) {
                batch.add(i);
            } else {
                sequential.add(i);
            }
        }
        if (batch.size() == 1) {
            sequential.add(0, batch.remove(0));
            sequential.sort(Integer::compareTo);
        }

        if (!batch.isEmpty()) {
            logger.fine("Agent " + context.agentId() + " dispatching " + batch.size()
                    + " calls concurrently");
            runBatch(calls, batch, records, context);
        }
        for (int index : sequential) {
            records[index] = invoke(calls.get(index), context);
        }
        return Arrays.asList(records);
    }

    private void runBatch(
            List<ToolCallRequest> calls,
            List<Integer> batch,
            CapabilityInvocationRecord[] records,
            AgentContext context) {
        List<Future<CapabilityInvocationRecord>> futures = new ArrayList<>(batch.size());
        for (int index : batch) {
            ToolCallRequest call = calls.get(index);
            futures.add(executor.submit(() -> invoke(call, context)));
        }

        RuntimeException failure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                records[batch.get(i)] = futures.get(i).get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (failure == null) {
                    failure = cause instanceof RuntimeException runtime
                            ? runtime
                            : new IllegalStateException(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new TaskCancelledException("Interrupted while awaiting capability calls", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private CapabilityInvocationRecord invoke(ToolCallRequest call, AgentContext context) {
        CapabilityInvocationRecord record = pipeline.execute(call, context);
        context.emit(LifecycleEvent.ToolResult.now(
                context.task().getTaskId(),
                context.agentId(),
                call.id(),
                call.name(),
                record.arguments(),
                record.result()));
        return record;
    }

    private static boolean isConcurrent(ToolCallRequest call, AgentContext context) {
        return context.capabilities()
                .get(call.name())
                .map(Capability::supportsConcurrentCalls)
                .orElse(false);
    }
}
