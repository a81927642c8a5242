package io.agentloom.core.policy;

import io.agentloom.core.AgentloomConfig;
import io.agentloom.core.capability.Capability;
import io.agentloom.core.capability.CapabilityException;
import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.capability.InvocationContext;
import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.execution.TaskCancelledException;
import io.agentloom.core.policy.CapabilityInvocationRecord.Builder;
import io.agentloom.core.reasoning.ToolCallRequest;
import io.agentloom.core.runtime.AgentContext;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs one capability call through the policy stages.
///
/// ```
/// pre-invocation ──allow──> invocation ──success──> post-invocation
///   │ block/skip/escalate        │ exception
///   v                            v
/// synthetic result          on-exception ──retry──> invocation (new record)
///                                │ skip/escalate/continue → synthetic result
///                                │ abort → rethrow
/// ```
///
/// ### Contracts
/// - **Postcondition**: a blocked, skipped or denied call never reaches the capability
/// - **Postcondition**: every attempt yields one {@link CapabilityInvocationRecord}, added to
///   the agent context and handed to each hook, with an outcome for each stage that ran
/// - **Invariant**: task cancellation passes through unchanged; cancelling only the
///   per-call token is an ordinary invocation failure
/// - **Invariant**: a success resets the agent's failure counter; each failed attempt
///   increments it, and reaching the threshold throws
///   {@link CircuitBreakerTrippedException} with the failure as cause
///
/// @implNote Stateless and thread-safe; concurrent calls of one agent share the
/// pipeline. Hook list is copied at construction time.
///
/// @see PolicyHook for stage contracts
/// @see ApprovalHandler for escalation
public final class PolicyPipeline {

    private static final Logger logger = Logger.getLogger(PolicyPipeline.class.getName());

    private final List<PolicyHook> hooks;
    private final ApprovalHandler approvalHandler;
    private final int maxRetries;
    private final int circuitBreakerThreshold;
    private final Duration retryBackoff;

    /// Creates a pipeline.
    ///
    /// @param hooks ordered hooks, not null (may be empty)
    /// @param approvalHandler escalation route, may be null
    /// @param config retry budget, backoff and breaker threshold, not null
    public PolicyPipeline(
            List<PolicyHook> hooks, ApprovalHandler approvalHandler, AgentloomConfig config) {
        this.hooks = List.copyOf(hooks);
        this.approvalHandler = approvalHandler;
        this.maxRetries = config.getMaxCapabilityRetries();
        this.circuitBreakerThreshold = config.getCircuitBreakerThreshold();
        this.retryBackoff = config.getCapabilityRetryBackoff();
    }

    /// Creates a pipeline without hooks: calls always proceed and failures become
    /// error results.
    ///
    /// @param config retry budget, backoff and breaker threshold, not null
    /// @return pipeline, never null
    public static PolicyPipeline permissive(AgentloomConfig config) {
        return new PolicyPipeline(List.of(), null, config);
    }

    /// Executes the call.
    ///
    /// @param call finalized call, not null
    /// @param context invoking agent, whose capability table resolves the name, not null
    /// @return record of the last attempt; its result is never null
    /// @throws CircuitBreakerTrippedException when the failure threshold is reached
    /// @throws TaskCancelledException when the task is cancelled
    /// @throws RuntimeException the original failure when a hook chooses
    ///     {@link ErrorAction#ABORT}
    public CapabilityInvocationRecord execute(ToolCallRequest call, AgentContext context) {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Builder trace = new Builder(call.id(), call.name(), call.arguments(), 0);
        CapabilityResult preempted = preInvocation(call, trace, context);
        if (preempted != null) {
            trace.result(preempted);
            return complete(trace, context);
        }

        int attempt = 0;
        while (true) {
            context.task().cancellation().throwIfCancelled();
            try {
                CapabilityResult result = invoke(call, trace, context);
                trace.stage(
                                InvocationStage.INVOCATION,
                                result.error() ? "error-result" : "success",
                                null)
                        .result(result);
                context.recordSuccess();
                postInvocation(call, trace, result, context);
                return complete(trace, context);
            } catch (Exception e) {
                if (isTaskCancellation(e, context)) {
                    trace.stage(InvocationStage.INVOCATION, "cancelled", e.getMessage()).error(e);
                    complete(trace, context);
                    throw (TaskCancelledException) e;
                }

                logger.warning(
                        "Capability " + call.name() + " failed (attempt " + (attempt + 1) + "): "
                                + describe(e));
                trace.stage(InvocationStage.INVOCATION, "exception", describe(e)).error(e);

                ErrorAction action = onException(call, e, attempt, context);
                boolean retrying = action == ErrorAction.RETRY && attempt < maxRetries;
                trace.stage(
                        InvocationStage.ON_EXCEPTION,
                        action.name().toLowerCase(),
                        action == ErrorAction.RETRY && !retrying ? "retry budget exhausted" : null);

                if (action == ErrorAction.ABORT) {
                    complete(trace, context);
                    throw e instanceof RuntimeException runtime
                            ? runtime
                            : new CapabilityException(describe(e), e);
                }

                CapabilityResult result = resultFor(action, retrying, e);
                trace.result(result);
                int failures = context.recordFailure();
                if (failures >= circuitBreakerThreshold) {
                    complete(trace, context);
                    throw new CircuitBreakerTrippedException(context.agentId(), failures, e);
                }
                if (!retrying) {
                    return complete(trace, context);
                }

                complete(trace, context);
                context.task().cancellation().sleep(retryBackoff.multipliedBy(1L << attempt));
                attempt++;
                trace = new Builder(call.id(), call.name(), trace.arguments(), attempt);
            }
        }
    }

    private CapabilityResult preInvocation(
            ToolCallRequest call, Builder trace, AgentContext context) {
        for (PolicyHook hook : hooks) {
            PolicyOutcome outcome;
            try {
                outcome = hook.beforeInvocation(call, trace.arguments(), context);
            } catch (RuntimeException e) {
                logger.warning("Pre-invocation hook failed for " + call.name() + ": " + e);
                trace.stage(InvocationStage.PRE_INVOCATION, "hook-error", describe(e));
                continue;
            }
            if (outcome == null) {
                continue;
            }
            if (outcome instanceof PolicyOutcome.Allow allow) {
                if (allow.modifiedArguments() != null) {
                    trace.arguments(allow.modifiedArguments());
                    trace.stage(InvocationStage.PRE_INVOCATION, "modify", null);
                }
            } else if (outcome instanceof PolicyOutcome.Block block) {
                logger.warning("Capability " + call.name() + " blocked: " + block.reason());
                trace.stage(InvocationStage.PRE_INVOCATION, "block", block.reason());
                return CapabilityResult.error("Blocked: " + block.reason());
            } else if (outcome instanceof PolicyOutcome.Skip skip) {
                trace.stage(InvocationStage.PRE_INVOCATION, "skip", skip.reason());
                return CapabilityResult.text("Skipped: " + skip.reason());
            } else if (outcome instanceof PolicyOutcome.Escalate escalate) {
                trace.stage(InvocationStage.PRE_INVOCATION, "escalate", escalate.reason());
                CapabilityResult denied = escalate(call, escalate.reason(), trace, context);
                if (denied != null) {
                    return denied;
                }
            }
        }
        trace.stage(InvocationStage.PRE_INVOCATION, "allow", null);
        return null;
    }

    private CapabilityResult escalate(
            ToolCallRequest call, String reason, Builder trace, AgentContext context) {
        CapabilityResult awaitingHuman =
                CapabilityResult.text(
                        "Action requires human approval: " + reason
                                + ". Please request human assistance.");
        if (approvalHandler == null) {
            trace.stage(InvocationStage.APPROVAL, "unavailable", null);
            return awaitingHuman;
        }

        ApprovalDecision decision;
        try {
            decision =
                    approvalHandler.requestApproval(
                            new ApprovalRequest(
                                    context.task().getTaskId(),
                                    context.agentId(),
                                    call.name(),
                                    trace.arguments(),
                                    reason),
                            context);
        } catch (TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warning("Approval handler failed for " + call.name() + ": " + e);
            trace.stage(InvocationStage.APPROVAL, "failed", describe(e));
            return awaitingHuman;
        }

        if (decision != null && decision.approved()) {
            logger.info(
                    "Capability " + call.name() + " approved by "
                            + (decision.approver() != null ? decision.approver() : "user"));
            trace.stage(InvocationStage.APPROVAL, "approved", decision.approver());
            return null;
        }
        String feedback =
                decision != null && decision.feedback() != null ? decision.feedback() : reason;
        trace.stage(InvocationStage.APPROVAL, "denied", feedback);
        return CapabilityResult.text("Action rejected: " + feedback);
    }

    private CapabilityResult invoke(ToolCallRequest call, Builder trace, AgentContext context)
            throws Exception {
        Capability capability =
                context.capabilities()
                        .get(call.name())
                        .orElseThrow(() -> CapabilityException.notFound(call.name()));
        CancellationToken token = context.openCall(call.id());
        try {
            InvocationContext invocation = new InvocationContext(context, call.id(), token);
            CapabilityResult result = capability.invoke(trace.arguments(), invocation);
            trace.sideChannel(invocation.sideChannel());
            return Objects.requireNonNull(result, () -> call.name() + " returned no result");
        } finally {
            context.closeCall(call.id());
        }
    }

    private void postInvocation(
            ToolCallRequest call, Builder trace, CapabilityResult result, AgentContext context) {
        for (PolicyHook hook : hooks) {
            try {
                hook.afterInvocation(call, trace.arguments(), result, context);
            } catch (RuntimeException e) {
                logger.warning("Post-invocation hook failed for " + call.name() + ": " + e);
                trace.stage(InvocationStage.POST_INVOCATION, "hook-error", describe(e));
                return;
            }
        }
        if (!hooks.isEmpty()) {
            trace.stage(InvocationStage.POST_INVOCATION, "observed", null);
        }
    }

    private ErrorAction onException(
            ToolCallRequest call, Exception error, int attempt, AgentContext context) {
        for (PolicyHook hook : hooks) {
            try {
                ErrorAction action = hook.onException(call, error, attempt, context);
                if (action != null) {
                    return action;
                }
            } catch (RuntimeException e) {
                logger.warning("Exception hook failed for " + call.name() + ": " + e);
            }
        }
        return ErrorAction.CONTINUE;
    }

    private CapabilityResult resultFor(ErrorAction action, boolean retrying, Exception error) {
        String message = describe(error);
        return switch (action) {
            case RETRY -> retrying
                    ? CapabilityResult.error("Error: " + message)
                    : CapabilityResult.error(
                            "Error after " + maxRetries + " retries: " + message);
            case SKIP -> CapabilityResult.text("Skipped due to error: " + message);
            case ESCALATE -> CapabilityResult.error(
                    "Error requires human assistance: " + message + ".");
            case ABORT, CONTINUE -> CapabilityResult.error("Error: " + message);
        };
    }

    private static boolean isTaskCancellation(Exception e, AgentContext context) {
        return e instanceof TaskCancelledException && context.task().cancellation().isCancelled();
    }

    private CapabilityInvocationRecord complete(Builder builder, AgentContext context) {
        CapabilityInvocationRecord completed = builder.build();
        context.addInvocation(completed);
        for (PolicyHook hook : hooks) {
            try {
                hook.onRecord(completed, context);
            } catch (RuntimeException e) {
                logger.warning("Record hook failed for " + completed.name() + ": " + e);
            }
        }
        return completed;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
