package io.agentloom.core.graph;

import io.agentloom.core.plan.PlanAgent;
import java.util.List;
import java.util.Objects;

/// One stage of a compiled plan.
///
/// Stages form a singly-linked list through {@link #next()}: a {@link Normal} stage
/// runs one agent, a {@link Parallel} stage runs several agents concurrently and
/// completes only when each of them has reached a terminal state.
///
/// ```
/// Normal(A) ──> Parallel(B, C) ──> Normal(D) ──> null
/// ```
///
/// @see ExecutionGraphCompiler
public sealed interface ExecutionTreeNode {

    /// Returns the following stage.
    ///
    /// @return next stage, or null if this is the last one
    ExecutionTreeNode next();

    /// Returns the agents run by this stage in declaration order.
    ///
    /// @return agents, never empty
    List<PlanAgent> agents();

    /// Stage running a single agent.
    ///
    /// @param agent the agent, not null
    /// @param next following stage, may be null
    record Normal(PlanAgent agent, ExecutionTreeNode next) implements ExecutionTreeNode {

        public Normal {
            Objects.requireNonNull(agent, "agent must not be null");
        }

        @Override
        public List<PlanAgent> agents() {
            return List.of(agent);
        }
    }

    /// Stage running several agents concurrently.
    ///
    /// @param branches one {@link Normal} per agent, each with a null `next`
    /// @param next stage started after every branch is terminal, may be null
    record Parallel(List<Normal> branches, ExecutionTreeNode next) implements ExecutionTreeNode {

        public Parallel {
            branches = List.copyOf(branches);
            if (branches.size() < 2) {
                throw new IllegalArgumentException("Parallel stage needs at least two branches");
            }
        }

        @Override
        public List<PlanAgent> agents() {
            return branches.stream().map(Normal::agent).toList();
        }
    }
}
