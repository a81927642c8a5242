package io.agentloom.core.plan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Declarative multi-agent task description produced by the planning step.
///
/// A plan holds an ordered list of {@link PlanAgent}s with dependency edges
/// between them, plus the markup document it was parsed from. The markup is a
/// cache: {@link io.agentloom.core.plan.markup.PlanMarkupCodec#serialize(Plan)}
/// refreshes it from the model.
///
/// ### Contracts
/// - **Invariant**: agent ids are unique within a plan
/// - **Invariant**: the agent list itself never changes after construction; only
///   agent status and `parallel` flags do
///
/// @see PlanAgent
/// @see io.agentloom.core.graph.ExecutionGraphCompiler
public final class Plan {

    private final String id;
    private final String name;
    private final String thought;
    private final List<PlanAgent> agents;
    private volatile String markup;

    /// Creates a plan.
    ///
    /// @param id task identifier, used as prefix for agent ids, not null
    /// @param name plan name, not null (may be empty)
    /// @param thought planner rationale, not null (may be empty)
    /// @param agents ordered agents, not null
    /// @param markup source document, may be null
    public Plan(String id, String name, String thought, List<PlanAgent> agents, String markup) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.thought = Objects.requireNonNull(thought, "thought must not be null");
        this.agents = List.copyOf(agents);
        this.markup = markup;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getThought() {
        return thought;
    }

    public List<PlanAgent> getAgents() {
        return agents;
    }

    /// Finds an agent by id.
    ///
    /// @param agentId agent id, not null
    /// @return the agent, or empty if absent
    public Optional<PlanAgent> findAgent(String agentId) {
        return agents.stream().filter(a -> a.getId().equals(agentId)).findFirst();
    }

    /// Returns the cached markup document.
    ///
    /// @return markup text, may be null for programmatically built plans
    public String getMarkup() {
        return markup;
    }

    /// Replaces the cached markup. Called by the codec after re-serialization.
    ///
    /// @param markup new document text, not null
    public void setMarkup(String markup) {
        this.markup = Objects.requireNonNull(markup, "markup must not be null");
    }

    @Override
    public String toString() {
        return "Plan{id=" + id + ", name=" + name + ", agents=" + agents.size() + "}";
    }
}
