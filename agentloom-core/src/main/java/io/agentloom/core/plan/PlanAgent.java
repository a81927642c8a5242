package io.agentloom.core.plan;

import java.util.List;
import java.util.Objects;

/// One capability provider's sub-task within a {@link Plan}.
///
/// Structural fields are fixed at parse time. The execution status and the
/// `parallel` flag are the only mutable parts: the status is advanced by the
/// runtime, and the flag is assigned by the graph compiler once a final plan is
/// compiled.
///
/// ### Identifiers
/// The id is derived from the plan id and the agent's markup ordinal
/// (`<planId>-<NN>`, zero-padded to two digits). `dependsOn` entries use the same form
/// and may reference agents that do not exist; the compiler repairs such edges.
///
/// @implNote Status and flag are `volatile`; agents of one parallel stage are
/// updated from different threads.
public final class PlanAgent {

    private final String id;
    private final String name;
    private final List<String> dependsOn;
    private final String task;
    private final List<PlanNode> nodes;
    private final String markup;
    private volatile AgentStatus status;
    private volatile Boolean parallel;

    /// Creates an agent in status {@link AgentStatus#INIT}.
    ///
    /// @param id unique id within the plan, not null
    /// @param name capability provider name, not null
    /// @param dependsOn ids of prerequisite agents, not null
    /// @param task task text, not null
    /// @param nodes ordered steps, not null
    /// @param markup raw `agent` element this agent was parsed from, may be null
    public PlanAgent(
            String id,
            String name,
            List<String> dependsOn,
            String task,
            List<PlanNode> nodes,
            String markup) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dependsOn = List.copyOf(dependsOn);
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.nodes = List.copyOf(nodes);
        this.markup = markup;
        this.status = AgentStatus.INIT;
    }

    /// Builds the id of the agent with the given ordinal inside a plan.
    ///
    /// @param planId owning plan id, not null
    /// @param ordinal markup id or index, not null
    /// @return `<planId>-<NN>`, never null
    public static String agentId(String planId, String ordinal) {
        String trimmed = ordinal.trim();
        try {
            int value = Integer.parseInt(trimmed);
            return planId + "-" + (value < 10 ? "0" + value : String.valueOf(value));
        } catch (NumberFormatException e) {
            return planId + "-" + trimmed;
        }
    }

    /// Returns the ordinal suffix of this agent's id, as written to markup.
    ///
    /// @return numeric ordinal without padding, never null
    public String ordinal() {
        return ordinalOf(id);
    }

    /// Extracts the ordinal suffix from an agent id.
    ///
    /// @param agentId agent id in `<planId>-<NN>` form, not null
    /// @return ordinal without padding, never null
    public static String ordinalOf(String agentId) {
        String suffix = agentId.substring(agentId.lastIndexOf('-') + 1);
        try {
            return String.valueOf(Integer.parseInt(suffix));
        } catch (NumberFormatException e) {
            return suffix;
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public String getTask() {
        return task;
    }

    public List<PlanNode> getNodes() {
        return nodes;
    }

    /// Returns the raw markup fragment, or null for programmatically built agents.
    ///
    /// @return `agent` element text, may be null
    public String getMarkup() {
        return markup;
    }

    public AgentStatus getStatus() {
        return status;
    }

    /// Advances the status.
    ///
    /// @param status new status, not null
    /// @throws IllegalStateException if the current status is terminal and differs
    public void setStatus(AgentStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        AgentStatus current = this.status;
        if (current.isTerminal() && current != status && status != AgentStatus.RUNNING) {
            throw new IllegalStateException(
                    "Agent " + id + " already " + current.wireName() + ", cannot become "
                            + status.wireName());
        }
        this.status = status;
    }

    /// Returns whether this agent runs concurrently with siblings.
    ///
    /// @return flag set by the compiler, or null before compilation
    public Boolean getParallel() {
        return parallel;
    }

    public void setParallel(Boolean parallel) {
        this.parallel = parallel;
    }

    /// Returns whether any step declares a shared variable binding.
    ///
    /// @return `true` if at least one step (nested steps included) has `input` or `output`
    public boolean usesVariables() {
        return nodes.stream().anyMatch(PlanAgent::usesVariables);
    }

    private static boolean usesVariables(PlanNode node) {
        if (node instanceof PlanNode.Step step) {
            return step.hasBindings();
        }
        if (node instanceof PlanNode.ForEach) {
            return true;
        }
        if (node instanceof PlanNode.Watch watch) {
            return watch.triggers().stream().anyMatch(PlanAgent::usesVariables);
        }
        return false;
    }

    @Override
    public String toString() {
        return "PlanAgent{id=" + id + ", name=" + name + ", dependsOn=" + dependsOn
                + ", status=" + status + "}";
    }
}
