package io.agentloom.core.plan;

/// Lifecycle state of a {@link PlanAgent}.
///
/// ```
/// INIT → RUNNING → DONE
///                ↘ ERROR
/// ```
///
/// `DONE` and `ERROR` are terminal.
public enum AgentStatus {
    INIT,
    RUNNING,
    DONE,
    ERROR;

    /// Returns whether no further transition is allowed from this state.
    ///
    /// @return `true` for `DONE` and `ERROR`
    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    /// Returns the lowercase name used in the plan markup and lifecycle events.
    ///
    /// @return wire name, never null
    public String wireName() {
        return name().toLowerCase();
    }
}
