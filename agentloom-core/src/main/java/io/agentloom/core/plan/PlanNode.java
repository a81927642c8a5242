package io.agentloom.core.plan;

import java.util.List;
import java.util.Objects;

/// A single unit of work inside a {@link PlanAgent}'s step list.
///
/// ### Variants
/// - {@link Step} - plain instruction text with optional variable bindings
/// - {@link ForEach} - repeats nested steps for every element of a collection variable
/// - {@link Watch} - waits for an event, then runs its trigger steps (optionally looping)
///
/// Nodes are immutable. Within an agent they are addressed by their position in
/// the `nodes` element, starting at zero.
///
/// @see io.agentloom.core.plan.markup.PlanMarkupCodec#extractNode(String, int)
public sealed interface PlanNode {

    /// Default collection variable iterated by a {@link ForEach} without `items`.
    String DEFAULT_ITEMS = "list";

    /// Default event observed by a {@link Watch} without `event`.
    String DEFAULT_WATCH_EVENT = "dom";

    /// Plain instruction step.
    ///
    /// @param text instruction text, not null (may be empty)
    /// @param input name of the shared variable read by this step, may be null
    /// @param output name of the shared variable written by this step, may be null
    record Step(String text, String input, String output) implements PlanNode {

        public Step {
            Objects.requireNonNull(text, "text must not be null");
        }

        /// Creates a step without variable bindings.
        ///
        /// @param text instruction text, not null
        /// @return new step, never null
        public static Step of(String text) {
            return new Step(text, null, null);
        }

        /// Returns whether this step reads or writes a shared variable.
        ///
        /// @return `true` if `input` or `output` is set
        public boolean hasBindings() {
            return (input != null && !input.isBlank()) || (output != null && !output.isBlank());
        }
    }

    /// Iterates a named collection variable.
    ///
    /// @param items name of the collection variable, not null
    /// @param steps steps repeated for each element, not null
    record ForEach(String items, List<Step> steps) implements PlanNode {

        public ForEach {
            Objects.requireNonNull(items, "items must not be null");
            steps = List.copyOf(steps);
        }
    }

    /// Event-triggered block.
    ///
    /// @param event event name, not null
    /// @param loop whether the trigger re-arms after firing
    /// @param description human readable condition, not null
    /// @param triggers steps run when the event fires; {@link Step} or {@link ForEach}, not null
    record Watch(String event, boolean loop, String description, List<PlanNode> triggers)
            implements PlanNode {

        public Watch {
            Objects.requireNonNull(event, "event must not be null");
            Objects.requireNonNull(description, "description must not be null");
            triggers = List.copyOf(triggers);
        }
    }
}
