package io.agentloom.core.capability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Name-keyed capability table of one agent.
///
/// Built per agent from its static capabilities and, when the agent has a provider,
/// the discovered ones. Entries keep insertion order so that descriptors are
/// presented to the reasoning engine in a stable order.
///
/// ### Merge semantics
/// {@link #merge(Collection)} replaces same-named entries in place and appends new
/// ones, so a later source overrides an earlier one without reordering it.
///
/// @implNote Not thread-safe. A table is rebuilt on the agent's loop thread and
/// only read by concurrent invocations.
public final class CapabilityTable {

    private final Map<String, Capability> entries = new LinkedHashMap<>();

    /// Creates an empty table.
    public CapabilityTable() {}

    /// Creates a table with initial entries.
    ///
    /// @param capabilities initial capabilities, not null
    public CapabilityTable(Collection<? extends Capability> capabilities) {
        merge(capabilities);
    }

    /// Adds or replaces one entry.
    ///
    /// @param capability capability to register, not null
    /// @return this table
    public CapabilityTable put(Capability capability) {
        Objects.requireNonNull(capability, "capability must not be null");
        entries.put(capability.name(), capability);
        return this;
    }

    /// Merges capabilities into this table.
    ///
    /// @param capabilities capabilities that win over existing same-named entries, not null
    /// @return this table
    public CapabilityTable merge(Collection<? extends Capability> capabilities) {
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        capabilities.forEach(this::put);
        return this;
    }

    public Optional<Capability> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public List<Capability> all() {
        return List.copyOf(entries.values());
    }

    /// Returns the descriptors in table order.
    ///
    /// @return descriptors, never null
    public List<CapabilityDescriptor> descriptors() {
        List<CapabilityDescriptor> descriptors = new ArrayList<>(entries.size());
        for (Capability capability : entries.values()) {
            descriptors.add(capability.describe());
        }
        return descriptors;
    }

    public int size() {
        return entries.size();
    }
}
