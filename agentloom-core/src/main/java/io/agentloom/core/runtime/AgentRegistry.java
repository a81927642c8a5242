package io.agentloom.core.runtime;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Name-keyed store of {@link AgentDefinition}s.
///
/// @implNote Thread-safe. Registration usually happens once at startup, lookups
/// happen from every agent thread.
public final class AgentRegistry {

    private final Map<String, AgentDefinition> definitions = new ConcurrentHashMap<>();

    public AgentRegistry() {}

    public AgentRegistry(List<AgentDefinition> initial) {
        initial.forEach(this::register);
    }

    /// Registers or replaces a definition.
    ///
    /// @param definition definition to register, not null
    public void register(AgentDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        definitions.put(definition.name(), definition);
    }

    public Optional<AgentDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }
}
