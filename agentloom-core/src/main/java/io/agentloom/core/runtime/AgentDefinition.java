package io.agentloom.core.runtime;

import io.agentloom.core.capability.Capability;
import io.agentloom.core.capability.CapabilityClient;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/// Capability provider a {@link io.agentloom.core.plan.PlanAgent} is bound to by name.
///
/// A definition carries the standing instructions of the provider, its static
/// capabilities and, for out-of-process providers, a factory for the protocol client.
/// A fresh client is created for each agent run so that the connection lives exactly
/// as long as the agent.
///
/// @param name provider name, matched against `PlanAgent.getName()`, not null
/// @param description standing instructions rendered into the system message, not null
/// @param capabilities static capabilities, not null (may be empty)
/// @param clientFactory creates the provider connection, may be null for local-only providers
/// @param discoveryFilter parameters passed to capability discovery, not null
/// @param concurrentRemoteCalls whether discovered capabilities may run concurrently
public record AgentDefinition(
        String name,
        String description,
        List<Capability> capabilities,
        Supplier<CapabilityClient> clientFactory,
        Map<String, Object> discoveryFilter,
        boolean concurrentRemoteCalls) {

    public AgentDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        capabilities = List.copyOf(capabilities);
        discoveryFilter = discoveryFilter != null ? Map.copyOf(discoveryFilter) : Map.of();
    }

    /// Creates a definition backed only by in-process capabilities.
    ///
    /// @param name provider name, not null
    /// @param description standing instructions, not null
    /// @param capabilities static capabilities, not null
    /// @return new definition, never null
    public static AgentDefinition local(
            String name, String description, List<Capability> capabilities) {
        return new AgentDefinition(name, description, capabilities, null, Map.of(), false);
    }

    /// Creates a definition whose capabilities are discovered from a provider.
    ///
    /// @param name provider name, not null
    /// @param description standing instructions, not null
    /// @param clientFactory creates the provider connection, not null
    /// @return new definition, never null
    public static AgentDefinition remote(
            String name, String description, Supplier<CapabilityClient> clientFactory) {
        Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        return new AgentDefinition(name, description, List.of(), clientFactory, Map.of(), false);
    }

    public boolean hasProvider() {
        return clientFactory != null;
    }
}
