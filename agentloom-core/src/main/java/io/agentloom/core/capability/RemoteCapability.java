package io.agentloom.core.capability;

import java.util.Map;
import java.util.Objects;

/// Capability discovered from a provider and executed through its client.
///
/// @param descriptor descriptor as listed by the provider, not null
/// @param client connection used for invocation, not null
/// @param concurrent whether calls may overlap
public record RemoteCapability(
        CapabilityDescriptor descriptor, CapabilityClient client, boolean concurrent)
        implements Capability {

    public RemoteCapability {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public CapabilityDescriptor describe() {
        return descriptor;
    }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, InvocationContext context) {
        return client.invoke(descriptor.name(), arguments, context.cancellation());
    }

    @Override
    public boolean supportsConcurrentCalls() {
        return concurrent;
    }
}
