package io.agentloom.core.capability;

import io.agentloom.core.execution.CancellationToken;
import java.util.List;
import java.util.Map;

/// Connection to an out-of-process capability provider.
///
/// The runtime opens the connection lazily when an agent starts and closes it when
/// the agent reaches a terminal state, whatever the outcome.
///
/// ### Contracts
/// - **Precondition**: {@link #connect(CancellationToken)} precedes list and invoke calls
/// - **Postcondition**: provider errors surface as {@link CapabilityException}s naming the
///   failed method
/// - **Invariant**: every blocking call honours its cancellation token
///
/// @implNote Implementations must be thread-safe; concurrent invocations share
/// one connection.
public interface CapabilityClient extends AutoCloseable {

    /// Opens the connection and performs the protocol handshake.
    ///
    /// @param cancellation aborts the attempt, not null
    /// @throws CapabilityException if the provider cannot be reached
    void connect(CancellationToken cancellation);

    /// Returns whether the connection is currently usable.
    ///
    /// @return `true` if connected
    boolean isConnected();

    /// Discovers the capabilities offered by the provider.
    ///
    /// @param filter provider-specific discovery parameters, not null (may be empty)
    /// @param cancellation aborts the request, not null
    /// @return descriptors, never null
    List<CapabilityDescriptor> listCapabilities(
            Map<String, Object> filter, CancellationToken cancellation);

    /// Invokes a capability on the provider.
    ///
    /// @param name capability name, not null
    /// @param arguments arguments, not null
    /// @param cancellation aborts the request, not null
    /// @return the provider's result, never null
    /// @throws CapabilityException if the provider reports an error
    CapabilityResult invoke(
            String name, Map<String, Object> arguments, CancellationToken cancellation);

    /// Closes the connection. Idempotent.
    @Override
    void close();
}
