package io.agentloom.core.reasoning;

import io.agentloom.core.execution.CancellationToken;
import java.util.function.Consumer;

/// External component proposing an agent's next text or capability calls.
///
/// The engine streams its answer into `sink` on the calling thread, in order, and
/// returns when the response is complete.
///
/// ### Contracts
/// - **Postcondition**: a complete response ends with exactly one
///   {@link ReasoningEvent.Finish}
/// - **Postcondition**: transport failures are thrown, not delivered as events
/// - **Invariant**: `sink` is never called after this method returns
///
/// @see ReasoningGateway for retry and compression around this contract
@FunctionalInterface
public interface ReasoningEngine {

    /// Streams one response.
    ///
    /// @param request the request, not null
    /// @param sink receives events in order, not null
    /// @param cancellation aborts the request, not null
    /// @throws Exception on transport failure
    void stream(
            ReasoningRequest request, Consumer<ReasoningEvent> sink, CancellationToken cancellation)
            throws Exception;
}
