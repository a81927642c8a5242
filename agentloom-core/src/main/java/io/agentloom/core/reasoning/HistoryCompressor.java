package io.agentloom.core.reasoning;

import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.execution.CancellationToken;
import java.util.List;

/// Shrinks an agent transcript that has grown past the configured thresholds.
///
/// ### Contracts
/// - **Postcondition**: the returned history starts with the original system and first
///   user messages
/// - **Postcondition**: no tool result is left without its preceding call
///
/// @see SlidingWindowCompressor for the default implementation
@FunctionalInterface
public interface HistoryCompressor {

    /// Returns a compressed copy of the history.
    ///
    /// @param agentId owning agent, not null
    /// @param messages current history, not null
    /// @param capabilities capabilities offered to the agent, not null
    /// @param cancellation aborts the compression, not null
    /// @return replacement history, never null
    List<Message> compress(
            String agentId,
            List<Message> messages,
            List<CapabilityDescriptor> capabilities,
            CancellationToken cancellation);
}
