package io.agentloom.core.runtime;

/// When an agent re-lists the capabilities of its provider.
public enum DiscoveryPolicy {
    /// Discover once, before the first reasoning request.
    FIRST_ITERATION,
    /// Discover before every reasoning request.
    EVERY_ITERATION,
    /// Use static capabilities only.
    NEVER;

    /// Returns whether discovery runs before the given loop iteration.
    ///
    /// @param iteration zero-based iteration
    /// @return `true` if capabilities are to be refreshed
    public boolean shouldRefresh(int iteration) {
        return switch (this) {
            case FIRST_ITERATION -> iteration == 0;
            case EVERY_ITERATION -> true;
            case NEVER -> false;
        };
    }
}
