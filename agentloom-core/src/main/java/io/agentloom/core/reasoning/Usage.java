package io.agentloom.core.reasoning;

/// Token accounting reported with a finished response.
///
/// @param promptTokens tokens consumed by the request
/// @param completionTokens tokens produced
/// @param totalTokens sum as reported by the engine
public record Usage(int promptTokens, int completionTokens, int totalTokens) {

    /// Usage of an engine that reports nothing.
    public static final Usage EMPTY = new Usage(0, 0, 0);

    /// Adds two usages.
    ///
    /// @param other usage to add, not null
    /// @return combined usage, never null
    public Usage plus(Usage other) {
        return new Usage(
                promptTokens + other.promptTokens,
                completionTokens + other.completionTokens,
                totalTokens + other.totalTokens);
    }
}
