package io.agentloom.adapter.langchain4j;

import java.util.Objects;

/// Model parameters for {@link LangChain4jModelFactory}.
///
/// Null fields fall back to the factory defaults.
///
/// @param model model name, its prefix selects the provider, not null
/// @param temperature sampling temperature, may be null
/// @param maxTokens response token cap, may be null
/// @param timeoutSeconds HTTP timeout, may be null
/// @param topP nucleus sampling, may be null
public record ModelOptions(
        String model, Double temperature, Integer maxTokens, Long timeoutSeconds, Double topP) {

    public ModelOptions {
        Objects.requireNonNull(model, "model must not be null");
    }

    /// @param model model name, not null
    /// @return options with defaults for everything but the model
    public static ModelOptions of(String model) {
        return new ModelOptions(model, null, null, null, null);
    }
}
