package io.agentloom.core.reasoning;

import java.util.Map;
import java.util.Objects;

/// A finalized capability call proposed by the reasoning engine.
///
/// @param id engine-assigned call id, correlates the result, not null
/// @param name capability name, not null
/// @param arguments decoded arguments, not null
/// @param rawArguments arguments as streamed by the engine, not null
public record ToolCallRequest(
        String id, String name, Map<String, Object> arguments, String rawArguments) {

    public ToolCallRequest {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments != null ? arguments : Map.of();
        rawArguments = rawArguments != null ? rawArguments : "{}";
    }
}
