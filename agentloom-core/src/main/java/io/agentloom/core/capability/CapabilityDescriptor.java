package io.agentloom.core.capability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Describes a callable capability without implementation details.
///
/// Descriptors are what the reasoning engine sees: a name, a description and a
/// JSON-Schema object describing the arguments. They come either from a static
/// {@link Capability} or from a remote provider's `tools/list` answer.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: All fields immutable after construction
///
/// @param name unique capability identifier, not null
/// @param description human-readable description for the reasoning engine, not null
/// @param inputSchema JSON-Schema of the arguments object, not null (may be empty)
/// @see CapabilityTable for name-keyed lookup
public record CapabilityDescriptor(
        String name, String description, Map<String, Object> inputSchema) {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /// Compact constructor with validation.
    public CapabilityDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description != null ? description : "";
        inputSchema =
                inputSchema != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema))
                        : emptySchema();
    }

    /// Creates a descriptor for a capability without arguments.
    ///
    /// @param name unique identifier, not null
    /// @param description human-readable description, not null
    /// @return new descriptor, never null
    public static CapabilityDescriptor simple(String name, String description) {
        return new CapabilityDescriptor(name, description, emptySchema());
    }

    /// Builds a descriptor from an untyped provider map (`name`, `description`, `inputSchema`).
    ///
    /// @param raw map as decoded from JSON, not null
    /// @return new descriptor, never null
    /// @throws IllegalArgumentException if `name` is missing
    public static CapabilityDescriptor fromMap(Map<String, Object> raw) {
        Object name = raw.get("name");
        if (!(name instanceof String text) || text.isBlank()) {
            throw new IllegalArgumentException("Capability descriptor without name: " + raw);
        }
        Object schema = raw.get("inputSchema");
        return new CapabilityDescriptor(
                text,
                raw.get("description") instanceof String description ? description : "",
                schema instanceof Map<?, ?> map ? MAPPER.convertValue(map, MAP_TYPE) : emptySchema());
    }

    private static Map<String, Object> emptySchema() {
        return Map.of("type", "object", "properties", Map.of());
    }
}
