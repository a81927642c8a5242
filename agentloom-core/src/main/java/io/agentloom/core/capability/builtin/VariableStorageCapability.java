package io.agentloom.core.capability.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.capability.Capability;
import io.agentloom.core.capability.CapabilityDescriptor;
import io.agentloom.core.capability.CapabilityResult;
import io.agentloom.core.capability.InvocationContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Built-in capability over the task-wide variable store.
///
/// Lets agents hand values to each other through the `input`/`output` bindings of
/// their steps. Writes are last-write-wins; concurrent agents see each other's writes
/// as soon as they happen.
///
/// ### Operations
/// | `operation`         | Arguments                 | Result                          |
/// |---------------------|---------------------------|---------------------------------|
/// | `read_variable`     | `name` (comma-separated)  | JSON object of the found values |
/// | `write_variable`    | `name`, `value`           | `success`                       |
/// | `list_all_variable` | none                      | JSON array of variable names    |
///
/// Missing arguments produce an `Error: ...` text result rather than an exception.
public final class VariableStorageCapability implements Capability {

    public static final String NAME = "variable_storage";

    private static final CapabilityDescriptor DESCRIPTOR =
            new CapabilityDescriptor(
                    NAME,
                    "Used for storing, reading, and retrieving variable data, and maintaining"
                            + " input/output variables in task nodes. When the same variable is"
                            + " stored repeatedly, it will overwrite the previous value.",
                    schema());

    private final ObjectMapper mapper;

    public VariableStorageCapability(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public CapabilityDescriptor describe() {
        return DESCRIPTOR;
    }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, InvocationContext context)
            throws JsonProcessingException {
        Map<String, Object> variables = context.agentContext().task().variables();
        String operation = stringArgument(arguments, "operation");
        String name = stringArgument(arguments, "name");

        if ("read_variable".equals(operation)) {
            if (name == null || name.isBlank()) {
                return CapabilityResult.text("Error: name is required");
            }
            Map<String, Object> found = new LinkedHashMap<>();
            for (String key : name.split(",")) {
                Object value = variables.get(key.trim());
                if (value != null) {
                    found.put(key.trim(), value);
                }
            }
            return CapabilityResult.text(mapper.writeValueAsString(found));
        }
        if ("write_variable".equals(operation)) {
            if (name == null || name.isBlank()) {
                return CapabilityResult.text("Error: name is required");
            }
            Object value = arguments.get("value");
            if (value == null || "".equals(value)) {
                return CapabilityResult.text("Error: value is required");
            }
            variables.put(name.trim(), value);
            return CapabilityResult.text("success");
        }
        if ("list_all_variable".equals(operation)) {
            return CapabilityResult.text(mapper.writeValueAsString(new ArrayList<>(variables.keySet())));
        }
        return CapabilityResult.text("Error: unknown operation " + operation);
    }

    @Override
    public boolean supportsConcurrentCalls() {
        return true;
    }

    private static String stringArgument(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        return value != null ? value.toString() : null;
    }

    private static Map<String, Object> schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(
                "operation",
                Map.of(
                        "type", "string",
                        "description", "variable storage operation type.",
                        "enum", List.of("read_variable", "write_variable", "list_all_variable")));
        properties.put(
                "name",
                Map.of(
                        "type", "string",
                        "description",
                        "variable name, required when reading and writing variables. When"
                                + " reading, several names may be separated by commas."));
        properties.put(
                "value",
                Map.of("type", "string", "description", "variable value, required when writing"));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("operation"));
        return schema;
    }
}
