package io.agentloom.adapter.langchain4j;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Converts untyped JSON-Schema maps, as carried by capability descriptors, into
/// LangChain4j schema elements.
///
/// Only the subset tool schemas use in practice is understood: `object`, `array`,
/// `string` (with `enum`), `integer`, `number` and `boolean`. Unknown or missing
/// types fall back to a string schema, which every provider accepts.
final class JsonSchemaConverter {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonSchemaConverter() {}

    /// Converts a top-level arguments schema.
    ///
    /// @param schema JSON-Schema map, may be null
    /// @return object schema, never null (empty when `schema` is not an object schema)
    static JsonObjectSchema toObjectSchema(Map<String, Object> schema) {
        if (schema == null || !isObject(schema)) {
            return JsonObjectSchema.builder().build();
        }
        return objectSchema(schema);
    }

    /// Converts a single schema element.
    ///
    /// @param schema JSON-Schema map, not null
    /// @return converted element, never null
    static JsonSchemaElement toElement(Map<String, Object> schema) {
        String description = string(schema.get("description"));
        if (schema.get("enum") instanceof List<?> values) {
            List<String> names = new ArrayList<>(values.size());
            values.forEach(value -> names.add(String.valueOf(value)));
            return JsonEnumSchema.builder().description(description).enumValues(names).build();
        }
        if (isObject(schema)) {
            return objectSchema(schema);
        }
        String type = type(schema);
        if (type == null) {
            return JsonStringSchema.builder().description(description).build();
        }
        return switch (type) {
            case "integer" -> JsonIntegerSchema.builder().description(description).build();
            case "number" -> JsonNumberSchema.builder().description(description).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description).build();
            case "array" -> JsonArraySchema.builder()
                    .description(description)
                    .items(schema.get("items") instanceof Map<?, ?> items
                            ? toElement(cast(items))
                            : JsonStringSchema.builder().build())
                    .build();
            default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private static JsonObjectSchema objectSchema(Map<String, Object> schema) {
        Map<String, JsonSchemaElement> properties = new LinkedHashMap<>();
        if (schema.get("properties") instanceof Map<?, ?> raw) {
            raw.forEach((name, value) -> {
                if (value instanceof Map<?, ?> property) {
                    properties.put(String.valueOf(name), toElement(cast(property)));
                }
            });
        }
        List<String> required = new ArrayList<>();
        if (schema.get("required") instanceof List<?> names) {
            for (Object name : names) {
                if (properties.containsKey(String.valueOf(name))) {
                    required.add(String.valueOf(name));
                }
            }
        }
        return JsonObjectSchema.builder()
                .description(string(schema.get("description")))
                .addProperties(properties)
                .required(required)
                .build();
    }

    private static boolean isObject(Map<String, Object> schema) {
        String type = type(schema);
        return "object".equals(type) || (type == null && schema.containsKey("properties"));
    }

    /// Resolves `type`, taking the first non-null entry of a union such as `["string", "null"]`.
    private static String type(Map<String, Object> schema) {
        Object type = schema.get("type");
        if (type instanceof String text) {
            return text;
        }
        if (type instanceof List<?> union) {
            for (Object entry : union) {
                if (entry instanceof String text && !"null".equals(text)) {
                    return text;
                }
            }
        }
        return null;
    }

    private static String string(Object value) {
        return value instanceof String text ? text : null;
    }

    private static Map<String, Object> cast(Map<?, ?> map) {
        return MAPPER.convertValue(map, MAP_TYPE);
    }
}
