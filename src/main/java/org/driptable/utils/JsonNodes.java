package org.driptable.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Map;

public final class JsonNodes {

    // Used by delegating creators, which have no access to the application mapper.
    static final ObjectMapper MAPPER = JsonMapper.builder().findAndAddModules().build();

    private JsonNodes() {
    }

    /*
     * Field readers for delegating creators. An absent or null field reads as null; a field of
     * the wrong type is rejected so that it fails deserialization instead of vanishing.
     */

    public static Integer intOrNull(JsonNode node, String owner, String field) {
        JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw mistyped(owner, field, "integer", value);
        }
        return value.intValue();
    }

    public static String textOrNull(JsonNode node, String owner, String field) {
        JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw mistyped(owner, field, "string", value);
        }
        return value.textValue();
    }

    public static Boolean boolOrNull(JsonNode node, String owner, String field) {
        JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        if (!value.isBoolean()) {
            throw mistyped(owner, field, "boolean", value);
        }
        return value.booleanValue();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> mapOrNull(JsonNode node, String owner, String field) {
        JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        if (!value.isObject()) {
            throw mistyped(owner, field, "object", value);
        }
        return MAPPER.convertValue(value, Map.class);
    }

    private static JsonNode present(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    private static IllegalArgumentException mistyped(String owner, String field, String type, JsonNode value) {
        return new IllegalArgumentException(owner + "." + field + " must be " + type + ", got " + value);
    }

    public static <T> T convert(JsonNode node, Class<T> type) {
        return MAPPER.convertValue(node, type);
    }

    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (com.fasterxml.jackson.core.JsonProcessingException ex) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }
}
