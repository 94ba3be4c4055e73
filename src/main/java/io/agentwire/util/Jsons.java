package io.agentwire.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Jsons {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toPrettyJson(Object value) {
        try {
            return PRETTY_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    /**
     * Converts a JSON object node into a mutable, insertion-ordered map of plain Java values
     * (String, Number, Boolean, null, List, Map).
     */
    public static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("JSON object expected");
        }
        return MAPPER.convertValue(node, MAP_TYPE);
    }

    /**
     * Rewrites {@code value} through its JSON text so the result holds exactly the types a decoder
     * would produce (a {@code Long} of int size becomes an {@code Integer}, a {@code Float} a
     * {@code Double}). The returned map and its nested containers are fresh copies.
     */
    public static Map<String, Object> normalizeObject(Map<String, Object> value) {
        try {
            return MAPPER.readValue(MAPPER.writeValueAsString(value), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not representable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Map<String, Object> parseObject(String raw) {
        try {
            return toMap(MAPPER.readTree(raw));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
