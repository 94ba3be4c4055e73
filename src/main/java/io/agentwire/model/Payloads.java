package io.agentwire.model;

import io.agentwire.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

final class Payloads {
    private Payloads() {
    }

    /**
     * Deep, unmodifiable copy holding the same value types a decoded envelope would hold, so that
     * decode(encode(e)) equals e. JSON null values are kept.
     */
    static Map<String, Object> freeze(Map<String, Object> payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return freezeMap(Jsons.normalizeObject(payload));
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value) {
        if (value instanceof Map) {
            return freezeMap((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(freezeValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Map<String, Object> freezeMap(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be empty");
        }
        return value;
    }

    static String newMessageId() {
        return UUID.randomUUID().toString();
    }

    static String now() {
        return Instant.now().toString();
    }
}
