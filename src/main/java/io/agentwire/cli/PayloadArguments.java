package io.agentwire.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentwire.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a request payload from {@code --payload} JSON and repeated {@code --field key=value}
 * arguments. Field values that read as a complete JSON value keep that type; anything else is a
 * plain string. Fields override keys of the same name in the JSON payload.
 */
final class PayloadArguments {
    private PayloadArguments() {
    }

    static Map<String, Object> build(String payloadJson, List<String> fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (payloadJson != null && !payloadJson.isBlank()) {
            payload.putAll(Jsons.parseObject(payloadJson));
        }
        if (fields != null) {
            for (String field : fields) {
                int eq = field == null ? -1 : field.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("Field must be key=value: " + field);
                }
                String key = field.substring(0, eq).trim();
                if (key.isEmpty()) {
                    throw new IllegalArgumentException("Field must be key=value: " + field);
                }
                payload.put(key, value(field.substring(eq + 1)));
            }
        }
        return payload;
    }

    static Object value(String raw) {
        if (raw.isBlank()) {
            return raw;
        }
        try {
            JsonNode node = Jsons.mapper()
                    .readerFor(JsonNode.class)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(raw);
            return Jsons.mapper().convertValue(node, Object.class);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }
}
