package io.agentwire.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentwire.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps envelopes and discovery records to and from their flat snake_case JSON form.
 *
 * <p>Decoding is strict about kinds and required fields and lenient about extras: unknown keys
 * are ignored and an explicit JSON {@code null} for an optional field reads as absent.
 */
public final class EnvelopeCodec {
    public static final String MESSAGE_ID = "message_id";
    public static final String FROM_AGENT = "from_agent";
    public static final String TO_AGENT = "to_agent";
    public static final String MESSAGE_TYPE = "message_type";
    public static final String PAYLOAD = "payload";
    public static final String TIMESTAMP = "timestamp";
    public static final String REPLY_TO = "reply_to";

    private EnvelopeCodec() {
    }

    public static ObjectNode encode(Envelope envelope) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put(MESSAGE_ID, envelope.messageId());
        out.put(FROM_AGENT, envelope.fromAgent());
        out.put(TO_AGENT, envelope.toAgent());
        out.put(MESSAGE_TYPE, envelope.kind().wireName());
        out.set(PAYLOAD, Jsons.mapper().valueToTree(envelope.payload()));
        if (envelope.timestamp() != null) {
            out.put(TIMESTAMP, envelope.timestamp());
        }
        envelope.replyTo().ifPresent(id -> out.put(REPLY_TO, id));
        return out;
    }

    public static String toJson(Envelope envelope) {
        return Jsons.toJson(encode(envelope));
    }

    public static Envelope fromJson(String raw) {
        return decode(readTree(raw));
    }

    public static Envelope decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedEnvelopeException("envelope must be a JSON object");
        }
        String recoveredId = readableText(node, MESSAGE_ID);
        String recoveredFrom = readableText(node, FROM_AGENT);
        try {
            return decodeObject(node);
        } catch (MalformedEnvelopeException e) {
            throw e.withRecovered(recoveredId, recoveredFrom);
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException(e.getMessage(), recoveredId, recoveredFrom, e);
        }
    }

    private static Envelope decodeObject(JsonNode node) {
        MessageKind kind = MessageKind.fromWire(optionalText(node, MESSAGE_TYPE));
        String messageId = requiredText(node, MESSAGE_ID);
        String fromAgent = requiredText(node, FROM_AGENT);
        String toAgent = requiredText(node, TO_AGENT);
        Map<String, Object> payload = requiredObject(node, PAYLOAD);
        String timestamp = optionalText(node, TIMESTAMP);
        String replyTo = optionalText(node, REPLY_TO);

        return switch (kind) {
            case REQUEST -> {
                if (replyTo != null) {
                    throw new MalformedEnvelopeException("request must not carry reply_to");
                }
                yield new RequestEnvelope(messageId, fromAgent, toAgent, timestamp, payload);
            }
            case RESPONSE -> {
                if (replyTo == null) {
                    throw new MalformedEnvelopeException("response requires reply_to");
                }
                yield new ResponseEnvelope(messageId, fromAgent, toAgent, timestamp, payload, replyTo);
            }
            case ERROR -> new ErrorEnvelope(messageId, fromAgent, toAgent, timestamp, payload, replyTo);
        };
    }

    public static ObjectNode encodeDescriptor(AgentDescriptor descriptor) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("agent_id", descriptor.agentId());
        out.put("name", descriptor.name());
        out.put("description", descriptor.description());
        out.put("endpoint", descriptor.endpoint());
        ArrayNode capabilities = out.putArray("capabilities");
        for (Capability capability : descriptor.capabilities()) {
            ObjectNode c = capabilities.addObject();
            c.put("name", capability.name());
            c.put("description", capability.description());
            c.set("input_schema", Jsons.mapper().valueToTree(capability.inputSchema()));
            c.set("output_schema", Jsons.mapper().valueToTree(capability.outputSchema()));
        }
        out.put("framework", descriptor.framework());
        out.put("model_provider", descriptor.modelProvider());
        out.put("status", descriptor.status());
        return out;
    }

    public static AgentDescriptor descriptorFromJson(String raw) {
        return decodeDescriptor(readTree(raw));
    }

    public static AgentDescriptor decodeDescriptor(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedEnvelopeException("agent info must be a JSON object");
        }
        JsonNode rawCapabilities = node.get("capabilities");
        if (rawCapabilities == null || !rawCapabilities.isArray()) {
            throw new MalformedEnvelopeException("missing or invalid field: capabilities");
        }
        List<Capability> capabilities = new ArrayList<>();
        for (JsonNode c : rawCapabilities) {
            if (!c.isObject()) {
                throw new MalformedEnvelopeException("capability must be a JSON object");
            }
            capabilities.add(new Capability(
                    requiredText(c, "name"),
                    requiredString(c, "description"),
                    requiredObject(c, "input_schema"),
                    requiredObject(c, "output_schema")
            ));
        }
        try {
            return new AgentDescriptor(
                    requiredText(node, "agent_id"),
                    requiredString(node, "name"),
                    requiredString(node, "description"),
                    requiredText(node, "endpoint"),
                    capabilities,
                    requiredString(node, "framework"),
                    requiredString(node, "model_provider"),
                    optionalText(node, "status")
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException(e.getMessage(), e);
        }
    }

    private static JsonNode readTree(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedEnvelopeException("empty body");
        }
        try {
            return Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String requiredText(JsonNode node, String field) {
        String value = requiredString(node, field);
        if (value.isBlank()) {
            throw new MalformedEnvelopeException("blank field: " + field);
        }
        return value;
    }

    private static String requiredString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedEnvelopeException("missing field: " + field);
        }
        if (!value.isTextual()) {
            throw new MalformedEnvelopeException("field must be a string: " + field);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedEnvelopeException("field must be a string: " + field);
        }
        return value.asText();
    }

    private static Map<String, Object> requiredObject(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedEnvelopeException("missing field: " + field);
        }
        if (!value.isObject()) {
            throw new MalformedEnvelopeException("field must be an object: " + field);
        }
        return Jsons.toMap(value);
    }

    private static String readableText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
