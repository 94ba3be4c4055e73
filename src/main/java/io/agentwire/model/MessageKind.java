package io.agentwire.model;

public enum MessageKind {
    REQUEST("request"),
    RESPONSE("response"),
    ERROR("error");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Strict inverse of {@link #wireName()}. Case-sensitive, no default.
     */
    public static MessageKind fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedEnvelopeException("missing message_type");
        }
        for (MessageKind value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new MalformedEnvelopeException("unknown message_type: " + raw);
    }
}
