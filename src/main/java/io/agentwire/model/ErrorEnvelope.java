package io.agentwire.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Protocol-level failure reply. {@code inReplyTo} is {@code null} only when the request that
 * caused the failure could not be identified.
 */
public record ErrorEnvelope(
        String messageId,
        String fromAgent,
        String toAgent,
        String timestamp,
        Map<String, Object> payload,
        String inReplyTo
) implements Envelope {
    public static final String ERROR_KEY = "error";
    public static final String UNKNOWN_AGENT = "unknown";

    public ErrorEnvelope {
        Payloads.requireText(messageId, "message_id");
        Payloads.requireText(fromAgent, "from_agent");
        Payloads.requireText(toAgent, "to_agent");
        if (inReplyTo != null && inReplyTo.isBlank()) {
            throw new IllegalArgumentException("reply_to cannot be blank");
        }
        payload = Payloads.freeze(payload);
    }

    public static ErrorEnvelope replyTo(Envelope request, String fromAgent, String errorMessage) {
        return new ErrorEnvelope(
                Payloads.newMessageId(),
                fromAgent,
                request.fromAgent(),
                Payloads.now(),
                errorPayload(errorMessage),
                request.messageId()
        );
    }

    /**
     * Error reply for a request that was only partially readable. Missing addressing falls back
     * to {@value #UNKNOWN_AGENT} and an absent {@code reply_to}.
     */
    public static ErrorEnvelope forUnreadable(
            String fromAgent,
            String recoveredSender,
            String recoveredMessageId,
            String errorMessage
    ) {
        String to = recoveredSender == null || recoveredSender.isBlank() ? UNKNOWN_AGENT : recoveredSender;
        String reply = recoveredMessageId == null || recoveredMessageId.isBlank() ? null : recoveredMessageId;
        return new ErrorEnvelope(Payloads.newMessageId(), fromAgent, to, Payloads.now(), errorPayload(errorMessage), reply);
    }

    private static Map<String, Object> errorPayload(String errorMessage) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ERROR_KEY, errorMessage == null ? "" : errorMessage);
        return payload;
    }

    public String errorMessage() {
        Object value = payload.get(ERROR_KEY);
        return value == null ? "" : value.toString();
    }

    @Override
    public MessageKind kind() {
        return MessageKind.ERROR;
    }

    @Override
    public Optional<String> replyTo() {
        return Optional.ofNullable(inReplyTo);
    }
}
