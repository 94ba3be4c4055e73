package io.agentwire.model;

import java.util.Map;
import java.util.Optional;

public record RequestEnvelope(
        String messageId,
        String fromAgent,
        String toAgent,
        String timestamp,
        Map<String, Object> payload
) implements Envelope {
    public RequestEnvelope {
        Payloads.requireText(messageId, "message_id");
        Payloads.requireText(fromAgent, "from_agent");
        Payloads.requireText(toAgent, "to_agent");
        payload = Payloads.freeze(payload);
    }

    /**
     * New request with a fresh message id and the current time.
     */
    public static RequestEnvelope create(String fromAgent, String toAgent, Map<String, Object> payload) {
        return new RequestEnvelope(Payloads.newMessageId(), fromAgent, toAgent, Payloads.now(), payload);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.REQUEST;
    }

    @Override
    public Optional<String> replyTo() {
        return Optional.empty();
    }
}
