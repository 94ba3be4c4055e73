package io.agentwire.model;

import java.util.Map;
import java.util.Optional;

public record ResponseEnvelope(
        String messageId,
        String fromAgent,
        String toAgent,
        String timestamp,
        Map<String, Object> payload,
        String inReplyTo
) implements Envelope {
    public ResponseEnvelope {
        Payloads.requireText(messageId, "message_id");
        Payloads.requireText(fromAgent, "from_agent");
        Payloads.requireText(toAgent, "to_agent");
        Payloads.requireText(inReplyTo, "reply_to");
        payload = Payloads.freeze(payload);
    }

    /**
     * Reply to {@code request}: fresh id, addressed back to the request's sender, correlated
     * through {@code reply_to}.
     */
    public static ResponseEnvelope replyTo(RequestEnvelope request, String fromAgent, Map<String, Object> payload) {
        return new ResponseEnvelope(
                Payloads.newMessageId(),
                fromAgent,
                request.fromAgent(),
                Payloads.now(),
                payload,
                request.messageId()
        );
    }

    @Override
    public MessageKind kind() {
        return MessageKind.RESPONSE;
    }

    @Override
    public Optional<String> replyTo() {
        return Optional.of(inReplyTo);
    }
}
