package io.agentwire.model;

import java.util.Optional;

/**
 * A body that does not decode into a valid envelope or descriptor.
 *
 * <p>When the offending body was at least a JSON object, the sender's {@code message_id} and
 * {@code from_agent} are kept if they were readable, so an error reply can still be addressed.
 */
public class MalformedEnvelopeException extends RuntimeException {
    private final String recoveredMessageId;
    private final String recoveredFromAgent;

    public MalformedEnvelopeException(String message) {
        this(message, null, null, null);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public MalformedEnvelopeException(String message, String recoveredMessageId, String recoveredFromAgent) {
        this(message, recoveredMessageId, recoveredFromAgent, null);
    }

    public MalformedEnvelopeException(
            String message,
            String recoveredMessageId,
            String recoveredFromAgent,
            Throwable cause
    ) {
        super(message, cause);
        this.recoveredMessageId = recoveredMessageId;
        this.recoveredFromAgent = recoveredFromAgent;
    }

    public Optional<String> recoveredMessageId() {
        return Optional.ofNullable(recoveredMessageId);
    }

    public Optional<String> recoveredFromAgent() {
        return Optional.ofNullable(recoveredFromAgent);
    }

    MalformedEnvelopeException withRecovered(String messageId, String fromAgent) {
        return new MalformedEnvelopeException(getMessage(), messageId, fromAgent, getCause());
    }
}
