package io.agentwire.model;

import java.util.Map;
import java.util.Optional;

/**
 * Addressed unit of transport between agents.
 *
 * <p>Each kind is its own record so kind-specific rules hold by construction: a
 * {@link RequestEnvelope} has no {@code reply_to}, a {@link ResponseEnvelope} always has one,
 * and an {@link ErrorEnvelope} has one whenever the originating request id was known.
 * {@code fromAgent}/{@code toAgent} are advisory; nothing checks that the answering server is
 * the addressed agent.
 */
public interface Envelope {
    String messageId();

    String fromAgent();

    String toAgent();

    /**
     * ISO-8601 creation time as it appeared on the wire, or {@code null} if a decoded envelope
     * carried none. Advisory only.
     */
    String timestamp();

    Map<String, Object> payload();

    MessageKind kind();

    Optional<String> replyTo();
}
