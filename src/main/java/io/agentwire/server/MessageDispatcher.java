package io.agentwire.server;

import io.agentwire.agent.MessageHandler;
import io.agentwire.model.Envelope;
import io.agentwire.model.EnvelopeCodec;
import io.agentwire.model.ErrorEnvelope;
import io.agentwire.model.MalformedEnvelopeException;
import io.agentwire.model.RequestEnvelope;
import io.agentwire.model.ResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Turns one raw {@code POST /message} body into the reply envelope and its HTTP status.
 *
 * <p>Never throws for per-request problems: undecodable bodies become 400 error envelopes and
 * handler failures become 500 error envelopes carrying only the failure message.
 */
public final class MessageDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    public static final int STATUS_OK = 200;
    public static final int STATUS_BAD_REQUEST = 400;
    public static final int STATUS_HANDLER_FAILED = 500;

    private final String agentId;
    private final MessageHandler handler;

    public MessageDispatcher(String agentId, MessageHandler handler) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        this.agentId = agentId;
        this.handler = handler;
    }

    public Outcome dispatch(String body) {
        Envelope incoming;
        try {
            incoming = EnvelopeCodec.fromJson(body);
        } catch (MalformedEnvelopeException e) {
            log.warn("Rejected malformed envelope: {}", e.getMessage());
            ErrorEnvelope error = ErrorEnvelope.forUnreadable(
                    agentId,
                    e.recoveredFromAgent().orElse(null),
                    e.recoveredMessageId().orElse(null),
                    "malformed envelope: " + e.getMessage()
            );
            return new Outcome(STATUS_BAD_REQUEST, error);
        }
        if (!(incoming instanceof RequestEnvelope)) {
            log.warn("Rejected {} envelope {} from {}: only requests are accepted",
                    incoming.kind().wireName(), incoming.messageId(), incoming.fromAgent());
            ErrorEnvelope error = ErrorEnvelope.replyTo(
                    incoming,
                    agentId,
                    "expected message_type request, got " + incoming.kind().wireName()
            );
            return new Outcome(STATUS_BAD_REQUEST, error);
        }
        return dispatch((RequestEnvelope) incoming);
    }

    public Outcome dispatch(RequestEnvelope request) {
        log.info("Received message {} from {}", request.messageId(), request.fromAgent());
        try {
            Map<String, Object> result = handler.handle(request);
            if (result == null) {
                throw new IllegalStateException("handler returned no payload");
            }
            return new Outcome(STATUS_OK, ResponseEnvelope.replyTo(request, agentId, result));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            log.error("Error processing message {} from {}", request.messageId(), request.fromAgent(), e);
            return new Outcome(STATUS_HANDLER_FAILED, ErrorEnvelope.replyTo(request, agentId, describe(e)));
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    public record Outcome(int status, Envelope reply) {
        public boolean success() {
            return status >= 200 && status < 300;
        }
    }
}
