package io.agentwire.client;

import io.agentwire.model.Envelope;
import io.agentwire.model.EnvelopeCodec;
import io.agentwire.model.ErrorEnvelope;
import io.agentwire.model.MalformedEnvelopeException;

import java.util.Optional;

/**
 * A call that did not produce a usable reply: network failure, timeout, non-2xx status, or a
 * body that does not decode. Never retried by the client.
 */
public class TransportException extends RuntimeException {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    public TransportException(String message, Throwable cause) {
        this(message, NO_STATUS, null, cause);
    }

    public TransportException(String message, int statusCode, String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    public TransportException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * HTTP status of the failed call, or {@link #NO_STATUS} when no response arrived.
     */
    public int statusCode() {
        return statusCode;
    }

    public Optional<String> responseBody() {
        return Optional.ofNullable(responseBody);
    }

    /**
     * The structured error reply carried by a failed call, when the body holds one.
     */
    public Optional<ErrorEnvelope> errorEnvelope() {
        if (responseBody == null || responseBody.isBlank()) {
            return Optional.empty();
        }
        try {
            Envelope envelope = EnvelopeCodec.fromJson(responseBody);
            return envelope instanceof ErrorEnvelope ? Optional.of((ErrorEnvelope) envelope) : Optional.empty();
        } catch (MalformedEnvelopeException e) {
            return Optional.empty();
        }
    }
}
