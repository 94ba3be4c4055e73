package io.agentwire.agent;

import io.agentwire.model.RequestEnvelope;

import java.util.Map;

/**
 * Agent-specific logic bound to a message server.
 *
 * <p>Returns a plain JSON-valued payload. By convention it carries {@code status}
 * ({@code "success"} or {@code "error"}) and a {@code message} on error, but the transport does
 * not look inside. Throwing turns the reply into an error envelope. Implementations may be
 * invoked concurrently from several server workers.
 */
@FunctionalInterface
public interface MessageHandler {
    Map<String, Object> handle(RequestEnvelope request) throws Exception;
}
