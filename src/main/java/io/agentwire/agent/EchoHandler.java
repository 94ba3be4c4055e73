package io.agentwire.agent;

import io.agentwire.model.Capability;
import io.agentwire.model.RequestEnvelope;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns the request's {@code text} unchanged. Smoke-test handler for a freshly deployed agent.
 */
public final class EchoHandler implements MessageHandler {
    public static final Capability CAPABILITY = new Capability(
            "echo",
            "Echo the given text back to the sender",
            Map.of("text", "string"),
            Map.of("text", "string")
    );

    @Override
    public Map<String, Object> handle(RequestEnvelope request) {
        Object text = request.payload().get("text");
        if (text == null) {
            return HandlerResults.error("No text");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", text);
        return HandlerResults.success(fields);
    }
}
