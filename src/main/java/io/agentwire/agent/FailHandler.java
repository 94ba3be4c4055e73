package io.agentwire.agent;

import io.agentwire.model.Capability;
import io.agentwire.model.RequestEnvelope;

import java.util.Map;

public final class FailHandler implements MessageHandler {
    public static final Capability CAPABILITY = new Capability(
            "fail",
            "Always fails; exercises error envelopes",
            Map.of(),
            Map.of()
    );

    @Override
    public Map<String, Object> handle(RequestEnvelope request) {
        throw new IllegalStateException("intentional failure from fail handler");
    }
}
