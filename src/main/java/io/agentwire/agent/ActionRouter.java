package io.agentwire.agent;

import io.agentwire.model.Capability;
import io.agentwire.model.RequestEnvelope;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatches on the payload's {@code action} key. Each registered capability name is one action.
 *
 * <p>An unknown or missing action is answered in-band with {@code status=error}; it is not a
 * protocol failure.
 */
public final class ActionRouter implements MessageHandler {
    public static final String ACTION = "action";

    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();
    private final List<Capability> capabilities = new CopyOnWriteArrayList<>();

    public ActionRouter register(Capability capability, MessageHandler handler) {
        if (capability == null || handler == null) {
            throw new IllegalArgumentException("capability and handler are required");
        }
        if (handlers.putIfAbsent(capability.name(), handler) != null) {
            throw new IllegalArgumentException("action already registered: " + capability.name());
        }
        capabilities.add(capability);
        return this;
    }

    public Optional<MessageHandler> findByAction(String action) {
        return action == null ? Optional.empty() : Optional.ofNullable(handlers.get(action));
    }

    /**
     * Registered capabilities in registration order, for the agent descriptor.
     */
    public List<Capability> capabilities() {
        return List.copyOf(capabilities);
    }

    @Override
    public Map<String, Object> handle(RequestEnvelope request) throws Exception {
        Object rawAction = request.payload().get(ACTION);
        String action = rawAction == null ? null : rawAction.toString();
        Optional<MessageHandler> handler = findByAction(action);
        if (handler.isEmpty()) {
            return HandlerResults.error("Unknown action: " + action);
        }
        return handler.get().handle(request);
    }
}
