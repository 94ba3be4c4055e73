package io.agentwire.client;

import io.agentwire.model.AgentDescriptor;
import io.agentwire.model.Envelope;
import io.agentwire.model.EnvelopeCodec;
import io.agentwire.model.MalformedEnvelopeException;
import io.agentwire.model.RequestEnvelope;
import io.agentwire.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends requests to other agents and resolves their descriptors.
 *
 * <p>Every call is one blocking HTTP exchange bounded by the configured timeout; failures surface
 * as {@link TransportException} and are never retried. A reply of kind {@code error} is not a
 * transport failure when it arrives with a 2xx status: its payload is returned like any other,
 * and callers inspect the payload's own {@code status} field.
 *
 * <p>Descriptors fetched through {@link #getAgentInfo(String)} are cached per endpoint string for
 * the lifetime of the client and are never refreshed automatically; use
 * {@link #invalidate(String)} or {@link #clearCache()} to force a new fetch.
 */
public final class MessageClient {
    private static final Logger log = LoggerFactory.getLogger(MessageClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final String agentId;
    private final Duration timeout;
    private final HttpClient http;
    private final ConcurrentMap<String, AgentDescriptor> agentCache = new ConcurrentHashMap<>();

    public MessageClient(String agentId) {
        this(agentId, DEFAULT_TIMEOUT);
    }

    public MessageClient(String agentId, Duration timeout) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.agentId = agentId;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    public String agentId() {
        return agentId;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Sends {@code payload} to the agent at {@code endpoint} and returns the reply's payload,
     * whether the reply is a response or an error envelope.
     */
    public Map<String, Object> sendRequest(String toAgent, String endpoint, Map<String, Object> payload) {
        return exchange(toAgent, endpoint, payload).payload();
    }

    /**
     * Like {@link #sendRequest} but returns the whole decoded reply, including its kind and
     * correlation fields.
     */
    public Envelope exchange(String toAgent, String endpoint, Map<String, Object> payload) {
        RequestEnvelope request = RequestEnvelope.create(agentId, toAgent, payload);
        String url = url(endpoint, "/message");
        log.debug("Sending message {} to {} at {}", request.messageId(), toAgent, url);
        HttpRequest httpRequest = HttpRequest.newBuilder(toUri(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(EnvelopeCodec.toJson(request), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(httpRequest, url);
        try {
            return EnvelopeCodec.fromJson(response.body());
        } catch (MalformedEnvelopeException e) {
            throw new TransportException(
                    "Undecodable reply from " + url + ": " + e.getMessage(), response.statusCode(), response.body(), e);
        }
    }

    /**
     * Descriptor of the agent at {@code endpoint}; fetched from {@code GET /info} on first use and
     * served from the cache afterwards. Failed fetches are not cached.
     */
    public AgentDescriptor getAgentInfo(String endpoint) {
        requireEndpoint(endpoint);
        AgentDescriptor cached = agentCache.get(endpoint);
        if (cached != null) {
            return cached;
        }
        AgentDescriptor fetched = fetchAgentInfo(endpoint);
        AgentDescriptor raced = agentCache.putIfAbsent(endpoint, fetched);
        if (raced != null) {
            return raced;
        }
        log.debug("Cached agent info for {} ({})", endpoint, fetched.agentId());
        return fetched;
    }

    public void invalidate(String endpoint) {
        agentCache.remove(endpoint);
    }

    public void clearCache() {
        agentCache.clear();
    }

    public Set<String> cachedEndpoints() {
        return Set.copyOf(agentCache.keySet());
    }

    /**
     * Liveness probe: the body of {@code GET /health}.
     */
    public Map<String, Object> health(String endpoint) {
        String url = url(endpoint, "/health");
        HttpResponse<String> response = send(get(url), url);
        try {
            return Jsons.parseObject(response.body());
        } catch (IllegalArgumentException e) {
            throw new TransportException("Undecodable health reply from " + url, response.statusCode(), response.body(), e);
        }
    }

    /**
     * Polls {@code /health} until it answers or {@code maxAttempts} probes have failed. Returns
     * {@code false} if interrupted.
     */
    public boolean waitForAgent(String endpoint, int maxAttempts, Duration delay) {
        for (int attempt = 1; attempt <= Math.max(1, maxAttempts); attempt++) {
            try {
                health(endpoint);
                return true;
            } catch (TransportException e) {
                log.debug("Agent at {} not ready (attempt {}/{}): {}", endpoint, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    private AgentDescriptor fetchAgentInfo(String endpoint) {
        String url = url(endpoint, "/info");
        HttpResponse<String> response = send(get(url), url);
        try {
            return EnvelopeCodec.descriptorFromJson(response.body());
        } catch (MalformedEnvelopeException e) {
            throw new TransportException(
                    "Undecodable agent info from " + url + ": " + e.getMessage(), response.statusCode(), response.body(), e);
        }
    }

    private HttpRequest get(String url) {
        return HttpRequest.newBuilder(toUri(url))
                .timeout(timeout)
                .GET()
                .build();
    }

    // The request timeout only covers the wait for headers; the deadline below also bounds the body.
    private HttpResponse<String> send(HttpRequest request, String url) {
        CompletableFuture<HttpResponse<String>> pending =
                http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        HttpResponse<String> response;
        try {
            response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new TransportException("Request to " + url + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new TransportException("Request to " + url + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while calling " + url, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new TransportException(
                    "Request to " + url + " failed status=" + response.statusCode(),
                    response.statusCode(),
                    response.body()
            );
        }
        return response;
    }

    private static String requireEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be empty");
        }
        return endpoint;
    }

    private static String url(String endpoint, String path) {
        String base = requireEndpoint(endpoint).trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private static URI toUri(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid endpoint URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new TransportException("Endpoint must be an http(s) URL: " + url, null);
        }
        return uri;
    }
}
