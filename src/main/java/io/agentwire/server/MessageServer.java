package io.agentwire.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.agentwire.agent.MessageHandler;
import io.agentwire.model.AgentDescriptor;
import io.agentwire.model.EnvelopeCodec;
import io.agentwire.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front of one agent: {@code GET /health}, {@code GET /info} and {@code POST /message}.
 *
 * <p>Each exchange runs on its own worker from a cached pool, so the bound handler must tolerate
 * concurrent calls. Per-request failures are always answered; only {@link #start()} is fail-fast.
 */
public final class MessageServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageServer.class);

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final String HEALTH_PATH = "/health";
    public static final String INFO_PATH = "/info";
    public static final String MESSAGE_PATH = "/message";

    private final AgentDescriptor descriptor;
    private final MessageDispatcher dispatcher;
    private final String host;
    private final int requestedPort;

    private HttpServer server;
    private ExecutorService workers;

    public MessageServer(AgentDescriptor descriptor, MessageHandler handler, int port) {
        this(descriptor, handler, DEFAULT_HOST, port);
    }

    public MessageServer(AgentDescriptor descriptor, MessageHandler handler, String host, int port) {
        if (descriptor == null) {
            throw new IllegalArgumentException("agent descriptor cannot be null");
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.descriptor = descriptor;
        this.dispatcher = new MessageDispatcher(descriptor.agentId(), handler);
        this.host = host == null || host.isBlank() ? DEFAULT_HOST : host;
        this.requestedPort = port;
    }

    public synchronized MessageServer start() {
        if (server != null) {
            throw new IllegalStateException("server already started for " + descriptor.agentId());
        }
        HttpServer http;
        try {
            http = HttpServer.create(new InetSocketAddress(host, requestedPort), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind " + host + ":" + requestedPort, e);
        }
        http.createContext(HEALTH_PATH, exchange -> serve(exchange, HEALTH_PATH, "GET", this::health));
        http.createContext(INFO_PATH, exchange -> serve(exchange, INFO_PATH, "GET", this::info));
        http.createContext(MESSAGE_PATH, exchange -> serve(exchange, MESSAGE_PATH, "POST", this::message));
        http.createContext("/", exchange -> {
            try {
                writeJson(exchange, Map.of("error", "not found"), 404);
            } finally {
                exchange.close();
            }
        });

        AtomicInteger threadCounter = new AtomicInteger();
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agentwire-http-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        http.setExecutor(workers);
        http.start();
        server = http;
        log.info("A2A server for {} listening on {}:{}", descriptor.agentId(), host, port());
        return this;
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(0);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
        workers = null;
        log.info("Stopped A2A server for {}", descriptor.agentId());
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    /**
     * Actual bound port; differs from the requested one when that was 0.
     */
    public synchronized int port() {
        if (server == null) {
            throw new IllegalStateException("server not started");
        }
        return server.getAddress().getPort();
    }

    public String baseUrl() {
        String advertisedHost = DEFAULT_HOST.equals(host) ? "127.0.0.1" : host;
        return "http://" + advertisedHost + ":" + port();
    }

    public AgentDescriptor descriptor() {
        return descriptor;
    }

    private void health(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("agent", descriptor.agentId());
        writeJson(exchange, body, 200);
    }

    private void info(HttpExchange exchange) throws IOException {
        writeJson(exchange, EnvelopeCodec.encodeDescriptor(descriptor), 200);
    }

    private void message(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        MessageDispatcher.Outcome outcome = dispatcher.dispatch(body);
        writeJson(exchange, EnvelopeCodec.encode(outcome.reply()), outcome.status());
    }

    private void serve(HttpExchange exchange, String path, String method, Route route) {
        try {
            if (!path.equals(exchange.getRequestURI().getPath())) {
                writeJson(exchange, Map.of("error", "not found"), 404);
                return;
            }
            if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", method);
                writeJson(exchange, Map.of("error", "method not allowed"), 405);
                return;
            }
            route.handle(exchange);
        } catch (IOException e) {
            log.warn("Failed to answer {} {}: {}", exchange.getRequestMethod(), path, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure serving {} {}", exchange.getRequestMethod(), path, e);
        } finally {
            exchange.close();
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }
}
