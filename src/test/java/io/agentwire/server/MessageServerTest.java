package io.agentwire.server;

import io.agentwire.agent.ActionRouter;
import io.agentwire.agent.EchoHandler;
import io.agentwire.agent.FailHandler;
import io.agentwire.client.MessageClient;
import io.agentwire.client.TransportException;
import io.agentwire.model.AgentDescriptor;
import io.agentwire.model.Envelope;
import io.agentwire.model.EnvelopeCodec;
import io.agentwire.model.ErrorEnvelope;
import io.agentwire.model.MessageKind;
import io.agentwire.model.ResponseEnvelope;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

final class MessageServerTest {

    @Test
    void echoRoundTripOverHttp() {
        try (MessageServer server = startServer("echo-agent")) {
            MessageClient client = new MessageClient("tester", Duration.ofSeconds(5));

            Map<String, Object> reply = client.sendRequest("echo-agent", server.baseUrl(), Map.of("action", "echo", "text", "hi"));

            Assertions.assertEquals("success", reply.get("status"));
            Assertions.assertEquals("hi", reply.get("text"));
        }
    }

    @Test
    void exchangeReturnsCorrelatedResponse() {
        try (MessageServer server = startServer("echo-agent")) {
            MessageClient client = new MessageClient("tester", Duration.ofSeconds(5));

            Envelope reply = client.exchange("echo-agent", server.baseUrl() + "/", Map.of("action", "echo", "text", "x"));

            ResponseEnvelope response = Assertions.assertInstanceOf(ResponseEnvelope.class, reply);
            Assertions.assertEquals("echo-agent", response.fromAgent());
            Assertions.assertEquals("tester", response.toAgent());
            Assertions.assertNotNull(response.inReplyTo());
        }
    }

    @Test
    void bogusMessageTypeIsAnsweredWithErrorEnvelope() throws Exception {
        try (MessageServer server = startServer("echo-agent")) {
            String body = "{\"message_id\":\"probe-1\",\"from_agent\":\"prober\",\"to_agent\":\"echo-agent\","
                    + "\"message_type\":\"bogus\",\"payload\":{}}";

            HttpResponse<String> response = post(server.baseUrl() + "/message", body);

            Assertions.assertEquals(400, response.statusCode());
            Assertions.assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
            Envelope reply = EnvelopeCodec.fromJson(response.body());
            Assertions.assertEquals(MessageKind.ERROR, reply.kind());
            Assertions.assertEquals("prober", reply.toAgent());
            Assertions.assertEquals("probe-1", reply.replyTo().orElseThrow());
        }
    }

    @Test
    void serverKeepsAnsweringAfterRepeatedHandlerFailures() {
        try (MessageServer server = startServer("flaky")) {
            MessageClient client = new MessageClient("tester", Duration.ofSeconds(5));

            for (int i = 0; i < 5; i++) {
                TransportException ex = Assertions.assertThrows(TransportException.class, () ->
                        client.sendRequest("flaky", server.baseUrl(), Map.of("action", "fail")));
                Assertions.assertEquals(500, ex.statusCode());
                ErrorEnvelope error = ex.errorEnvelope().orElseThrow();
                Assertions.assertEquals("intentional failure from fail handler", error.errorMessage());
                Assertions.assertFalse(error.errorMessage().contains("at io.agentwire"));
            }
            Map<String, Object> health = client.health(server.baseUrl());
            Assertions.assertEquals("healthy", health.get("status"));
            Assertions.assertEquals("hi", client.sendRequest("flaky", server.baseUrl(), Map.of("action", "echo", "text", "hi")).get("text"));
        }
    }

    @Test
    void healthAndInfoDescribeTheAgent() {
        try (MessageServer server = startServer("echo-agent")) {
            MessageClient client = new MessageClient("tester", Duration.ofSeconds(5));

            Map<String, Object> health = client.health(server.baseUrl());
            AgentDescriptor info = client.getAgentInfo(server.baseUrl());

            Assertions.assertEquals(Map.of("status", "healthy", "agent", "echo-agent"), health);
            Assertions.assertEquals(server.descriptor(), info);
            Assertions.assertEquals(List.of("echo", "fail"), info.capabilities().stream().map(c -> c.name()).toList());
        }
    }

    @Test
    void unknownPathsAndWrongMethodsAreRejected() throws Exception {
        try (MessageServer server = startServer("echo-agent")) {
            HttpClient http = HttpClient.newHttpClient();

            HttpResponse<String> missing = http.send(
                    HttpRequest.newBuilder(URI.create(server.baseUrl() + "/nope")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> wrongMethod = http.send(
                    HttpRequest.newBuilder(URI.create(server.baseUrl() + "/message")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> infoSuffix = http.send(
                    HttpRequest.newBuilder(URI.create(server.baseUrl() + "/info/extra")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            Assertions.assertEquals(404, missing.statusCode());
            Assertions.assertEquals(405, wrongMethod.statusCode());
            Assertions.assertEquals("POST", wrongMethod.headers().firstValue("Allow").orElseThrow());
            Assertions.assertEquals(404, infoSuffix.statusCode());
        }
    }

    @Test
    void lifecycleIsFailFast() {
        MessageServer server = startServer("echo-agent");
        try {
            Assertions.assertTrue(server.isRunning());
            Assertions.assertTrue(server.port() > 0);
            Assertions.assertThrows(IllegalStateException.class, server::start);

            MessageServer clash = new MessageServer(server.descriptor(), new EchoHandler(), "127.0.0.1", server.port());
            Assertions.assertThrows(java.io.UncheckedIOException.class, clash::start);
        } finally {
            server.stop();
        }
        Assertions.assertFalse(server.isRunning());
        Assertions.assertThrows(IllegalStateException.class, server::port);
    }

    static MessageServer startServer(String agentId) {
        ActionRouter router = new ActionRouter()
                .register(EchoHandler.CAPABILITY, new EchoHandler())
                .register(FailHandler.CAPABILITY, new FailHandler());
        AgentDescriptor descriptor = new AgentDescriptor(
                agentId,
                agentId,
                "test agent",
                "http://127.0.0.1:0",
                router.capabilities(),
                "none",
                "none"
        );
        return new MessageServer(descriptor, router, "127.0.0.1", 0).start();
    }

    private static HttpResponse<String> post(String url, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
    }
}
