package io.agentwire.server;

import io.agentwire.model.EnvelopeCodec;
import io.agentwire.model.ErrorEnvelope;
import io.agentwire.model.MessageKind;
import io.agentwire.model.RequestEnvelope;
import io.agentwire.model.ResponseEnvelope;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class MessageDispatcherTest {

    @Test
    void responseIsCorrelatedWithRequest() {
        MessageDispatcher dispatcher = new MessageDispatcher("translator", request -> Map.of("status", "success"));
        RequestEnvelope request = RequestEnvelope.create("orchestrator", "translator", Map.of("text", "hi"));

        MessageDispatcher.Outcome outcome = dispatcher.dispatch(EnvelopeCodec.toJson(request));

        Assertions.assertEquals(200, outcome.status());
        Assertions.assertTrue(outcome.success());
        ResponseEnvelope reply = Assertions.assertInstanceOf(ResponseEnvelope.class, outcome.reply());
        Assertions.assertEquals(request.messageId(), reply.inReplyTo());
        Assertions.assertEquals("orchestrator", reply.toAgent());
        Assertions.assertEquals("translator", reply.fromAgent());
        Assertions.assertNotEquals(request.messageId(), reply.messageId());
        Assertions.assertEquals(Map.of("status", "success"), reply.payload());
    }

    @Test
    void handlerFailureBecomesErrorEnvelopeWithMessageOnly() {
        MessageDispatcher dispatcher = new MessageDispatcher("agent", request -> {
            throw new IllegalStateException("model offline");
        });
        RequestEnvelope request = RequestEnvelope.create("caller", "agent", Map.of());

        MessageDispatcher.Outcome outcome = dispatcher.dispatch(request);

        Assertions.assertEquals(500, outcome.status());
        ErrorEnvelope reply = Assertions.assertInstanceOf(ErrorEnvelope.class, outcome.reply());
        Assertions.assertEquals("model offline", reply.errorMessage());
        Assertions.assertEquals(request.messageId(), reply.replyTo().orElseThrow());
        Assertions.assertEquals("caller", reply.toAgent());
    }

    @Test
    void nullResultAndMessagelessExceptionsStillProduceErrors() {
        MessageDispatcher nullResult = new MessageDispatcher("agent", request -> null);
        MessageDispatcher bareThrow = new MessageDispatcher("agent", request -> {
            throw new UnsupportedOperationException();
        });
        MessageDispatcher linkage = new MessageDispatcher("agent", request -> {
            throw new NoClassDefFoundError("com/example/Missing");
        });
        RequestEnvelope request = RequestEnvelope.create("caller", "agent", Map.of());

        ErrorEnvelope first = (ErrorEnvelope) nullResult.dispatch(request).reply();
        ErrorEnvelope second = (ErrorEnvelope) bareThrow.dispatch(request).reply();

        Assertions.assertEquals("handler returned no payload", first.errorMessage());
        Assertions.assertEquals("UnsupportedOperationException", second.errorMessage());
        MessageDispatcher.Outcome third = linkage.dispatch(request);
        Assertions.assertEquals(500, third.status());
        Assertions.assertEquals("com/example/Missing", ((ErrorEnvelope) third.reply()).errorMessage());
    }

    @Test
    void malformedBodyIsRejectedWithoutCallingHandler() {
        MessageDispatcher dispatcher = new MessageDispatcher("agent", request -> {
            throw new AssertionError("handler must not run");
        });

        MessageDispatcher.Outcome garbage = dispatcher.dispatch("{not json");
        MessageDispatcher.Outcome bogus = dispatcher.dispatch("{\"message_id\":\"m-1\",\"from_agent\":\"probe\","
                + "\"to_agent\":\"agent\",\"message_type\":\"bogus\",\"payload\":{}}");

        Assertions.assertEquals(400, garbage.status());
        ErrorEnvelope anonymous = (ErrorEnvelope) garbage.reply();
        Assertions.assertEquals(ErrorEnvelope.UNKNOWN_AGENT, anonymous.toAgent());
        Assertions.assertTrue(anonymous.replyTo().isEmpty());

        Assertions.assertEquals(400, bogus.status());
        Assertions.assertEquals(MessageKind.ERROR, bogus.reply().kind());
        Assertions.assertEquals("probe", bogus.reply().toAgent());
        Assertions.assertEquals("m-1", bogus.reply().replyTo().orElseThrow());
    }

    @Test
    void nonRequestKindsAreBadRequests() {
        MessageDispatcher dispatcher = new MessageDispatcher("agent", request -> Map.of());
        RequestEnvelope original = RequestEnvelope.create("agent", "peer", Map.of());
        ResponseEnvelope stray = ResponseEnvelope.replyTo(original, "peer", Map.of());

        MessageDispatcher.Outcome outcome = dispatcher.dispatch(EnvelopeCodec.toJson(stray));

        Assertions.assertEquals(400, outcome.status());
        Assertions.assertEquals(stray.messageId(), outcome.reply().replyTo().orElseThrow());
        Assertions.assertEquals("peer", outcome.reply().toAgent());
    }
}
