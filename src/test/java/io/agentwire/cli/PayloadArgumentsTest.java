package io.agentwire.cli;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class PayloadArgumentsTest {

    @Test
    void fieldsAreTypedWhenTheyReadAsJson() {
        Map<String, Object> payload = PayloadArguments.build(null, List.of(
                "action=translate",
                "count=3",
                "ratio=0.25",
                "strict=true",
                "nested={\"a\":1}",
                "quoted=\"7\"",
                "phrase=hello world",
                "code=12abc",
                "empty="
        ));

        Assertions.assertEquals("translate", payload.get("action"));
        Assertions.assertEquals(3, payload.get("count"));
        Assertions.assertEquals(0.25, payload.get("ratio"));
        Assertions.assertEquals(Boolean.TRUE, payload.get("strict"));
        Assertions.assertEquals(Map.of("a", 1), payload.get("nested"));
        Assertions.assertEquals("7", payload.get("quoted"));
        Assertions.assertEquals("hello world", payload.get("phrase"));
        Assertions.assertEquals("12abc", payload.get("code"));
        Assertions.assertEquals("", payload.get("empty"));
    }

    @Test
    void fieldsOverrideJsonPayloadKeys() {
        Map<String, Object> payload = PayloadArguments.build("{\"text\":\"a\",\"lang\":\"fr\"}", List.of("text=b"));

        Assertions.assertEquals(Map.of("text", "b", "lang", "fr"), payload);
        Assertions.assertEquals(List.of("text", "lang"), List.copyOf(payload.keySet()));
    }

    @Test
    void rejectsMalformedInput() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> PayloadArguments.build(null, List.of("novalue")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> PayloadArguments.build(null, List.of("=x")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> PayloadArguments.build("[1]", List.of()));
    }
}
