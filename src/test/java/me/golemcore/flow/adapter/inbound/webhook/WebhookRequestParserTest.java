package me.golemcore.flow.adapter.inbound.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.flow.domain.model.InboundEvent;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class WebhookRequestParserTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final WebhookRequestParser parser = new WebhookRequestParser(new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldNormalizePathAfterPrefix() {
        assertEquals("wf1/hook", parser.pathKey(MockServerHttpRequest.post("/webhook//wf1/hook/").build(),
                "/webhook"));
        assertEquals("", parser.pathKey(MockServerHttpRequest.post("/webhook").build(), "/webhook"));
        assertEquals("wf1/a+b", parser.pathKey(MockServerHttpRequest.post("/webhook/wf1/a+b").build(),
                "/webhook"));
    }

    @Test
    void shouldCaptureRequestWithoutSensitiveHeaders() {
        MockServerHttpRequest request = MockServerHttpRequest.post("/webhook/wf1/hook?source=crm&id=7")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Authorization", "Bearer secret")
                .header("Cookie", "session=1")
                .header("X-Tags", "a", "b")
                .build();

        InboundEvent event = parser.parse(request, "wf1/hook",
                "{\"name\":\"Ada\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals(Map.of("name", "Ada"), event.getBody());
        assertEquals(Map.of("source", "crm", "id", "7"), event.getQuery());
        assertEquals("POST", event.getMethod());
        assertEquals("/wf1/hook", event.getPath());
        assertEquals(NOW, event.getTimestamp());
        assertEquals("a, b", event.getHeaders().get("x-tags"));
        assertFalse(event.getHeaders().containsKey("authorization"));
        assertFalse(event.getHeaders().containsKey("cookie"));
    }

    @Test
    void shouldDecodeBodyByContentType() {
        assertEquals(Map.of(), parser.parseBody(new byte[0], MediaType.APPLICATION_JSON));
        assertEquals(List.of(1, 2), parser.parseBody(bytes("[1,2]"), MediaType.valueOf("application/vnd.api+json")));
        assertEquals(Map.of(), parser.parseBody(bytes("{broken"), MediaType.APPLICATION_JSON));
        assertEquals(Map.of("a", "1 2", "b", ""),
                parser.parseBody(bytes("a=1+2&b="), MediaType.APPLICATION_FORM_URLENCODED));
        assertEquals("plain text", parser.parseBody(bytes("plain text"), MediaType.TEXT_PLAIN));
        assertEquals(Map.of("x", true), parser.parseBody(bytes("{\"x\":true}"), null));
        assertEquals(Map.of(), parser.parseBody(bytes("<xml/>"), MediaType.APPLICATION_XML));
    }

    @Test
    void shouldKeepMalformedFormEscapesAsSent() {
        assertEquals(Map.of("a", "100%", "b", "2", "c%zz", "x y"),
                parser.parseBody(bytes("a=100%&b=2&c%zz=x+y"), MediaType.APPLICATION_FORM_URLENCODED));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
