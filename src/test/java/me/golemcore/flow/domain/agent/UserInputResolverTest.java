package me.golemcore.flow.domain.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UserInputResolverTest {

    private final UserInputResolver resolver = new UserInputResolver(new ObjectMapper());

    @Test
    void shouldPreferQueryOverOtherDirectFields() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("message", "from message");
        input.put("query", "from query");

        assertEquals("from query", resolver.resolve(input));
    }

    @Test
    void shouldSkipBlankDirectFields() {
        assertEquals("from prompt", resolver.resolve(Map.of("query", "  ", "prompt", "from prompt")));
    }

    @Test
    void shouldDescribeWebhookBody() {
        Map<String, Object> input = Map.of("trigger", Map.of("body", Map.of("order", 42)));

        assertEquals("Process this webhook data: {\"order\":42}", resolver.resolve(input));
    }

    @Test
    void shouldDescribeOtherTriggerPayload() {
        assertEquals("Process this trigger data: \"cron\"", resolver.resolve(Map.of("trigger", "cron")));
    }

    @Test
    void shouldUseBodyOfUpstreamOutput() {
        Map<String, Object> input = Map.of("previous", Map.of("http-1", Map.of("body", Map.of("ok", true))));

        assertEquals("Process this data: {\"ok\":true}", resolver.resolve(input));
    }

    @Test
    void shouldFallBackToGreeting() {
        assertEquals(UserInputResolver.GREETING, resolver.resolve(Map.of()));
        assertEquals(UserInputResolver.GREETING, resolver.resolve(null));
        assertEquals(UserInputResolver.GREETING, resolver.resolve(Map.of("query", 12)));
    }
}
