package me.golemcore.flow.domain.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.flow.domain.model.DeliveredResponse;
import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.domain.model.NodeExecutionRequest;
import me.golemcore.flow.domain.service.WebhookResponseRendezvous;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RespondToWebhookNodeExecutorTest {

    private WebhookResponseRendezvous rendezvous;
    private RespondToWebhookNodeExecutor executor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        rendezvous = new WebhookResponseRendezvous(clock);
        executor = new RespondToWebhookNodeExecutor(rendezvous, new ObjectMapper(), clock);
    }

    @Test
    void shouldDeliverResponseToWaitingWebhook() throws Exception {
        CompletableFuture<Optional<DeliveredResponse>> waiting = rendezvous.await("wf-1/trigger",
                Duration.ofSeconds(5));

        Map<String, Object> output = executor.execute(request(Map.of(
                "triggerNodeId", "trigger",
                "statusCode", "201",
                "headers", "{\"X-Trace\":\"abc\"}",
                "body", Map.of("created", true)))).get(1, TimeUnit.SECONDS);

        assertEquals(Map.of("sent", true, "statusCode", 201), output);
        DeliveredResponse response = waiting.get(1, TimeUnit.SECONDS).orElseThrow();
        assertEquals(201, response.getStatusCode());
        assertEquals("abc", response.header("x-trace"));
        assertEquals("application/json", response.contentType());
        assertEquals(Map.of("created", true), response.getBody());
    }

    @Test
    void shouldPreferExplicitWebhookPath() throws Exception {
        executor.execute(request(Map.of(
                "webhookPath", "/custom/path/",
                "triggerNodeId", "trigger",
                "contentType", "text/plain",
                "responseBody", "hello"))).get(1, TimeUnit.SECONDS);

        DeliveredResponse response = rendezvous.await("custom/path", Duration.ofMillis(50))
                .get(1, TimeUnit.SECONDS).orElseThrow();
        assertEquals("text/plain", response.contentType());
        assertEquals("hello", response.getBody());
    }

    @Test
    void shouldAcceptHeaderEntryList() throws Exception {
        executor.execute(request(Map.of(
                "triggerNodeId", "trigger",
                "headers", List.of(Map.of("key", "Content-Type", "value", "text/csv"))))).get(1, TimeUnit.SECONDS);

        DeliveredResponse response = rendezvous.await("wf-1/trigger", Duration.ofMillis(50))
                .get(1, TimeUnit.SECONDS).orElseThrow();
        assertEquals("text/csv", response.contentType());
    }

    @Test
    void shouldReportRejectedSecondDelivery() throws Exception {
        Map<String, Object> input = Map.of("triggerNodeId", "trigger");
        executor.execute(request(input)).get(1, TimeUnit.SECONDS);

        Map<String, Object> second = executor.execute(request(input)).get(1, TimeUnit.SECONDS);

        assertFalse((Boolean) second.get("sent"));
    }

    @Test
    void shouldRejectMissingCorrelationKey() {
        assertValidationError(Map.of("body", "x"));
    }

    @Test
    void shouldRejectOutOfRangeStatus() {
        assertValidationError(Map.of("triggerNodeId", "trigger", "statusCode", 700));
        assertValidationError(Map.of("triggerNodeId", "trigger", "statusCode", "abc"));
    }

    @Test
    void shouldRejectMalformedHeaderJson() {
        assertValidationError(Map.of("triggerNodeId", "trigger", "headers", "{not json"));
    }

    @Test
    void shouldExposeResponseOperations() {
        assertTrue(executor.supportedOperations().contains("webhook.respond"));
        assertTrue(executor.supportedOperations().contains("http.response"));
    }

    private void assertValidationError(Map<String, Object> input) {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> executor.execute(request(input)).get(1, TimeUnit.SECONDS));
        NodeExecutionException cause = assertInstanceOf(NodeExecutionException.class, error.getCause());
        assertEquals(NodeErrorCode.VALIDATION_ERROR, cause.getCode());
    }

    private static NodeExecutionRequest request(Map<String, Object> input) {
        return NodeExecutionRequest.builder()
                .workflowId("wf-1")
                .nodeId("respond-1")
                .operation("webhook.respond")
                .input(input)
                .build();
    }
}
