/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.flow.adapter.inbound.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.adapter.inbound.webhook.dto.WebhookAck;
import me.golemcore.flow.domain.model.DeliveredResponse;
import me.golemcore.flow.domain.model.InboundEvent;
import me.golemcore.flow.domain.service.CorrelationKeys;
import me.golemcore.flow.domain.service.EventBroadcastService;
import me.golemcore.flow.domain.service.InboundEventStore;
import me.golemcore.flow.domain.service.WebhookResponseRendezvous;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Entry point of webhook-triggered workflows (WebFlux).
 *
 * <p>
 * Both endpoints accept every HTTP method:
 * <ul>
 * <li>{@code /webhook/{key}} - production trigger</li>
 * <li>{@code /webhook-test/{key}} - editor test mode</li>
 * </ul>
 *
 * <p>
 * The request is stored for listeners, announced on the workflow's event
 * stream, and then held open until a workflow delivers a response for the same
 * key. Without a response in time the caller receives a 200 acknowledgment.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String PRODUCTION_PREFIX = "/webhook";
    static final String TEST_PREFIX = "/webhook-test";
    static final String TEST_ACK_MESSAGE = "Webhook received. Workflow executed but no response was configured.";
    private static final String ACK_MESSAGE = "received";
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of("content-length", "transfer-encoding",
            "connection");

    private final WebhookRequestParser parser;
    private final InboundEventStore inboundEventStore;
    private final WebhookResponseRendezvous rendezvous;
    private final EventBroadcastService eventBroadcastService;
    private final FlowProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @RequestMapping({ PRODUCTION_PREFIX, PRODUCTION_PREFIX + "/**" })
    public Mono<ResponseEntity<String>> receive(ServerHttpRequest request,
            @RequestBody(required = false) byte[] body) {
        return handle(request, body, PRODUCTION_PREFIX, false);
    }

    @RequestMapping({ TEST_PREFIX, TEST_PREFIX + "/**" })
    public Mono<ResponseEntity<String>> receiveTest(ServerHttpRequest request,
            @RequestBody(required = false) byte[] body) {
        return handle(request, body, TEST_PREFIX, true);
    }

    private Mono<ResponseEntity<String>> handle(ServerHttpRequest request, byte[] body, String prefix,
            boolean testMode) {
        String key = parser.pathKey(request, prefix);
        if (key.isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Webhook path is required"));
        }

        InboundEvent event = parser.parse(request, key, body);
        inboundEventStore.store(key, event);
        eventBroadcastService.publishWebhookReceived(CorrelationKeys.workflowIdOf(key), key, event.toPayload());
        log.info("[Webhook] Received {} /{}{}, waiting for workflow response", event.getMethod(), key,
                testMode ? " (test)" : "");

        Duration timeout = Duration.ofMillis(properties.getWebhook().getResponseTimeoutMs());
        // Suppress cancel: a disconnected caller leaves its waiter in place until the timeout.
        return Mono.fromFuture(rendezvous.await(key, timeout), true)
                .map(delivered -> delivered
                        .map(response -> {
                            log.info("[Webhook] Returning workflow response for /{} (status {})", key,
                                    response.getStatusCode());
                            return toResponse(response);
                        })
                        .orElseGet(() -> {
                            log.info("[Webhook] No workflow response for /{}, returning acknowledgment", key);
                            return acknowledge(key, event.getMethod(), testMode);
                        }));
    }

    private ResponseEntity<String> toResponse(DeliveredResponse response) {
        HttpHeaders headers = new HttpHeaders();
        if (response.getHeaders() != null) {
            response.getHeaders().forEach((name, value) -> {
                if (name != null && value != null && !HOP_BY_HOP_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    headers.set(name, value);
                }
            });
        }
        headers.set(HttpHeaders.CONTENT_TYPE, response.contentType());
        return ResponseEntity.status(HttpStatusCode.valueOf(response.getStatusCode()))
                .headers(headers)
                .body(render(response.getBody()));
    }

    private String render(Object body) {
        if (body == null) {
            return "";
        }
        if (body instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.warn("[Webhook] Response body is not serializable: {}", e.getOriginalMessage());
            return String.valueOf(body);
        }
    }

    private ResponseEntity<String> acknowledge(String key, String method, boolean testMode) {
        WebhookAck ack = WebhookAck.builder()
                .message(testMode ? TEST_ACK_MESSAGE : ACK_MESSAGE)
                .path(key)
                .method(method)
                .timestamp(testMode ? null : clock.instant().toString())
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(render(ack));
    }
}
