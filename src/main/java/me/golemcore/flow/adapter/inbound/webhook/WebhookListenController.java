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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.adapter.inbound.webhook.dto.ListenActionRequest;
import me.golemcore.flow.adapter.inbound.webhook.dto.WebhookListenResponse;
import me.golemcore.flow.domain.service.InboundEventStore;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Long-poll endpoint the editor uses to wait for the next webhook hit of a
 * trigger node, plus {@code clear}/{@code reset} of the captured event.
 */
@RestController
@RequestMapping(WebhookListenController.PREFIX)
@RequiredArgsConstructor
@Slf4j
public class WebhookListenController {

    static final String PREFIX = "/webhook-listen";
    static final String TIMEOUT_MESSAGE = "No webhook event received within timeout period";

    private final WebhookRequestParser parser;
    private final InboundEventStore inboundEventStore;
    private final FlowProperties properties;

    @GetMapping("/**")
    public Mono<ResponseEntity<WebhookListenResponse>> listen(ServerHttpRequest request,
            @RequestParam(name = "timeout", required = false) String timeout) {
        String key = parser.pathKey(request, PREFIX);
        Duration wait = Duration.ofMillis(resolveTimeout(timeout));
        log.debug("[WebhookListen] Polling {} for up to {} ms", key, wait.toMillis());

        return inboundEventStore.poll(key, wait)
                .map(event -> event
                        .map(found -> {
                            log.info("[WebhookListen] Event for {} handed to listener", key);
                            return WebhookListenResponse.received(found.toPayload());
                        })
                        .orElseGet(() -> WebhookListenResponse.notReceived(TIMEOUT_MESSAGE)))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/**")
    public Mono<ResponseEntity<WebhookListenResponse>> action(ServerHttpRequest request,
            @RequestBody(required = false) ListenActionRequest body) {
        String key = parser.pathKey(request, PREFIX);
        String action = body != null ? body.getAction() : null;

        if ("clear".equals(action)) {
            boolean existed = inboundEventStore.clear(key);
            log.info("[WebhookListen] Cleared {} (event present: {})", key, existed);
            return Mono.just(ResponseEntity.ok(WebhookListenResponse.action(true, "Listener cleared")));
        }
        if ("reset".equals(action)) {
            boolean existed = inboundEventStore.reset(key);
            log.info("[WebhookListen] Reset {} (event present: {})", key, existed);
            return Mono.just(ResponseEntity.ok(WebhookListenResponse.action(true, "Listener reset")));
        }
        log.warn("[WebhookListen] Unknown action '{}' on {}", action, key);
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(WebhookListenResponse.action(false, "Unknown action")));
    }

    long resolveTimeout(String raw) {
        FlowProperties.WebhookProperties webhook = properties.getWebhook();
        long requested = webhook.getDefaultListenTimeoutMs();
        if (raw != null && !raw.isBlank()) {
            try {
                requested = Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                log.debug("[WebhookListen] Ignoring non-numeric timeout '{}'", raw);
            }
        }
        if (requested < 0) {
            requested = 0;
        }
        return Math.min(requested, webhook.getMaxListenTimeoutMs());
    }
}
