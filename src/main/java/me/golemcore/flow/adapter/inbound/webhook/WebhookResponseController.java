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
import me.golemcore.flow.adapter.inbound.webhook.dto.WebhookResponseRequest;
import me.golemcore.flow.adapter.inbound.webhook.dto.WebhookResponseResult;
import me.golemcore.flow.domain.model.DeliveredResponse;
import me.golemcore.flow.domain.service.WebhookResponseRendezvous;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lets an executor running outside this process hand a response to the caller
 * waiting on {@code /webhook/{key}}.
 */
@RestController
@RequestMapping(WebhookResponseController.PREFIX)
@RequiredArgsConstructor
@Slf4j
public class WebhookResponseController {

    static final String PREFIX = "/webhook-responses";
    private static final int MIN_STATUS = 100;
    private static final int MAX_STATUS = 599;

    private final WebhookRequestParser parser;
    private final WebhookResponseRendezvous rendezvous;
    private final Clock clock;

    @PostMapping("/**")
    public Mono<ResponseEntity<WebhookResponseResult>> deliver(ServerHttpRequest request,
            @RequestBody(required = false) WebhookResponseRequest body) {
        String key = parser.pathKey(request, PREFIX);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Webhook path is required");
        }
        WebhookResponseRequest payload = body != null ? body : new WebhookResponseRequest();
        int status = payload.getStatusCode() != null ? payload.getStatusCode() : 200;
        if (status < MIN_STATUS || status > MAX_STATUS) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599");
        }

        Map<String, String> headers = payload.getHeaders() != null
                ? new LinkedHashMap<>(payload.getHeaders())
                : Map.of();
        DeliveredResponse response = DeliveredResponse.builder()
                .pathKey(key)
                .statusCode(status)
                .headers(headers)
                .body(payload.getBody())
                .deliveredAt(clock.instant())
                .build();

        boolean delivered = rendezvous.deliver(key, response);
        log.info("[Webhook] Response for /{} submitted (delivered: {})", key, delivered);
        return Mono.just(ResponseEntity.ok(WebhookResponseResult.builder()
                .success(true)
                .delivered(delivered)
                .build()));
    }
}
