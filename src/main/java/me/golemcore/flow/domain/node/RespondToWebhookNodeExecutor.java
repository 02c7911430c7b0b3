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

package me.golemcore.flow.domain.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.DeliveredResponse;
import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.domain.model.NodeExecutionRequest;
import me.golemcore.flow.domain.service.CorrelationKeys;
import me.golemcore.flow.domain.service.WebhookResponseRendezvous;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Respond-to-webhook and HTTP response nodes: builds the HTTP response of the
 * webhook request that started the execution and hands it to the rendezvous.
 *
 * <p>
 * The correlation key is {@code webhookPath} when set, otherwise
 * {@code {workflowId}/{triggerNodeId}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RespondToWebhookNodeExecutor implements NodeExecutor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final WebhookResponseRendezvous rendezvous;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Set<String> supportedOperations() {
        return Set.of("http.response", "webhook.respond");
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(NodeExecutionRequest request) {
        try {
            Map<String, Object> input = request.getInput() != null ? request.getInput() : Map.of();
            String key = correlationKey(request, input);
            int statusCode = statusCode(input.get("statusCode"));

            Map<String, String> headers = new LinkedHashMap<>(headers(input.get("headers")));
            if (headers.keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
                String contentType = input.get("contentType") instanceof String ct && !ct.isBlank()
                        ? ct
                        : DeliveredResponse.DEFAULT_CONTENT_TYPE;
                headers.put("Content-Type", contentType);
            }
            Object body = input.containsKey("body") ? input.get("body") : input.get("responseBody");

            boolean sent = rendezvous.deliver(key, DeliveredResponse.builder()
                    .statusCode(statusCode)
                    .headers(headers)
                    .body(body)
                    .deliveredAt(clock.instant())
                    .build());
            log.info("[Webhook] Response {} for {} (status {})", sent ? "delivered" : "rejected", key, statusCode);

            Map<String, Object> output = new LinkedHashMap<>();
            output.put("sent", sent);
            output.put("statusCode", statusCode);
            return CompletableFuture.completedFuture(output);
        } catch (NodeExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String correlationKey(NodeExecutionRequest request, Map<String, Object> input) {
        try {
            if (input.get("webhookPath") instanceof String path && !path.isBlank()) {
                return CorrelationKeys.normalize(path);
            }
            if (input.get("triggerNodeId") instanceof String triggerNodeId && !triggerNodeId.isBlank()
                    && request.getWorkflowId() != null) {
                return CorrelationKeys.of(request.getWorkflowId(), triggerNodeId);
            }
        } catch (IllegalArgumentException e) {
            throw new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR, e.getMessage(), e);
        }
        throw new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR,
                "Either webhookPath or triggerNodeId is required to respond to a webhook");
    }

    private static int statusCode(Object raw) {
        if (raw == null || raw instanceof String s && s.isBlank()) {
            return 200;
        }
        int status;
        if (raw instanceof Number number) {
            status = number.intValue();
        } else {
            try {
                status = Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR, "Invalid status code: " + raw);
            }
        }
        if (status < 100 || status > 599) {
            throw new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR, "Invalid status code: " + status);
        }
        return status;
    }

    /**
     * Accepts a JSON object string, a map, or a list of {@code {key, value}}
     * entries.
     */
    private Map<String, String> headers(Object raw) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (raw instanceof String json && !json.isBlank()) {
            try {
                objectMapper.readValue(json, MAP_TYPE_REF).forEach((k, v) -> putHeader(headers, k, v));
            } catch (JsonProcessingException e) {
                throw new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR,
                        "headers must be a JSON object: " + e.getOriginalMessage(), e);
            }
        } else if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> putHeader(headers, k, v));
        } else if (raw instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> pair) {
                    putHeader(headers, pair.get("key"), pair.get("value"));
                }
            }
        }
        return headers;
    }

    private static void putHeader(Map<String, String> headers, Object name, Object value) {
        if (name != null && !name.toString().isBlank() && value != null) {
            headers.put(name.toString(), value.toString());
        }
    }
}
