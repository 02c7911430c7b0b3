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
import me.golemcore.flow.domain.model.InboundEvent;
import me.golemcore.flow.domain.service.CorrelationKeys;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a raw webhook request into an {@link InboundEvent}.
 *
 * <p>
 * The body is decoded by content type: JSON, form-encoded fields, plain text,
 * or a best-effort JSON parse for anything else. {@code cookie} and
 * {@code authorization} headers never reach the stored event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookRequestParser {

    private static final Set<String> SENSITIVE_HEADERS = Set.of("cookie", "authorization");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Correlation key of the request: the path after {@code prefix},
     * normalized.
     */
    public String pathKey(ServerHttpRequest request, String prefix) {
        String path = request.getPath().pathWithinApplication().value();
        String remainder = path.startsWith(prefix) ? path.substring(prefix.length()) : path;
        return CorrelationKeys.normalize(UriUtils.decode(remainder, StandardCharsets.UTF_8));
    }

    public InboundEvent parse(ServerHttpRequest request, String pathKey, byte[] body) {
        HttpHeaders headers = request.getHeaders();
        return InboundEvent.builder()
                .body(parseBody(body, headers.getContentType()))
                .query(new LinkedHashMap<>(request.getQueryParams().toSingleValueMap()))
                .headers(safeHeaders(headers))
                .method(request.getMethod().name())
                .path("/" + pathKey)
                .timestamp(clock.instant())
                .build();
    }

    Object parseBody(byte[] body, MediaType contentType) {
        if (body == null || body.length == 0) {
            return Map.of();
        }
        String text = new String(body, StandardCharsets.UTF_8);
        if (contentType == null) {
            return parseJsonOrEmpty(text);
        }
        if (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || contentType.getSubtype().endsWith("+json")) {
            return parseJsonOrEmpty(text);
        }
        if (MediaType.APPLICATION_FORM_URLENCODED.isCompatibleWith(contentType)) {
            return parseForm(text);
        }
        if ("text".equalsIgnoreCase(contentType.getType())) {
            return text;
        }
        return parseJsonOrEmpty(text);
    }

    private Object parseJsonOrEmpty(String text) {
        try {
            Object parsed = objectMapper.readValue(text, Object.class);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.debug("[Webhook] Body is not JSON, storing empty object: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static Map<String, Object> parseForm(String text) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String pair : text.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            fields.put(decodeFormPart(name), decodeFormPart(value));
        }
        return fields;
    }

    private static String decodeFormPart(String part) {
        try {
            return URLDecoder.decode(part, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("[Webhook] Keeping malformed form value as sent: {}", e.getMessage());
            return part;
        }
    }

    private static Map<String, String> safeHeaders(HttpHeaders headers) {
        Map<String, String> safe = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!SENSITIVE_HEADERS.contains(lower)) {
                safe.put(lower, String.join(", ", values));
            }
        });
        return safe;
    }
}
