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

package me.golemcore.flow.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Generic HTTP call tool ({@code http_request}).
 *
 * <p>
 * Settings: {@code baseUrl} (prefix for relative URLs), {@code defaultHeaders}
 * (JSON object or map), {@code allowedMethods} and {@code timeout} in seconds.
 * JSON responses are parsed; a non-2xx status is returned as structured error
 * data, not thrown.
 */
@Slf4j
public class HttpRequestTool implements AgentTool {

    static final String NAME = "http_request";

    private static final String PARAM_URL = "url";
    private static final String PARAM_METHOD = "method";
    private static final String PARAM_BODY = "body";
    private static final String PARAM_HEADERS = "headers";
    private static final String TYPE = "type";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_OBJECT = "object";
    private static final String DESCRIPTION = "description";

    private static final List<String> ALL_METHODS = List.of("GET", "POST", "PUT", "PATCH", "DELETE");
    private static final List<String> BODY_REQUIRED = List.of("POST", "PUT", "PATCH");
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final Settings settings;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, String> defaultHeaders;
    private final List<String> allowedMethods;

    public HttpRequestTool(Settings settings, OkHttpClient httpClient, ObjectMapper objectMapper,
            int defaultTimeoutSeconds) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.defaultHeaders = parseHeaders(settings.getDefaultHeaders());
        this.allowedMethods = settings.getAllowedMethods() != null && !settings.getAllowedMethods().isEmpty()
                ? settings.getAllowedMethods().stream().map(m -> m.toUpperCase(Locale.ROOT)).toList()
                : ALL_METHODS;
        int timeout = settings.getTimeout() != null && settings.getTimeout() > 0
                ? settings.getTimeout()
                : defaultTimeoutSeconds;
        this.httpClient = httpClient.newBuilder()
                .callTimeout(timeout, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public ToolDefinition getDefinition() {
        String description = settings.getDescription() != null && !settings.getDescription().isBlank()
                ? settings.getDescription()
                : "Make HTTP requests to external APIs. Use this to fetch data from URLs or call REST APIs.";
        return ToolDefinition.builder()
                .name(NAME)
                .description(description)
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_URL, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "The full URL to request, or a path relative to the base URL"),
                                PARAM_METHOD, Map.of(
                                        TYPE, TYPE_STRING,
                                        "enum", allowedMethods,
                                        DESCRIPTION, "HTTP method"),
                                PARAM_BODY, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Request body as JSON string (for POST/PUT/PATCH)"),
                                PARAM_HEADERS, Map.of(
                                        TYPE, TYPE_OBJECT,
                                        DESCRIPTION, "Additional headers as key-value pairs")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            String method = arguments.get(PARAM_METHOD) instanceof String m && !m.isBlank()
                    ? m.toUpperCase(Locale.ROOT)
                    : "GET";
            if (!allowedMethods.contains(method)) {
                throw new ToolExecutionException("HTTP method " + method + " is not allowed. Allowed: "
                        + String.join(", ", allowedMethods));
            }
            HttpUrl url = resolveUrl(arguments.get(PARAM_URL));
            Request request = buildRequest(url, method, arguments);

            log.info("[Tool:{}] {} {}", NAME, method, url.redact());
            try (Response response = httpClient.newCall(request).execute()) {
                return toResult(response);
            } catch (IOException e) {
                log.warn("[Tool:{}] Request to {} failed: {}", NAME, url.redact(), e.getMessage());
                return ToolResult.failure("Request failed: " + e.getMessage(),
                        Map.of("error", "Request failed: " + e.getMessage()));
            }
        });
    }

    private HttpUrl resolveUrl(Object rawUrl) {
        if (!(rawUrl instanceof String url) || url.isBlank()) {
            throw new ToolExecutionException("Missing required parameter: url");
        }
        String baseUrl = settings.getBaseUrl();
        String full;
        if (url.startsWith("http://") || url.startsWith("https://")) {
            full = url;
        } else if (baseUrl != null && !baseUrl.isBlank()) {
            full = stripTrailingSlash(baseUrl) + (url.startsWith("/") ? url : "/" + url);
        } else {
            throw new ToolExecutionException("Relative URL '" + url + "' requires a configured baseUrl");
        }
        HttpUrl parsed = HttpUrl.parse(full);
        if (parsed == null) {
            throw new ToolExecutionException("Invalid URL: " + full);
        }
        return parsed;
    }

    private Request buildRequest(HttpUrl url, String method, Map<String, Object> arguments) {
        Request.Builder builder = new Request.Builder().url(url);
        builder.header("Content-Type", "application/json");
        defaultHeaders.forEach(builder::header);
        if (arguments.get(PARAM_HEADERS) instanceof Map<?, ?> headers) {
            headers.forEach((key, value) -> {
                if (key != null && value != null) {
                    builder.header(key.toString(), value.toString());
                }
            });
        }

        RequestBody body = null;
        Object rawBody = arguments.get(PARAM_BODY);
        if (rawBody != null && !"GET".equals(method)) {
            body = RequestBody.create(bodyText(rawBody), JSON);
        } else if (BODY_REQUIRED.contains(method)) {
            body = RequestBody.create("", JSON);
        }
        return builder.method(method, body).build();
    }

    private String bodyText(Object rawBody) {
        if (rawBody instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(rawBody);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Request body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private ToolResult toResult(Response response) throws IOException {
        ResponseBody responseBody = response.body();
        String text = responseBody != null ? responseBody.string() : "";
        String contentType = response.header("Content-Type", "");
        Object data = contentType.contains("json") ? parseJson(text) : text;

        if (response.isSuccessful()) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("status", response.code());
            result.put("data", data);
            return ToolResult.success("HTTP " + response.code(), result);
        }

        log.debug("[Tool:{}] Non-success status {}", NAME, response.code());
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", "HTTP " + response.code());
        error.put("status", response.code());
        error.put("body", data);
        return ToolResult.failure("HTTP " + response.code(), error);
    }

    private Object parseJson(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    private Map<String, String> parseHeaders(Object raw) {
        Map<String, String> headers = new LinkedHashMap<>();
        Map<String, Object> source = null;
        if (raw instanceof Map<?, ?> map) {
            source = objectMapper.convertValue(map, MAP_TYPE_REF);
        } else if (raw instanceof String json && !json.isBlank()) {
            try {
                source = objectMapper.readValue(json, MAP_TYPE_REF);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("defaultHeaders is not a JSON object", e);
            }
        }
        if (source != null) {
            source.forEach((key, value) -> {
                if (value != null) {
                    headers.put(key, value.toString());
                }
            });
        }
        return headers;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        private String description;
        private String baseUrl;
        private Object defaultHeaders;
        private List<String> allowedMethods;
        private Integer timeout;
    }
}
