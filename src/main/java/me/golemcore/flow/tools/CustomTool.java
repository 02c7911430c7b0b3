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
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * User-defined tool. Name, description and parameters come from settings; the
 * arguments are POSTed as JSON to {@code webhookUrl}.
 *
 * <p>
 * Without a webhook URL the tool answers with an acknowledgement that echoes
 * the arguments.
 */
@Slf4j
public class CustomTool implements AgentTool {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final Settings settings;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;
    private final Map<String, Object> inputSchema;

    public CustomTool(Settings settings, OkHttpClient httpClient, ObjectMapper objectMapper,
            int defaultTimeoutSeconds) {
        if (settings.getName() == null || settings.getName().isBlank()) {
            throw new IllegalArgumentException("Custom tool requires a name");
        }
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.inputSchema = buildSchema(parseParameters(settings.getParameters()));
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
                : "Custom tool: " + settings.getName();
        return ToolDefinition.builder()
                .name(settings.getName())
                .description(description)
                .inputSchema(inputSchema)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            String webhookUrl = settings.getWebhookUrl();
            if (webhookUrl == null || webhookUrl.isBlank()) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("message", "Custom tool executed");
                data.put("args", arguments);
                return ToolResult.success("Custom tool executed", data);
            }
            return callWebhook(webhookUrl, arguments);
        });
    }

    private ToolResult callWebhook(String webhookUrl, Map<String, Object> arguments) {
        String name = settings.getName();
        Request request;
        try {
            request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(objectMapper.writeValueAsString(arguments), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Arguments are not serializable: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ToolExecutionException("Invalid webhookUrl for custom tool " + name, e);
        }

        log.info("[Tool:{}] POST {}", name, request.url().redact());
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            Object data = parseJson(text);
            if (!response.isSuccessful()) {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error", "Webhook returned HTTP " + response.code());
                error.put("status", response.code());
                error.put("body", data);
                return ToolResult.failure("Webhook returned HTTP " + response.code(), error);
            }
            return ToolResult.success(text, data);
        } catch (IOException e) {
            log.warn("[Tool:{}] Webhook call failed: {}", name, e.getMessage());
            return ToolResult.failure("Webhook call failed: " + e.getMessage(),
                    Map.of("error", "Webhook call failed: " + e.getMessage()));
        }
    }

    private Object parseJson(String text) {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return Map.of("response", text);
        }
    }

    private Map<String, Object> parseParameters(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return objectMapper.convertValue(map, MAP_TYPE_REF);
        }
        if (raw instanceof String json && !json.isBlank()) {
            try {
                return objectMapper.readValue(json, MAP_TYPE_REF);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("parameters is not a JSON object", e);
            }
        }
        return Map.of();
    }

    private static Map<String, Object> buildSchema(Map<String, Object> parameters) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        parameters.forEach((paramName, spec) -> {
            Map<String, Object> property = new LinkedHashMap<>();
            if (spec instanceof Map<?, ?> specMap) {
                Object type = specMap.get("type");
                property.put("type", type != null ? type.toString() : "string");
                if (specMap.get("description") != null) {
                    property.put("description", specMap.get("description").toString());
                }
                if (Boolean.TRUE.equals(specMap.get("required"))) {
                    required.add(paramName);
                }
            } else {
                property.put("type", "string");
            }
            properties.put(paramName, property);
        });

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        private String name;
        private String description;
        private Object parameters;
        private String webhookUrl;
        private Integer timeout;
    }
}
