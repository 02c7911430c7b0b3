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

package me.golemcore.flow.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.LlmUsage;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter on the langchain4j library.
 *
 * <p>
 * Every request names its own provider, model and API key, since each agent
 * node picks its decision model. Chat models are built on first use and cached
 * per provider, model, key and generation settings.
 *
 * <p>
 * Supported providers:
 * <ul>
 * <li>{@code openai}, or any OpenAI-compatible endpoint through
 * {@code flow.llm.providers.openai.base-url}
 * <li>{@code anthropic}
 * </ul>
 *
 * <p>
 * Rate limits are retried with exponential backoff
 * ({@code flow.llm.max-retries}, {@code flow.llm.initial-backoff-ms}); other
 * failures complete the future exceptionally.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    static final String PROVIDER_OPENAI = "openai";
    static final String PROVIDER_ANTHROPIC = "anthropic";

    private static final Set<String> SUPPORTED_PROVIDERS = Set.of(PROVIDER_OPENAI, PROVIDER_ANTHROPIC);
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int DEFAULT_ANTHROPIC_MAX_TOKENS = 4096;
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final FlowProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;
    private final Map<ModelKey, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(FlowProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supportsProvider(String provider) {
        return provider != null && SUPPORTED_PROVIDERS.contains(provider.toLowerCase(Locale.ROOT));
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = modelFor(request);
            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(convertMessages(request));
            List<ToolSpecification> tools = convertTools(request);
            if (!tools.isEmpty()) {
                chatRequest.toolSpecifications(tools);
            }
            ChatRequest built = chatRequest.build();

            int maxRetries = Math.max(0, settings.getMaxRetries());
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    log.debug("[LLM] {}/{} with {} messages and {} tools", request.getProvider(), request.getModel(),
                            built.messages().size(), tools.size());
                    return convertResponse(model.chat(built), request.getModel());
                } catch (RuntimeException e) { // NOSONAR - provider SDKs throw unchecked exceptions only
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (settings.getInitialBackoffMs()
                                * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1, maxRetries,
                                backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat with {}/{} failed: {}", request.getProvider(), request.getModel(),
                                e.getMessage());
                        throw new LlmCallException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new LlmCallException("LLM chat failed: max retries exhausted", null);
        });
    }

    private ChatModel modelFor(LlmRequest request) {
        String provider = request.getProvider() != null
                ? request.getProvider().toLowerCase(Locale.ROOT)
                : PROVIDER_OPENAI;
        if (!supportsProvider(provider)) {
            throw new LlmCallException("Unsupported LLM provider: " + request.getProvider(), null);
        }
        FlowProperties.ProviderProperties configured = settings.getProviders().get(provider);
        String apiKey = request.getApiKey() != null && !request.getApiKey().isBlank()
                ? request.getApiKey()
                : configured != null ? configured.getApiKey() : null;
        if (apiKey == null || apiKey.isBlank()) {
            throw new LlmCallException("No API key for provider " + provider, null);
        }
        String baseUrl = configured != null ? configured.getBaseUrl() : null;

        ModelKey key = new ModelKey(provider, request.getModel(), baseUrl, apiKey, request.getTemperature(),
                request.getMaxTokens());
        return models.computeIfAbsent(key, this::createModel);
    }

    private ChatModel createModel(ModelKey key) {
        Duration timeout = Duration.ofMillis(settings.getTimeoutMs());
        if (PROVIDER_ANTHROPIC.equals(key.provider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(key.apiKey())
                    .modelName(key.model())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(key.maxTokens() != null ? key.maxTokens() : DEFAULT_ANTHROPIC_MAX_TOKENS)
                    .temperature(key.temperature())
                    .timeout(timeout);
            if (key.baseUrl() != null && !key.baseUrl().isBlank()) {
                builder.baseUrl(key.baseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(key.apiKey())
                .modelName(key.model())
                .maxRetries(0) // Retry handled by our backoff logic
                .temperature(key.temperature())
                .timeout(timeout);
        if (key.maxTokens() != null) {
            builder.maxTokens(key.maxTokens());
        }
        if (key.baseUrl() != null && !key.baseUrl().isBlank()) {
            builder.baseUrl(key.baseUrl());
        }
        return builder.build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmCallException("LLM chat interrupted during retry backoff", e);
        }
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            String role = msg.getRole() != null ? msg.getRole() : Message.ROLE_USER;
            switch (role) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content));
            case Message.ROLE_SYSTEM -> {
                if (!content.isBlank()) {
                    messages.add(SystemMessage.from(content));
                }
            }
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", role);
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            properties.forEach((name, paramSchema) -> schemaBuilder.addProperty(name.toString(),
                    toJsonSchemaElement(paramSchema instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of())));
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required(required.stream().map(Object::toString).toList());
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String description = paramSchema.get("description") instanceof String d && !d.isBlank() ? d : null;

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(Object::toString).toList());
            if (description != null) {
                builder.description(description);
            }
            return builder.build();
        }

        String type = paramSchema.get("type") instanceof String t ? t : "string";
        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (description != null) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (description != null) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (description != null) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (description != null) {
                builder.description(description);
            }
            Map<String, Object> items = paramSchema.get("items") instanceof Map<?, ?> map
                    ? (Map<String, Object>) map
                    : Map.of("type", "string");
            builder.items(toJsonSchemaElement(items));
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (description != null) {
                builder.description(description);
            }
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                nested.forEach((name, value) -> builder.addProperty(name.toString(),
                        toJsonSchemaElement(value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of())));
            }
            return builder.build();
        }
        default -> {
            // Unknown types, and plain strings
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (description != null) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response, String requestedModel) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            Integer input = response.tokenUsage().inputTokenCount();
            Integer output = response.tokenUsage().outputTokenCount();
            usage = LlmUsage.of(input != null ? input : 0, output != null ? output : 0);
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(response.modelName() != null ? response.modelName() : requestedModel)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "STOP")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    private record ModelKey(String provider, String model, String baseUrl, String apiKey, double temperature,
            Integer maxTokens) {

        @Override
        public String toString() {
            return provider + "/" + model;
        }
    }

    /**
     * Failure of a chat call after retries.
     */
    static class LlmCallException extends RuntimeException {

        LlmCallException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
