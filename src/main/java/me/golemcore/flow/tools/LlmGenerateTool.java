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
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.port.outbound.LlmPort;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Text generation with a secondary model, exposed as {@code openai_generate}
 * or {@code anthropic_generate}. The call carries no tools, so the secondary
 * model cannot recurse into the agent's tool set.
 */
@Slf4j
public class LlmGenerateTool implements AgentTool {

    private static final String PARAM_PROMPT = "prompt";
    private static final String PARAM_SYSTEM_PROMPT = "systemPrompt";
    private static final String PARAM_MAX_TOKENS = "maxTokens";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";
    private static final int DEFAULT_MAX_TOKENS = 1000;

    private final String name;
    private final String provider;
    private final String model;
    private final String apiKey;
    private final Settings settings;
    private final LlmPort llmPort;
    private final double temperature;

    public LlmGenerateTool(String name, String provider, String defaultModel, String apiKey, Settings settings,
            LlmPort llmPort, double temperature) {
        this.name = name;
        this.provider = provider;
        this.model = settings.getModel() != null && !settings.getModel().isBlank() ? settings.getModel()
                : defaultModel;
        this.apiKey = apiKey;
        this.settings = settings;
        this.llmPort = llmPort;
        this.temperature = temperature;
    }

    @Override
    public ToolDefinition getDefinition() {
        String description = settings.getDescription() != null && !settings.getDescription().isBlank()
                ? settings.getDescription()
                : "Generate text using " + model + ". Use for text generation, summarization or analysis.";
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_PROMPT, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "The prompt to send"),
                                PARAM_SYSTEM_PROMPT, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "Optional system prompt"),
                                PARAM_MAX_TOKENS, Map.of(
                                        TYPE, "integer",
                                        DESCRIPTION, "Maximum tokens to generate (default: " + DEFAULT_MAX_TOKENS
                                                + ")")),
                        "required", List.of(PARAM_PROMPT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        if (apiKey == null || apiKey.isBlank()) {
            return CompletableFuture.failedFuture(
                    new ToolExecutionException("No " + provider + " API key configured for " + name));
        }
        if (!(arguments.get(PARAM_PROMPT) instanceof String prompt) || prompt.isBlank()) {
            return CompletableFuture.failedFuture(new ToolExecutionException("Missing required parameter: prompt"));
        }
        int maxTokens = arguments.get(PARAM_MAX_TOKENS) instanceof Number n && n.intValue() > 0
                ? n.intValue()
                : DEFAULT_MAX_TOKENS;
        String systemPrompt = arguments.get(PARAM_SYSTEM_PROMPT) instanceof String s && !s.isBlank() ? s : null;

        LlmRequest request = LlmRequest.builder()
                .provider(provider)
                .model(model)
                .apiKey(apiKey)
                .systemPrompt(systemPrompt)
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content(prompt)
                        .timestamp(Instant.now())
                        .build()))
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();

        log.debug("[Tool:{}] Generating with {}/{}", name, provider, model);
        return llmPort.chat(request)
                .thenApply(this::toResult)
                .exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.warn("[Tool:{}] Generation failed: {}", name, cause.getMessage());
                    return ToolResult.failure("Generation failed: " + cause.getMessage(),
                            Map.of("error", "Generation failed: " + cause.getMessage()));
                });
    }

    private ToolResult toResult(LlmResponse response) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", response.getContent() != null ? response.getContent() : "");
        data.put("model", response.getModel() != null ? response.getModel() : model);
        if (response.getUsage() != null) {
            data.put("usage", Map.of(
                    "inputTokens", response.getUsage().getInputTokens(),
                    "outputTokens", response.getUsage().getOutputTokens(),
                    "totalTokens", response.getUsage().getTotalTokens()));
        }
        return ToolResult.success(response.getContent(), data);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        private String description;
        private String apiKey;
        private String model;
    }
}
