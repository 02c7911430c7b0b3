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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.infrastructure.http.FeignClientFactory;
import me.golemcore.flow.port.outbound.LlmPort;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the executable tool set of one agent run from the node's tool
 * configuration.
 *
 * <p>
 * Entries with an unknown type or with settings that cannot be bound are
 * skipped with a log line. When two entries produce the same tool name, the
 * first one wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolRegistry {

    static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
    static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-5-sonnet-20241022";

    private final OkHttpClient okHttpClient;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;
    private final LlmPort llmPort;
    private final FlowProperties properties;

    public List<AgentTool> build(List<ToolConfig> configs, ToolContext context) {
        if (configs == null || configs.isEmpty()) {
            return List.of();
        }
        Map<String, AgentTool> tools = new LinkedHashMap<>();
        for (ToolConfig config : configs) {
            if (config == null) {
                continue;
            }
            Optional<ToolKind> kind = ToolKind.fromType(config.getType());
            if (kind.isEmpty()) {
                log.debug("[Agent] Skipping tool config of unknown type '{}'", config.getType());
                continue;
            }
            AgentTool tool;
            try {
                tool = create(kind.get(), settingsOf(config), context);
            } catch (IllegalArgumentException e) {
                log.warn("[Agent] Skipping {} tool on node {}: {}", config.getType(), context.getNodeId(),
                        e.getMessage());
                continue;
            }
            String name = tool.getDefinition().getName();
            if (tools.putIfAbsent(name, tool) != null) {
                log.warn("[Agent] Duplicate tool name '{}' on node {}, keeping the first", name,
                        context.getNodeId());
            }
        }
        log.debug("[Agent] Built {} tools for node {}: {}", tools.size(), context.getNodeId(), tools.keySet());
        return new ArrayList<>(tools.values());
    }

    private AgentTool create(ToolKind kind, Map<String, Object> settings, ToolContext context) {
        FlowProperties.ToolsProperties toolDefaults = properties.getTools();
        int timeout = toolDefaults.getDefaultTimeoutSeconds();
        return switch (kind) {
        case HTTP_REQUEST -> new HttpRequestTool(bind(settings, HttpRequestTool.Settings.class),
                okHttpClient, objectMapper, timeout);
        case DATABASE_QUERY -> new DatabaseQueryTool(bind(settings, DatabaseQueryTool.Settings.class),
                toolDefaults.getDatabase(), timeout);
        case GOOGLE_SHEETS -> new GoogleSheetsTool(bind(settings, GoogleSheetsTool.Settings.class), context,
                feignClientFactory, toolDefaults.getGoogleSheets().getBaseUrl(), timeout);
        case SLACK_MESSAGE -> new SlackMessageTool(bind(settings, SlackMessageTool.Settings.class), context,
                feignClientFactory, toolDefaults.getSlack().getBaseUrl(), toolDefaults.getSlack().getBotToken(),
                timeout);
        case SEND_EMAIL -> new SendEmailTool(bind(settings, SendEmailTool.Settings.class), toolDefaults.getSmtp());
        case OPENAI_GENERATE -> llmTool(kind, "openai", DEFAULT_OPENAI_MODEL, settings, context);
        case ANTHROPIC_GENERATE -> llmTool(kind, "anthropic", DEFAULT_ANTHROPIC_MODEL, settings, context);
        case CUSTOM -> new CustomTool(bind(settings, CustomTool.Settings.class), okHttpClient, objectMapper,
                timeout);
        };
    }

    private AgentTool llmTool(ToolKind kind, String provider, String defaultModel, Map<String, Object> settings,
            ToolContext context) {
        LlmGenerateTool.Settings bound = bind(settings, LlmGenerateTool.Settings.class);
        String apiKey = bound.getApiKey() != null && !bound.getApiKey().isBlank()
                ? bound.getApiKey()
                : context.credential(provider).orElseGet(() -> configuredKey(provider));
        return new LlmGenerateTool(kind.getToolName(), provider, defaultModel, apiKey, bound, llmPort,
                properties.getLlm().getTemperature());
    }

    private String configuredKey(String provider) {
        FlowProperties.ProviderProperties configured = properties.getLlm().getProviders().get(provider);
        return configured != null ? configured.getApiKey() : null;
    }

    private <T> T bind(Map<String, Object> settings, Class<T> type) {
        return objectMapper.convertValue(settings, type);
    }

    private static Map<String, Object> settingsOf(ToolConfig config) {
        return config.getSettings() != null ? config.getSettings() : Map.of();
    }
}
