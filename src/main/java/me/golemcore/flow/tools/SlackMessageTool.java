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
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.infrastructure.http.FeignClientFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Slack tool ({@code slack_message}) posting through {@code chat.postMessage}.
 *
 * <p>
 * Bot token lookup order: settings, the node's {@code slack} credential, then
 * {@code flow.tools.slack.bot-token}.
 */
@Slf4j
public class SlackMessageTool implements AgentTool {

    static final String NAME = "slack_message";
    static final String DEFAULT_CHANNEL = "#general";

    private static final String PARAM_CHANNEL = "channel";
    private static final String PARAM_MESSAGE = "message";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";

    private final Settings settings;
    private final ToolContext context;
    private final String fallbackToken;
    private final SlackApi api;

    public SlackMessageTool(Settings settings, ToolContext context, FeignClientFactory feignClientFactory,
            String baseUrl, String fallbackToken, int defaultTimeoutSeconds) {
        this.settings = settings;
        this.context = context;
        this.fallbackToken = fallbackToken;
        int timeout = settings.getTimeout() != null && settings.getTimeout() > 0
                ? settings.getTimeout()
                : defaultTimeoutSeconds;
        this.api = feignClientFactory.create(SlackApi.class, baseUrl, timeout);
    }

    @Override
    public ToolDefinition getDefinition() {
        String description = settings.getDescription() != null && !settings.getDescription().isBlank()
                ? settings.getDescription()
                : "Send messages to Slack channels.";
        return ToolDefinition.builder()
                .name(NAME)
                .description(description)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_CHANNEL, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "Channel name or ID (e.g. #general)"),
                                PARAM_MESSAGE, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "Message text to send")),
                        "required", List.of(PARAM_MESSAGE)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            if (!(arguments.get(PARAM_MESSAGE) instanceof String message) || message.isBlank()) {
                throw new ToolExecutionException("Missing required parameter: message");
            }
            String channel = resolveChannel(arguments.get(PARAM_CHANNEL));
            String token = botToken();

            try {
                PostMessageResponse response = api.postMessage(token, new PostMessageRequest(channel, message));
                if (response == null || !response.isOk()) {
                    String error = response != null && response.getError() != null ? response.getError()
                            : "unknown_error";
                    log.warn("[Tool:{}] Slack rejected message to {}: {}", NAME, channel, error);
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("error", "Slack API error: " + error);
                    data.put("sent", false);
                    return ToolResult.failure("Slack API error: " + error, data);
                }
                log.info("[Tool:{}] Message sent to {}", NAME, channel);
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("sent", true);
                data.put(PARAM_CHANNEL, response.getChannel() != null ? response.getChannel() : channel);
                data.put("ts", response.getTs());
                return ToolResult.success("Message sent to " + channel, data);
            } catch (FeignException e) {
                log.warn("[Tool:{}] Slack request failed (status {})", NAME, e.status());
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("error", "Slack request failed: HTTP " + e.status());
                data.put("sent", false);
                return ToolResult.failure("Slack request failed: HTTP " + e.status(), data);
            }
        });
    }

    private String resolveChannel(Object requested) {
        if (requested instanceof String channel && !channel.isBlank()) {
            return channel;
        }
        String configured = settings.getDefaultChannel();
        return configured != null && !configured.isBlank() ? configured : DEFAULT_CHANNEL;
    }

    private String botToken() {
        if (settings.getBotToken() != null && !settings.getBotToken().isBlank()) {
            return settings.getBotToken();
        }
        return context.credential("slack")
                .or(() -> fallbackToken != null && !fallbackToken.isBlank()
                        ? Optional.of(fallbackToken)
                        : Optional.<String>empty())
                .orElseThrow(() -> new ToolExecutionException("No Slack bot token configured for " + NAME));
    }

    interface SlackApi {
        @RequestLine("POST /api/chat.postMessage")
        @Headers({
                "Authorization: Bearer {token}",
                "Content-Type: application/json; charset=utf-8"
        })
        PostMessageResponse postMessage(@Param("token") String token, PostMessageRequest request);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class PostMessageRequest {
        private String channel;
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PostMessageResponse {
        private boolean ok;
        private String error;
        private String channel;
        private String ts;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        private String description;
        private String botToken;
        private String defaultChannel;
        private Integer timeout;
    }
}
