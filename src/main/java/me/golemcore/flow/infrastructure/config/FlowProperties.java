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

package me.golemcore.flow.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the workflow runtime, bound from
 * application.yml.
 *
 * <p>
 * All runtime configuration is organized under the {@code flow.*} prefix:
 * <ul>
 * <li>{@link WebhookProperties} - response rendezvous and inbound event
 * polling</li>
 * <li>{@link EventsProperties} - workflow event stream</li>
 * <li>{@link AgentProperties} - reasoning loop bounds and defaults</li>
 * <li>{@link LlmProperties} - decision and generation model providers</li>
 * <li>{@link ToolsProperties} - fallbacks for agent tools</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "flow")
@Data
public class FlowProperties {

    private WebhookProperties webhook = new WebhookProperties();
    private EventsProperties events = new EventsProperties();
    private AgentProperties agent = new AgentProperties();
    private LlmProperties llm = new LlmProperties();
    private ToolsProperties tools = new ToolsProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class WebhookProperties {
        private long responseTimeoutMs = 30000;
        private long pollIntervalMs = 500;
        private long retentionMs = 300000;
        private long sweepIntervalMs = 60000;
        private long defaultListenTimeoutMs = 30000;
        private long maxListenTimeoutMs = 120000;
    }

    @Data
    public static class EventsProperties {
        private long heartbeatIntervalMs = 30000;
    }

    @Data
    public static class AgentProperties {
        private int defaultMaxIterations = 10;
        private int maxIterationsLimit = 20;
        private long toolTimeoutMs = 60000;
        private int workerThreads = 8;
        private String defaultProvider = "openai";
        private String defaultModel = "gpt-4o-mini";
        private String defaultSystemPrompt = "You are a helpful AI assistant with access to tools. "
                + "Use tools when needed to answer questions accurately. "
                + "Always provide a final answer when you have enough information.";
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private long timeoutMs = 60000;
        private double temperature = 0.7;
        private int maxRetries = 5;
        private long initialBackoffMs = 5000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private int defaultTimeoutSeconds = 30;
        private SlackToolProperties slack = new SlackToolProperties();
        private GoogleSheetsToolProperties googleSheets = new GoogleSheetsToolProperties();
        private DatabaseToolProperties database = new DatabaseToolProperties();
        private SmtpToolProperties smtp = new SmtpToolProperties();
    }

    @Data
    public static class SlackToolProperties {
        private String botToken;
        private String baseUrl = "https://slack.com";
    }

    @Data
    public static class GoogleSheetsToolProperties {
        private String baseUrl = "https://sheets.googleapis.com";
    }

    @Data
    public static class DatabaseToolProperties {
        private String url;
        private String username;
        private String password;
    }

    @Data
    public static class SmtpToolProperties {
        private String host = "";
        private int port = 587;
        private String username = "";
        private String password = "";
        private String security = "starttls";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
