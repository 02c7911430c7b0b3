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

package me.golemcore.flow.domain.agent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves the decision model of an agent node from its input.
 *
 * <p>
 * API key lookup order: {@code decisionMakerApiKey}, the legacy
 * {@code chatModelConfig.settings.apiKey}, the node credential for the
 * provider, then {@code flow.llm.providers.<provider>.api-key}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionModelResolver {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-5-sonnet-20241022";

    private final FlowProperties properties;

    public DecisionModel resolve(Map<String, Object> input, Map<String, String> credentials) {
        FlowProperties.AgentProperties agent = properties.getAgent();
        String requestedProvider = text(input.get("decisionMakerProvider"));
        String requestedModel = text(input.get("decisionMakerModel"));

        String provider = requestedProvider != null
                ? requestedProvider.toLowerCase(Locale.ROOT)
                : agent.getDefaultProvider();
        if (requestedModel != null && requestedModel.startsWith("claude")) {
            provider = PROVIDER_ANTHROPIC;
        }

        String model = requestedModel;
        if (model == null) {
            model = PROVIDER_ANTHROPIC.equals(provider) ? DEFAULT_ANTHROPIC_MODEL : agent.getDefaultModel();
        }

        String apiKey = text(input.get("decisionMakerApiKey"));
        String source = "config";
        if (apiKey == null) {
            apiKey = legacyKey(input.get("chatModelConfig"));
            source = "legacy";
        }
        if (apiKey == null && credentials != null) {
            apiKey = text(credentials.get(provider));
            source = "credential";
        }
        if (apiKey == null) {
            FlowProperties.ProviderProperties configured = properties.getLlm().getProviders().get(provider);
            apiKey = configured != null ? text(configured.getApiKey()) : null;
            source = "environment";
        }
        if (apiKey == null) {
            throw new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR,
                    "API Key is required for the Decision Maker. Please provide an API key in the AI Agent "
                            + "configuration or set " + provider.toUpperCase(Locale.ROOT)
                            + "_API_KEY in your environment.");
        }
        log.debug("[Agent] Decision model {}/{} (key from {})", provider, model, source);
        return new DecisionModel(provider, model, apiKey, source);
    }

    private static String legacyKey(Object chatModelConfig) {
        if (chatModelConfig instanceof Map<?, ?> config && config.get("settings") instanceof Map<?, ?> settings) {
            return text(settings.get("apiKey"));
        }
        return null;
    }

    private static String text(Object value) {
        return value instanceof String s && !s.isBlank() ? s.trim() : null;
    }
}
