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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.agent.AgentPromptStyle;
import me.golemcore.flow.domain.agent.AgentRunRequest;
import me.golemcore.flow.domain.agent.DecisionModel;
import me.golemcore.flow.domain.agent.DecisionModelResolver;
import me.golemcore.flow.domain.agent.ReasoningLoop;
import me.golemcore.flow.domain.agent.UserInputResolver;
import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.domain.model.NodeExecutionRequest;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.tools.AgentTool;
import me.golemcore.flow.tools.ToolConfig;
import me.golemcore.flow.tools.ToolContext;
import me.golemcore.flow.tools.ToolRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs AI agent nodes ({@code agent.tools}, {@code agent.planAndExecute},
 * {@code agent.conversational}).
 *
 * <p>
 * Input, decision model and tools are resolved on the calling thread so that
 * configuration errors fail fast; the loop itself runs on the agent worker
 * pool.
 */
@Component
@Slf4j
public class AgentNodeExecutor implements NodeExecutor {

    private final ReasoningLoop reasoningLoop;
    private final ToolRegistry toolRegistry;
    private final UserInputResolver userInputResolver;
    private final DecisionModelResolver decisionModelResolver;
    private final ObjectMapper objectMapper;
    private final FlowProperties properties;
    private final ExecutorService agentExecutor;

    public AgentNodeExecutor(ReasoningLoop reasoningLoop, ToolRegistry toolRegistry,
            UserInputResolver userInputResolver, DecisionModelResolver decisionModelResolver,
            ObjectMapper objectMapper, FlowProperties properties,
            @Qualifier("agentExecutor") ExecutorService agentExecutor) {
        this.reasoningLoop = reasoningLoop;
        this.toolRegistry = toolRegistry;
        this.userInputResolver = userInputResolver;
        this.decisionModelResolver = decisionModelResolver;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.agentExecutor = agentExecutor;
    }

    @Override
    public Set<String> supportedOperations() {
        return Arrays.stream(AgentPromptStyle.values())
                .map(AgentPromptStyle::getOperation)
                .collect(Collectors.toSet());
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(NodeExecutionRequest request) {
        AgentRunRequest runRequest;
        try {
            AgentPromptStyle style = AgentPromptStyle.fromOperation(request.getOperation())
                    .orElseThrow(() -> new NodeExecutionException(NodeErrorCode.UNSUPPORTED_OPERATION,
                            "Unknown operation: " + request.getOperation()));
            runRequest = prepare(request, style);
        } catch (NodeExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }

        try {
            return CompletableFuture.supplyAsync(() -> reasoningLoop.run(runRequest).toOutput(), agentExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new NodeExecutionException(NodeErrorCode.EXECUTION_FAILED,
                    "Agent worker pool is not accepting work", e));
        }
    }

    AgentRunRequest prepare(NodeExecutionRequest request, AgentPromptStyle style) {
        Map<String, Object> input = request.getInput() != null ? request.getInput() : Map.of();
        String userInput = userInputResolver.resolve(input);
        DecisionModel decisionModel = decisionModelResolver.resolve(input, request.getCredentials());
        String configuredPrompt = input.get("systemPrompt") instanceof String s ? s : null;

        ToolContext context = ToolContext.builder()
                .workflowId(request.getWorkflowId())
                .nodeId(request.getNodeId())
                .credentials(request.getCredentials() != null ? request.getCredentials() : Map.of())
                .build();
        List<AgentTool> tools = toolRegistry.build(toolConfigs(input), context);

        return AgentRunRequest.builder()
                .workflowId(request.getWorkflowId())
                .nodeId(request.getNodeId())
                .executionId(request.getExecutionId())
                .input(userInput)
                .systemPrompt(style.systemPrompt(configuredPrompt, properties.getAgent().getDefaultSystemPrompt()))
                .maxIterations(maxIterations(input.get("maxIterations")))
                .decisionModel(decisionModel)
                .tools(tools)
                .build();
    }

    /**
     * The legacy chat-model slot comes first, followed by the node's tool list.
     */
    private List<ToolConfig> toolConfigs(Map<String, Object> input) {
        List<ToolConfig> configs = new ArrayList<>();
        addToolConfig(configs, input.get("chatModelConfig"));
        if (input.get("toolConfigs") instanceof List<?> list) {
            list.forEach(item -> addToolConfig(configs, item));
        }
        return configs;
    }

    private void addToolConfig(List<ToolConfig> configs, Object raw) {
        if (!(raw instanceof Map<?, ?>)) {
            return;
        }
        try {
            configs.add(objectMapper.convertValue(raw, ToolConfig.class));
        } catch (IllegalArgumentException e) {
            log.warn("[Agent] Ignoring malformed tool config: {}", e.getMessage());
        }
    }

    private static Integer maxIterations(Object raw) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException e) {
                throw new NodeExecutionException(NodeErrorCode.VALIDATION_ERROR,
                        "maxIterations must be a number: " + text);
            }
        }
        return null;
    }
}
