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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.AgentRunResult;
import me.golemcore.flow.domain.model.AgentRunStatus;
import me.golemcore.flow.domain.model.AgentState;
import me.golemcore.flow.domain.model.AgentStep;
import me.golemcore.flow.domain.model.FlowEventType;
import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;
import me.golemcore.flow.domain.model.Message;
import me.golemcore.flow.domain.model.ToolCallRecord;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.domain.service.EventBroadcastService;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.LlmPort;
import me.golemcore.flow.tools.AgentTool;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * ReAct loop: the decision model either answers or asks for tools; tool
 * results are appended as observations and the model is asked again, until it
 * answers, the iteration cap is hit, or the model call fails.
 *
 * <p>
 * Every tool call is answered by exactly one {@code tool} message carrying the
 * call's id, whatever the outcome of the tool. Tool failures are observations,
 * not run failures; only a failing model call ends the run with
 * {@link AgentRunStatus#ERROR}.
 */
@Slf4j
public class DefaultReasoningLoop implements ReasoningLoop {

    private static final int LAST_TOOL_CALLS_IN_FALLBACK = 3;
    private static final String NO_RESPONSE = "No response generated";

    private final LlmPort llmPort;
    private final EventBroadcastService events;
    private final FlowProperties.AgentProperties settings;
    private final double temperature;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultReasoningLoop(LlmPort llmPort, EventBroadcastService events, FlowProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        this.llmPort = llmPort;
        this.events = events;
        this.settings = properties.getAgent();
        this.temperature = properties.getLlm().getTemperature();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public AgentRunResult run(AgentRunRequest request) {
        int maxIterations = clampIterations(request.getMaxIterations());
        ToolSet tools = new ToolSet(request.getTools());
        AgentState state = new AgentState(request.getSystemPrompt(), request.getInput(), clock.instant());

        log.info("[Agent] Run started on node {} ({} tools, max {} iterations, model {})",
                request.getNodeId(), tools.definitions().size(), maxIterations, request.getDecisionModel());
        publish(request, FlowEventType.AGENT_START, payload("input", request.getInput()));

        try {
            while (state.getIterations() < maxIterations && state.getStep() != AgentStep.COMPLETE) {
                iterate(request, state, tools);
            }
        } catch (RuntimeException e) { // NOSONAR - the run must always end with a result
            log.error("[Agent] Run on node {} failed unexpectedly", request.getNodeId(), e);
            fail(request, state, messageOf(e));
        }

        AgentRunResult result = finish(state, maxIterations);
        log.info("[Agent] Run on node {} finished: status={}, iterations={}, toolCalls={}",
                request.getNodeId(), result.getStatus().getWireName(), result.getIterations(),
                result.getToolCalls().size());

        Map<String, Object> complete = new LinkedHashMap<>();
        complete.put("answer", result.getAnswer());
        complete.put("totalIterations", result.getIterations());
        complete.put("toolCallsSummary", result.getToolCalls().stream()
                .map(call -> {
                    Map<String, Object> summary = payload("tool", call.tool());
                    summary.put("success", call.success());
                    return summary;
                })
                .toList());
        publish(request, FlowEventType.AGENT_COMPLETE, complete);
        return result;
    }

    private void iterate(AgentRunRequest request, AgentState state, ToolSet tools) {
        int iteration = state.nextIteration();
        state.setStep(AgentStep.REASON);
        log.debug("[Agent] Iteration {} on node {}", iteration, request.getNodeId());
        publish(request, FlowEventType.AGENT_THINKING, payload("iteration", iteration));

        LlmResponse response;
        try {
            response = llmPort.chat(buildRequest(request, state, tools.definitions())).join();
        } catch (RuntimeException e) { // NOSONAR - provider failures end the run with an error status
            String error = messageOf(e);
            log.warn("[Agent] Decision model call failed on iteration {}: {}", iteration, error);
            fail(request, state, error);
            return;
        }

        if (response != null && response.hasToolCalls()) {
            act(request, state, tools, response);
            state.setStep(AgentStep.OBSERVE);
        } else if (response != null && response.hasContent()) {
            state.append(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(response.getContent())
                    .timestamp(clock.instant())
                    .build());
            state.setOutput(response.getContent());
            state.setStep(AgentStep.COMPLETE);
        } else {
            log.debug("[Agent] Empty decision on iteration {}, continuing", iteration);
        }
    }

    private void act(AgentRunRequest request, AgentState state, ToolSet tools, LlmResponse response) {
        state.setStep(AgentStep.ACT);
        List<Message.ToolCall> calls = response.getToolCalls().stream()
                .map(call -> Message.ToolCall.builder()
                        .id(call.getId() != null && !call.getId().isBlank() ? call.getId()
                                : "call_" + UUID.randomUUID())
                        .name(call.getName())
                        .arguments(call.getArguments() != null ? call.getArguments() : Map.of())
                        .build())
                .toList();

        state.append(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(response.getContent() != null ? response.getContent() : "")
                .toolCalls(calls)
                .timestamp(clock.instant())
                .build());

        for (Message.ToolCall call : calls) {
            int toolIndex = tools.indexOf(call.getName());
            Map<String, Object> start = new LinkedHashMap<>();
            start.put("toolName", call.getName());
            start.put("toolIndex", toolIndex);
            start.put("toolInput", call.getArguments());
            publish(request, FlowEventType.AGENT_TOOL_START, start);

            Observation observation = invoke(tools.get(call.getName()), call);
            state.record(new ToolCallRecord(call.getName(), call.getArguments(), observation.output(),
                    observation.success(), clock.instant()));

            Map<String, Object> end = new LinkedHashMap<>();
            end.put("toolName", call.getName());
            end.put("toolIndex", toolIndex);
            end.put("toolOutput", observation.success() ? observation.output() : null);
            end.put("error", observation.error());
            publish(request, FlowEventType.AGENT_TOOL_END, end);

            state.append(Message.builder()
                    .role(Message.ROLE_TOOL)
                    .toolCallId(call.getId())
                    .toolName(call.getName())
                    .content(toJson(observation.output()))
                    .timestamp(clock.instant())
                    .build());
        }
    }

    private Observation invoke(AgentTool tool, Message.ToolCall call) {
        if (tool == null) {
            log.warn("[Agent] Model requested unknown tool '{}'", call.getName());
            return Observation.failure("Unknown tool: " + call.getName(), null);
        }
        long timeoutMs = settings.getToolTimeoutMs();
        ToolResult result;
        try {
            result = tool.execute(call.getArguments())
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("[Tool:{}] Timed out after {}ms", call.getName(), timeoutMs);
                return Observation.failure("Tool execution timed out after " + timeoutMs + "ms", null);
            }
            log.warn("[Tool:{}] Failed: {}", call.getName(), cause.getMessage());
            return Observation.failure(messageOf(cause), null);
        } catch (RuntimeException e) { // NOSONAR - a tool that throws synchronously is still an observation
            log.warn("[Tool:{}] Failed: {}", call.getName(), e.getMessage());
            return Observation.failure(messageOf(e), null);
        }

        if (result == null) {
            return Observation.failure("Tool returned no result", null);
        }
        if (!result.isSuccess()) {
            return Observation.failure(result.getError() != null ? result.getError() : "Tool failed",
                    result.getData());
        }
        Object output = result.getData() != null ? result.getData() : result.getOutput();
        return new Observation(true, output, null);
    }

    private LlmRequest buildRequest(AgentRunRequest request, AgentState state, List<ToolDefinition> tools) {
        DecisionModel model = request.getDecisionModel();
        return LlmRequest.builder()
                .provider(model != null ? model.provider() : settings.getDefaultProvider())
                .model(model != null ? model.model() : settings.getDefaultModel())
                .apiKey(model != null ? model.apiKey() : null)
                .messages(new ArrayList<>(state.getMessages()))
                .tools(tools)
                .temperature(temperature)
                .build();
    }

    private AgentRunResult finish(AgentState state, int maxIterations) {
        AgentRunStatus status;
        String answer;
        if (state.getError() != null) {
            status = AgentRunStatus.ERROR;
            answer = state.getError();
        } else if (state.getOutput() != null) {
            status = AgentRunStatus.COMPLETED;
            answer = state.getOutput();
        } else {
            status = AgentRunStatus.MAX_ITERATIONS;
            List<ToolCallRecord> calls = state.getToolCalls();
            String lastCalls = calls.stream()
                    .skip(Math.max(0, calls.size() - LAST_TOOL_CALLS_IN_FALLBACK))
                    .map(ToolCallRecord::tool)
                    .collect(Collectors.joining(", "));
            answer = "Agent reached maximum iterations (" + maxIterations + "). Last tool calls: "
                    + (lastCalls.isEmpty() ? "none" : lastCalls);
            state.setOutput(answer);
        }
        return AgentRunResult.builder()
                .answer(answer != null && !answer.isBlank() ? answer : NO_RESPONSE)
                .status(status)
                .iterations(state.getIterations())
                .error(state.getError())
                .toolCalls(List.copyOf(state.getToolCalls()))
                .messages(List.copyOf(state.getMessages()))
                .build();
    }

    private void fail(AgentRunRequest request, AgentState state, String error) {
        state.setError(error);
        state.setStep(AgentStep.COMPLETE);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error);
        payload.put("iteration", state.getIterations());
        publish(request, FlowEventType.AGENT_ERROR, payload);
    }

    int clampIterations(Integer requested) {
        int limit = Math.max(1, settings.getMaxIterationsLimit());
        int value = requested != null ? requested : settings.getDefaultMaxIterations();
        return Math.max(1, Math.min(limit, value));
    }

    private void publish(AgentRunRequest request, FlowEventType type, Map<String, Object> payload) {
        events.publish(request.getWorkflowId(), type, request.getNodeId(), payload);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static Map<String, Object> payload(String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return payload;
    }

    private static String messageOf(Throwable error) {
        Throwable cause = error;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private record Observation(boolean success, Object output, String error) {

        static Observation failure(String error, Object data) {
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("error", error);
            if (data instanceof Map<?, ?> details) {
                details.forEach((key, value) -> output.putIfAbsent(String.valueOf(key), value));
            } else if (data != null) {
                output.put("details", data);
            }
            return new Observation(false, output, error);
        }
    }

    /**
     * Tools of one run by name, with their position in the configured order.
     */
    private static final class ToolSet {

        private final Map<String, AgentTool> byName = new LinkedHashMap<>();
        private final Map<String, Integer> indexes = new LinkedHashMap<>();
        private final List<ToolDefinition> definitions = new ArrayList<>();

        ToolSet(List<AgentTool> tools) {
            if (tools == null) {
                return;
            }
            for (AgentTool tool : tools) {
                ToolDefinition definition = tool.getDefinition();
                if (byName.putIfAbsent(definition.getName(), tool) == null) {
                    indexes.put(definition.getName(), definitions.size());
                    definitions.add(definition);
                }
            }
        }

        AgentTool get(String name) {
            return name != null ? byName.get(name) : null;
        }

        int indexOf(String name) {
            return name != null ? indexes.getOrDefault(name, -1) : -1;
        }

        List<ToolDefinition> definitions() {
            return definitions;
        }
    }
}
