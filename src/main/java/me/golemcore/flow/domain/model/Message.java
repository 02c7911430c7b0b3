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

package me.golemcore.flow.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One role-tagged turn in an agent conversation: system, user, assistant or
 * tool.
 *
 * <p>
 * Assistant turns that request tools carry {@link ToolCall}s; each subsequent
 * tool turn carries the {@code toolCallId} of the call it answers.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role;
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Instant timestamp;

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Plain map view used in node output, with the snake_case keys downstream
     * workflow steps expect.
     */
    public Map<String, Object> toOutputMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("role", role);
        map.put("content", content != null ? content : "");
        if (toolCallId != null) {
            map.put("tool_call_id", toolCallId);
        }
        if (toolName != null) {
            map.put("name", toolName);
        }
        if (hasToolCalls()) {
            map.put("tool_calls", toolCalls.stream()
                    .map(tc -> {
                        Map<String, Object> call = new LinkedHashMap<>();
                        call.put("id", tc.getId());
                        call.put("name", tc.getName());
                        call.put("arguments", tc.getArguments() != null ? tc.getArguments() : Map.of());
                        return call;
                    })
                    .toList());
        }
        return map;
    }

    /**
     * A tool invocation requested by the decision model, normalized from the
     * provider wire format right after the response arrives.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
