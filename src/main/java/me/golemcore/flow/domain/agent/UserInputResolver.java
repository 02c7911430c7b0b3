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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Picks the text an agent run starts from out of the node input.
 *
 * <p>
 * Precedence: an explicit {@code query}, {@code prompt}, {@code message} or
 * {@code input} string; then the trigger payload; then upstream node outputs;
 * then a greeting.
 */
@Component
@RequiredArgsConstructor
public class UserInputResolver {

    static final String GREETING = "Hello! What can you help me with?";

    private static final List<String> DIRECT_FIELDS = List.of("query", "prompt", "message", "input");

    private final ObjectMapper objectMapper;

    public String resolve(Map<String, Object> input) {
        String resolved = fromInput(input != null ? input : Map.of());
        if (resolved == null || resolved.isBlank() || "undefined".equals(resolved) || "{}".equals(resolved)) {
            return GREETING;
        }
        return resolved;
    }

    private String fromInput(Map<String, Object> input) {
        for (String field : DIRECT_FIELDS) {
            if (input.get(field) instanceof String text && !text.isBlank()) {
                return text;
            }
        }

        Object trigger = input.get("trigger");
        if (trigger != null) {
            if (trigger instanceof Map<?, ?> triggerMap && triggerMap.get("body") instanceof Map<?, ?> body) {
                return "Process this webhook data: " + toJson(body);
            }
            return "Process this trigger data: " + toJson(trigger);
        }

        Object previous = input.get("previous");
        if (previous instanceof Map<?, ?> previousMap) {
            for (Object value : previousMap.values()) {
                if (value instanceof Map<?, ?> output && output.containsKey("body")) {
                    return "Process this data: " + toJson(output.get("body"));
                }
            }
            return "Process this data: " + toJson(previousMap);
        }
        if (previous != null) {
            return "Process this data: " + toJson(previous);
        }
        return null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
