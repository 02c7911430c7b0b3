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

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working state of one agent run. Created when the loop starts and discarded
 * when it returns; {@code messages} and {@code toolCalls} only grow.
 */
@Data
public class AgentState {

    private final String input;
    private final List<Message> messages = new ArrayList<>();
    private final List<ToolCallRecord> toolCalls = new ArrayList<>();
    private AgentStep step = AgentStep.REASON;
    private int iterations;
    private String output;
    private String error;

    public AgentState(String systemPrompt, String input, Instant now) {
        this.input = input;
        messages.add(Message.builder()
                .role(Message.ROLE_SYSTEM)
                .content(systemPrompt)
                .timestamp(now)
                .build());
        messages.add(Message.builder()
                .role(Message.ROLE_USER)
                .content(input)
                .timestamp(now)
                .build());
    }

    public void append(Message message) {
        messages.add(message);
    }

    public void record(ToolCallRecord toolCall) {
        toolCalls.add(toolCall);
    }

    public int nextIteration() {
        iterations++;
        return iterations;
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<ToolCallRecord> getToolCalls() {
        return Collections.unmodifiableList(toolCalls);
    }
}
