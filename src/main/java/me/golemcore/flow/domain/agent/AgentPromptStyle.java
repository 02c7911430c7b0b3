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

import java.util.Arrays;
import java.util.Optional;

/**
 * Agent node operations. All of them run the same loop and differ only in the
 * preamble put in front of the configured system prompt.
 */
public enum AgentPromptStyle {

    TOOLS("agent.tools", null),
    PLAN_AND_EXECUTE("agent.planAndExecute", """
            You are a planning AI assistant. Before taking actions:
            1. First analyze the task and create a step-by-step plan
            2. Execute each step using available tools
            3. Verify results after each step
            4. Provide a comprehensive final answer

            """),
    CONVERSATIONAL("agent.conversational", """
            You are a friendly conversational AI assistant. Engage naturally with the user \
            while using tools when helpful. Remember context from the conversation.

            """);

    private final String operation;
    private final String preamble;

    AgentPromptStyle(String operation, String preamble) {
        this.operation = operation;
        this.preamble = preamble;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Builds the system prompt for this style. {@link #TOOLS} uses the
     * configured prompt, or the default when none is set; the other styles put
     * their preamble in front of the configured prompt only.
     */
    public String systemPrompt(String configured, String defaultPrompt) {
        boolean hasConfigured = configured != null && !configured.isBlank();
        if (preamble == null) {
            return hasConfigured ? configured : defaultPrompt;
        }
        return preamble + (hasConfigured ? configured : "");
    }

    public static Optional<AgentPromptStyle> fromOperation(String operation) {
        return Arrays.stream(values())
                .filter(style -> style.operation.equals(operation))
                .findFirst();
    }
}
