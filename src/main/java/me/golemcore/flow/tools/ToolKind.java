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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of tool kinds an agent node can be configured with, keyed by the
 * configuration {@code type} tags that select them.
 */
public enum ToolKind {

    HTTP_REQUEST("http_request", "httpRequestTool"),
    DATABASE_QUERY("database_query", "postgresTool"),
    GOOGLE_SHEETS("google_sheets", "googleSheetsTool"),
    SLACK_MESSAGE("slack_message", "slackTool"),
    SEND_EMAIL("send_email", "gmailTool", "emailTool"),
    OPENAI_GENERATE("openai_generate", "openaiTool", "openAiChatModel"),
    ANTHROPIC_GENERATE("anthropic_generate", "anthropicTool", "anthropicChatModel"),
    CUSTOM(null, "customTool");

    private final String toolName;
    private final List<String> types;

    ToolKind(String toolName, String... types) {
        this.toolName = toolName;
        this.types = List.of(types);
    }

    /**
     * Fixed tool name exposed to the decision model; {@code null} for
     * {@link #CUSTOM}, whose name comes from settings.
     */
    public String getToolName() {
        return toolName;
    }

    public List<String> getTypes() {
        return types;
    }

    public static Optional<ToolKind> fromType(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.types.contains(type))
                .findFirst();
    }
}
