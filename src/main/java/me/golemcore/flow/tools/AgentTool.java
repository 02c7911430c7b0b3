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

import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A capability the decision model can invoke during an agent run.
 *
 * <p>
 * Instances are built per run from node configuration by {@link ToolRegistry}.
 * Expected failures of the wrapped system complete the future with a failed
 * {@link ToolResult}; a tool that cannot be used at all (missing credentials,
 * disallowed operation) completes it exceptionally with
 * {@link ToolExecutionException}.
 */
public interface AgentTool {

    ToolDefinition getDefinition();

    CompletableFuture<ToolResult> execute(Map<String, Object> arguments);
}
