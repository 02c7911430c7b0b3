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

import lombok.Builder;
import lombok.Data;
import me.golemcore.flow.tools.AgentTool;

import java.util.List;

/**
 * Everything one agent run needs, already resolved from the node input.
 */
@Data
@Builder
public class AgentRunRequest {

    private String workflowId;
    private String nodeId;
    private String executionId;
    private String input;
    private String systemPrompt;
    private Integer maxIterations;
    private DecisionModel decisionModel;

    @Builder.Default
    private List<AgentTool> tools = List.of();
}
