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

import me.golemcore.flow.domain.model.AgentRunResult;

/**
 * Bounded reason/act/observe loop driving one agent run.
 */
public interface ReasoningLoop {

    /**
     * Runs to a terminal status. Blocks the calling thread; callers schedule it
     * off the event loop. Never throws: failures end in the {@code error}
     * status.
     */
    AgentRunResult run(AgentRunRequest request);
}
