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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.flow.domain.service.EventBroadcastService;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the reasoning loop. */
@Configuration
public class AgentLoopConfiguration {

    @Bean
    public ReasoningLoop reasoningLoop(LlmPort llmPort, EventBroadcastService eventBroadcastService,
            FlowProperties flowProperties, ObjectMapper objectMapper, Clock clock) {
        return new DefaultReasoningLoop(llmPort, eventBroadcastService, flowProperties, objectMapper, clock);
    }
}
