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

package me.golemcore.flow.port.outbound;

import me.golemcore.flow.domain.model.LlmRequest;
import me.golemcore.flow.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to language model providers, used both by the reasoning loop
 * (decision model) and by generation tools.
 */
public interface LlmPort {

    /**
     * Executes a chat completion request and returns the full response. Tool
     * invocations in the response are already normalized to
     * {@link me.golemcore.flow.domain.model.Message.ToolCall}.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Checks whether a provider id is supported by this port.
     */
    boolean supportsProvider(String provider);
}
