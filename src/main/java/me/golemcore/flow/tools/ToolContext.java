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

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Map;
import java.util.Optional;

/**
 * Per-run context handed to tools: which node they serve and the credentials
 * connected to it.
 */
@Data
@Builder
public class ToolContext {

    private String workflowId;
    private String nodeId;

    @Builder.Default
    @ToString.Exclude
    private Map<String, String> credentials = Map.of();

    public Optional<String> credential(String provider) {
        if (credentials == null) {
            return Optional.empty();
        }
        String value = credentials.get(provider);
        return value != null && !value.isBlank() ? Optional.of(value) : Optional.empty();
    }
}
