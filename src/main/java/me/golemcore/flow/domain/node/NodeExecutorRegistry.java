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

package me.golemcore.flow.domain.node;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.NodeErrorCode;
import me.golemcore.flow.domain.model.NodeExecutionException;
import me.golemcore.flow.domain.model.NodeExecutionRequest;
import me.golemcore.flow.domain.service.EventBroadcastService;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Dispatches node executions by operation id and publishes each successful
 * node output to the workflow's event stream.
 */
@Service
@Slf4j
public class NodeExecutorRegistry {

    private final Map<String, NodeExecutor> byOperation = new HashMap<>();
    private final EventBroadcastService eventBroadcastService;

    public NodeExecutorRegistry(List<NodeExecutor> executors, EventBroadcastService eventBroadcastService) {
        this.eventBroadcastService = eventBroadcastService;
        for (NodeExecutor executor : executors) {
            for (String operation : executor.supportedOperations()) {
                NodeExecutor previous = byOperation.putIfAbsent(operation, executor);
                if (previous != null) {
                    log.warn("[Node] Operation {} is claimed by both {} and {}, keeping the first", operation,
                            previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
                }
            }
        }
        log.info("[Node] Registered {} node operations: {}", byOperation.size(), byOperation.keySet());
    }

    public CompletableFuture<Map<String, Object>> execute(NodeExecutionRequest request) {
        NodeExecutor executor = request.getOperation() != null ? byOperation.get(request.getOperation()) : null;
        if (executor == null) {
            return CompletableFuture.failedFuture(new NodeExecutionException(NodeErrorCode.UNSUPPORTED_OPERATION,
                    "Unknown operation: " + request.getOperation()));
        }

        CompletableFuture<Map<String, Object>> future;
        try {
            future = executor.execute(request);
        } catch (NodeExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((output, error) -> {
            if (error == null) {
                eventBroadcastService.publishNodeOutput(request.getWorkflowId(), request.getNodeId(), output);
            } else {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.warn("[Node] Node {} ({}) failed: {}", request.getNodeId(), request.getOperation(),
                        cause.getMessage());
            }
        });
    }

    public boolean supports(String operation) {
        return operation != null && byOperation.containsKey(operation);
    }
}
