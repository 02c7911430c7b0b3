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

package me.golemcore.flow.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.FlowEvent;
import me.golemcore.flow.domain.model.FlowEventType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide fan-out of workflow progress events.
 *
 * <p>
 * Subscriptions are grouped per workflow id. Publishing is best effort: with no
 * subscriber the event is dropped, and a subscriber whose stream is closed is
 * removed without affecting the others. Nothing is buffered for observers that
 * connect later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventBroadcastService {

    private final Map<String, Set<EventSubscription>> subscriptions = new ConcurrentHashMap<>();
    private final Clock clock;

    public EventSubscription subscribe(String workflowId) {
        EventSubscription subscription = new EventSubscription(workflowId);
        subscriptions.compute(workflowId, (id, existing) -> {
            Set<EventSubscription> set = existing != null ? existing : ConcurrentHashMap.newKeySet();
            set.add(subscription);
            return set;
        });
        subscription.emit(FlowEvent.of(FlowEventType.CONNECTED, null, clock.instant(),
                Map.of("workflowId", workflowId)));
        log.info("[Hub] Client connected to workflow {} ({} open)", workflowId, subscriberCount(workflowId));
        return subscription;
    }

    public void unsubscribe(EventSubscription subscription) {
        if (subscription == null) {
            return;
        }
        subscriptions.computeIfPresent(subscription.getWorkflowId(), (id, set) -> {
            set.remove(subscription);
            return set.isEmpty() ? null : set;
        });
        subscription.complete();
        log.info("[Hub] Client disconnected from workflow {}", subscription.getWorkflowId());
    }

    /**
     * Sends an event to every open subscription of the workflow. Never blocks and
     * never throws.
     */
    public void publish(String workflowId, FlowEvent event) {
        if (workflowId == null || event == null) {
            return;
        }
        Set<EventSubscription> set = subscriptions.get(workflowId);
        if (set == null || set.isEmpty()) {
            return;
        }

        List<EventSubscription> broken = new ArrayList<>();
        for (EventSubscription subscription : set) {
            try {
                if (!subscription.emit(event)) {
                    broken.add(subscription);
                }
            } catch (RuntimeException e) { // NOSONAR - one broken stream must not stop the fan-out
                log.warn("[Hub] Failed to emit {} to subscription {}: {}", event.type(), subscription.getId(),
                        e.getMessage());
                broken.add(subscription);
            }
        }
        broken.forEach(this::unsubscribe);
    }

    public void publish(String workflowId, FlowEventType type, String nodeId, Map<String, Object> payload) {
        publish(workflowId, FlowEvent.of(type, nodeId, clock.instant(), payload));
    }

    public void publishNodeOutput(String workflowId, String nodeId, Object output) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("output", output);
        publish(workflowId, FlowEventType.NODE_OUTPUT, nodeId, payload);
    }

    public void publishWebhookReceived(String workflowId, String pathKey, Map<String, Object> transaction) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("path", pathKey);
        payload.put("transaction", transaction);
        publish(workflowId, FlowEventType.WEBHOOK_RECEIVED, null, payload);
    }

    public void publishExecutionStarted(String workflowId, String executionId) {
        publish(workflowId, FlowEventType.EXECUTION_STARTED, null, executionPayload(executionId));
    }

    public void publishExecutionCompleted(String workflowId, String executionId, Object results) {
        Map<String, Object> payload = executionPayload(executionId);
        payload.put("results", results);
        publish(workflowId, FlowEventType.EXECUTION_COMPLETED, null, payload);
    }

    public int subscriberCount(String workflowId) {
        Set<EventSubscription> set = subscriptions.get(workflowId);
        return set != null ? set.size() : 0;
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.values().forEach(set -> set.forEach(EventSubscription::complete));
        subscriptions.clear();
        log.info("[Hub] All event streams closed");
    }

    private Map<String, Object> executionPayload(String executionId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executionId", executionId);
        return payload;
    }
}
