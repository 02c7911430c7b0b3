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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.FlowEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.UUID;

/**
 * Handle of one open event stream. Owns a unicast sink, so {@link #events()}
 * may be subscribed once. At most {@link #BUFFER_CAPACITY} events wait for a
 * slow client; past that the stream is closed.
 */
@Slf4j
public final class EventSubscription {

    static final int BUFFER_CAPACITY = 256;

    private final String id = UUID.randomUUID().toString();
    private final String workflowId;
    private final Sinks.Many<FlowEvent> sink = Sinks.many().unicast()
            .onBackpressureBuffer(Queues.<FlowEvent>get(BUFFER_CAPACITY).get());

    EventSubscription(String workflowId) {
        this.workflowId = workflowId;
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Flux<FlowEvent> events() {
        return sink.asFlux();
    }

    /**
     * Pushes an event to this stream.
     *
     * @return {@code false} if the stream is closed and the handle should be
     *         dropped
     */
    synchronized boolean emit(FlowEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isSuccess()) {
            return true;
        }
        if (result == Sinks.EmitResult.FAIL_TERMINATED || result == Sinks.EmitResult.FAIL_CANCELLED) {
            return false;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.warn("[Hub] Subscription {} to workflow {} is not reading, closing it", id, workflowId);
            sink.tryEmitComplete();
            return false;
        }
        log.debug("[Hub] Event {} not emitted to subscription {}: {}", event.type(), id, result);
        return true;
    }

    synchronized void complete() {
        sink.tryEmitComplete();
    }
}
