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
import me.golemcore.flow.domain.model.InboundEvent;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Latest inbound webhook event per correlation key, handed to at most one
 * poller.
 *
 * <p>
 * Polling checks the key at a fixed interval until an unconsumed event shows up
 * or the first check after the timeout finds nothing. Consumption flips the event's flag with
 * compare-and-set, so two concurrent pollers can never both receive it.
 */
@Service
@Slf4j
public class InboundEventStore {

    private final Map<String, StoredEvent> events = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration pollInterval;

    public InboundEventStore(Clock clock, FlowProperties properties) {
        this.clock = clock;
        this.pollInterval = Duration.ofMillis(Math.max(1, properties.getWebhook().getPollIntervalMs()));
    }

    /**
     * Records the event for {@code pathKey}, replacing any previous one, as
     * unconsumed.
     */
    public void store(String pathKey, InboundEvent event) {
        String key = CorrelationKeys.normalize(pathKey);
        events.put(key, new StoredEvent(event, new AtomicBoolean(false), clock.instant()));
        log.debug("[Bridge] Inbound event stored for {}", key);
    }

    /**
     * Waits up to {@code timeout} (rounded up to the poll interval) for an
     * unconsumed event and consumes it. A zero or negative timeout checks once.
     */
    public Mono<Optional<InboundEvent>> poll(String pathKey, Duration timeout) {
        String key = CorrelationKeys.normalize(pathKey);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return Mono.fromSupplier(() -> tryConsume(key));
        }
        // the deadline is checked in the same signal as the consumption, so a
        // consumed event is always the value returned
        return Mono.defer(() -> {
            long deadline = System.nanoTime() + timeout.toNanos();
            return Flux.interval(Duration.ZERO, pollInterval)
                    .map(tick -> tryConsume(key))
                    .takeUntil(result -> result.isPresent() || System.nanoTime() - deadline >= 0)
                    .last(Optional.empty());
        });
    }

    public Optional<InboundEvent> tryConsume(String pathKey) {
        StoredEvent stored = events.get(CorrelationKeys.normalize(pathKey));
        if (stored != null && stored.consumed().compareAndSet(false, true)) {
            return Optional.of(stored.event());
        }
        return Optional.empty();
    }

    /**
     * Returns the stored event without consuming it.
     */
    public Optional<InboundEvent> peek(String pathKey) {
        StoredEvent stored = events.get(CorrelationKeys.normalize(pathKey));
        return stored != null ? Optional.of(stored.event()) : Optional.empty();
    }

    public boolean clear(String pathKey) {
        return events.remove(CorrelationKeys.normalize(pathKey)) != null;
    }

    /**
     * Marks the stored event unconsumed again so the next poll receives it.
     */
    public boolean reset(String pathKey) {
        StoredEvent stored = events.get(CorrelationKeys.normalize(pathKey));
        if (stored == null) {
            return false;
        }
        stored.consumed().set(false);
        return true;
    }

    public int sweep(Instant cutoff) {
        int before = events.size();
        events.entrySet().removeIf(entry -> entry.getValue().storedAt().isBefore(cutoff));
        return Math.max(0, before - events.size());
    }

    public int size() {
        return events.size();
    }

    public void clearAll() {
        events.clear();
    }

    private record StoredEvent(InboundEvent event, AtomicBoolean consumed, Instant storedAt) {
    }
}
