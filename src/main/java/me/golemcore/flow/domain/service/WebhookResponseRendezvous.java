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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.DeliveredResponse;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Response rendezvous between a webhook request waiting for its HTTP response
 * and the workflow execution that produces it.
 *
 * <p>
 * Each correlation key owns one slot holding either a waiter or a stored
 * response, and every transition of a slot happens inside
 * {@link ConcurrentHashMap#compute}. Rules:
 * <ul>
 * <li>{@code await} consumes a stored response immediately, otherwise it
 * registers a waiter. A newer waiter displaces an older one, which resolves
 * with no response.</li>
 * <li>{@code deliver} hands the response to a live waiter, otherwise stores it.
 * While a stored response is unconsumed, further deliveries for the key are
 * rejected.</li>
 * <li>A waiter that times out removes only its own registration.</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookResponseRendezvous {

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Waits for the response of {@code pathKey}.
     *
     * @return a future completing with the response, or with
     *         {@link Optional#empty()} after {@code timeout}
     */
    public CompletableFuture<Optional<DeliveredResponse>> await(String pathKey, Duration timeout) {
        String key = CorrelationKeys.normalize(pathKey);
        Waiting registration = new Waiting(new CompletableFuture<>(), clock.instant());
        AtomicReference<DeliveredResponse> stored = new AtomicReference<>();
        AtomicReference<Waiting> displaced = new AtomicReference<>();

        slots.compute(key, (k, slot) -> {
            if (slot instanceof Stored existing) {
                stored.set(existing.response());
                return null;
            }
            if (slot instanceof Waiting previous) {
                displaced.set(previous);
            }
            return registration;
        });

        if (stored.get() != null) {
            log.debug("[Bridge] Response for {} was already delivered", key);
            return CompletableFuture.completedFuture(Optional.of(stored.get()));
        }
        if (displaced.get() != null && displaced.get().future().complete(Optional.empty())) {
            log.warn("[Bridge] Second waiter registered for {}, previous waiter released without response", key);
        }

        CompletableFuture<Optional<DeliveredResponse>> future = registration.future();
        future.completeOnTimeout(Optional.empty(), Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> slots.remove(key, registration));
        return future;
    }

    /**
     * Hands a response to the waiter of {@code pathKey}, or stores it for a
     * later {@link #await}.
     *
     * @return {@code false} if an unconsumed response is already stored for the
     *         key and this one was dropped
     */
    public boolean deliver(String pathKey, DeliveredResponse response) {
        String key = CorrelationKeys.normalize(pathKey);
        DeliveredResponse stamped = stamp(key, response);
        AtomicReference<Waiting> target = new AtomicReference<>();
        AtomicBoolean accepted = new AtomicBoolean(true);

        slots.compute(key, (k, slot) -> {
            if (slot instanceof Waiting waiting && !waiting.future().isDone()) {
                target.set(waiting);
                return null;
            }
            if (slot instanceof Stored) {
                accepted.set(false);
                return slot;
            }
            return new Stored(stamped);
        });

        if (!accepted.get()) {
            log.warn("[Bridge] Response for {} already stored and not yet consumed, dropping new delivery", key);
            return false;
        }
        if (target.get() == null) {
            log.debug("[Bridge] No waiter for {}, response stored", key);
            return true;
        }
        if (target.get().future().complete(Optional.of(stamped))) {
            log.info("[Bridge] Response delivered to waiting request {} (status {})", key, stamped.getStatusCode());
            return true;
        }
        // The waiter timed out between the slot update and completion: keep the
        // response for the next await.
        return slots.putIfAbsent(key, new Stored(stamped)) == null;
    }

    /**
     * Removes stored responses delivered before {@code cutoff}, consumed or not.
     */
    public int sweep(Instant cutoff) {
        int before = slots.size();
        slots.entrySet().removeIf(entry -> entry.getValue() instanceof Stored stored
                && stored.response().getDeliveredAt().isBefore(cutoff));
        return Math.max(0, before - slots.size());
    }

    public int pendingCount() {
        return (int) slots.values().stream().filter(Waiting.class::isInstance).count();
    }

    public int storedCount() {
        return (int) slots.values().stream().filter(Stored.class::isInstance).count();
    }

    public void clear() {
        slots.values().forEach(slot -> {
            if (slot instanceof Waiting waiting) {
                waiting.future().complete(Optional.empty());
            }
        });
        slots.clear();
    }

    private DeliveredResponse stamp(String key, DeliveredResponse response) {
        return DeliveredResponse.builder()
                .pathKey(key)
                .statusCode(response.getStatusCode())
                .headers(response.getHeaders() != null ? response.getHeaders() : Map.of())
                .body(response.getBody())
                .deliveredAt(response.getDeliveredAt() != null ? response.getDeliveredAt() : clock.instant())
                .build();
    }

    private interface Slot {
    }

    private record Waiting(CompletableFuture<Optional<DeliveredResponse>> future, Instant registeredAt)
            implements Slot {
    }

    private record Stored(DeliveredResponse response) implements Slot {
    }
}
