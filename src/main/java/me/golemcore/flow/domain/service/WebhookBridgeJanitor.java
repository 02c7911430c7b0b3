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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the lifecycle of the bridge stores: a periodic sweep removes stored
 * responses and inbound events older than the retention window, and shutdown
 * releases every waiter and clears both stores.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookBridgeJanitor {

    private final WebhookResponseRendezvous rendezvous;
    private final InboundEventStore inboundEventStore;
    private final FlowProperties properties;
    private final Clock clock;

    private ScheduledExecutorService cleanupExecutor;

    @PostConstruct
    public void init() {
        long interval = properties.getWebhook().getSweepIntervalMs();
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "webhook-bridge-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[Bridge] Cleanup scheduled every {}ms, retention {}ms", interval,
                properties.getWebhook().getRetentionMs());
    }

    /**
     * Runs one sweep with the configured retention window.
     */
    public void sweep() {
        try {
            Instant cutoff = clock.instant().minusMillis(properties.getWebhook().getRetentionMs());
            int responses = rendezvous.sweep(cutoff);
            int events = inboundEventStore.sweep(cutoff);
            if (responses > 0 || events > 0) {
                log.info("[Bridge] Swept {} stale responses and {} stale inbound events", responses, events);
            }
        } catch (RuntimeException e) { // NOSONAR - keep the scheduled task alive
            log.error("[Bridge] Cleanup sweep failed", e);
        }
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        rendezvous.clear();
        inboundEventStore.clearAll();
        log.info("[Bridge] Stores cleared on shutdown");
    }
}
