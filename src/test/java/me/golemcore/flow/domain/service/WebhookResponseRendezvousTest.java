package me.golemcore.flow.domain.service;

import me.golemcore.flow.domain.model.DeliveredResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookResponseRendezvousTest {

    private static final Duration LONG = Duration.ofSeconds(5);
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private WebhookResponseRendezvous rendezvous;

    @BeforeEach
    void setUp() {
        rendezvous = new WebhookResponseRendezvous(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldHandResponseToWaitingRequest() throws Exception {
        CompletableFuture<Optional<DeliveredResponse>> waiting = rendezvous.await("wf1/hook", LONG);
        assertEquals(1, rendezvous.pendingCount());

        boolean delivered = rendezvous.deliver("wf1/hook", response(201, Map.of("id", 9)));

        assertTrue(delivered);
        Optional<DeliveredResponse> result = waiting.get(1, TimeUnit.SECONDS);
        assertTrue(result.isPresent());
        assertEquals(201, result.get().getStatusCode());
        assertEquals(Map.of("id", 9), result.get().getBody());
        assertEquals(0, rendezvous.pendingCount());
        assertEquals(0, rendezvous.storedCount());
    }

    @Test
    void shouldStoreEarlyResponseForLaterAwait() throws Exception {
        assertTrue(rendezvous.deliver("wf1/hook/", response(200, "early")));
        assertEquals(1, rendezvous.storedCount());

        Optional<DeliveredResponse> result = rendezvous.await("/wf1/hook", LONG).get(1, TimeUnit.SECONDS);

        assertEquals("early", result.orElseThrow().getBody());
        assertEquals("wf1/hook", result.get().getPathKey());
        assertEquals(0, rendezvous.storedCount());
    }

    @Test
    void shouldConsumeStoredResponseOnlyOnce() throws Exception {
        rendezvous.deliver("wf1/hook", response(200, "once"));

        assertTrue(rendezvous.await("wf1/hook", LONG).get(1, TimeUnit.SECONDS).isPresent());
        assertFalse(rendezvous.await("wf1/hook", Duration.ofMillis(50)).get(1, TimeUnit.SECONDS).isPresent());
    }

    @Test
    void shouldResolveEmptyAfterTimeout() throws Exception {
        Duration timeout = Duration.ofMillis(200);
        long started = System.nanoTime();

        Optional<DeliveredResponse> result = rendezvous.await("wf1/slow", timeout).get(1, TimeUnit.SECONDS);
        long elapsed = System.nanoTime() - started;

        assertTrue(result.isEmpty());
        assertTrue(elapsed >= timeout.toNanos(), "resolved after " + elapsed + " ns");
        assertTrue(elapsed < timeout.multipliedBy(2).toNanos(), "resolved after " + elapsed + " ns");
    }

    @Test
    void shouldStoreResponseDeliveredAfterTimeout() throws Exception {
        rendezvous.await("wf1/late", Duration.ofMillis(20)).get(1, TimeUnit.SECONDS);

        assertTrue(rendezvous.deliver("wf1/late", response(200, "late")));

        assertEquals(1, rendezvous.storedCount());
    }

    @Test
    void shouldRejectSecondDeliveryWhileFirstIsUnconsumed() throws Exception {
        assertTrue(rendezvous.deliver("wf1/hook", response(200, "first")));
        assertFalse(rendezvous.deliver("wf1/hook", response(200, "second")));

        assertEquals("first", rendezvous.await("wf1/hook", LONG).get(1, TimeUnit.SECONDS).orElseThrow().getBody());
    }

    @Test
    void shouldReleasePreviousWaiterWhenNewOneRegisters() throws Exception {
        CompletableFuture<Optional<DeliveredResponse>> first = rendezvous.await("wf1/hook", LONG);
        CompletableFuture<Optional<DeliveredResponse>> second = rendezvous.await("wf1/hook", LONG);

        rendezvous.deliver("wf1/hook", response(200, "for-second"));

        assertTrue(first.get(1, TimeUnit.SECONDS).isEmpty());
        assertEquals("for-second", second.get(1, TimeUnit.SECONDS).orElseThrow().getBody());
    }

    @Test
    void shouldDeliverExactlyOnceUnderConcurrentAwaitAndDeliver() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 200; i++) {
                String key = "race/" + i;
                CountDownLatch start = new CountDownLatch(1);
                CompletableFuture<CompletableFuture<Optional<DeliveredResponse>>> awaiting = CompletableFuture
                        .supplyAsync(() -> {
                            awaitLatch(start);
                            return rendezvous.await(key, LONG);
                        }, pool);
                CompletableFuture<Boolean> delivering = CompletableFuture.supplyAsync(() -> {
                    awaitLatch(start);
                    return rendezvous.deliver(key, response(200, "r"));
                }, pool);
                start.countDown();

                assertTrue(delivering.get(1, TimeUnit.SECONDS));
                assertTrue(awaiting.get(1, TimeUnit.SECONDS).get(1, TimeUnit.SECONDS).isPresent(), key);
            }
            assertEquals(0, rendezvous.pendingCount());
            assertEquals(0, rendezvous.storedCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldSweepOnlyResponsesOlderThanCutoff() {
        rendezvous.deliver("wf1/old", DeliveredResponse.builder().deliveredAt(NOW.minusSeconds(600)).build());
        rendezvous.deliver("wf1/new", DeliveredResponse.builder().deliveredAt(NOW).build());

        int removed = rendezvous.sweep(NOW.minusSeconds(300));

        assertEquals(1, removed);
        assertEquals(1, rendezvous.storedCount());
    }

    @Test
    void shouldReleaseWaitersOnClear() throws Exception {
        CompletableFuture<Optional<DeliveredResponse>> waiting = rendezvous.await("wf1/hook", LONG);

        rendezvous.clear();

        assertTrue(waiting.get(1, TimeUnit.SECONDS).isEmpty());
        assertEquals(0, rendezvous.pendingCount());
    }

    private static DeliveredResponse response(int status, Object body) {
        return DeliveredResponse.builder().statusCode(status).body(body).build();
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
