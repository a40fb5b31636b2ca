package com.alertsentinel.core.batch;

import com.alertsentinel.core.model.TriggerEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DebounceBatcher}.
 */
class DebounceBatcherTest {

    private static final Duration SHORT = Duration.ofMillis(150);

    private final DebounceBatcher batcher = new DebounceBatcher();

    @AfterEach
    void tearDown() {
        batcher.close();
    }

    @Test
    @DisplayName("Events added within the window should be delivered together once")
    void shouldDeliverOneBatchPerQuietPeriod() throws InterruptedException {
        List<List<TriggerEvent>> deliveries = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(1);
        BatchListener listener = (key, events) -> {
            deliveries.add(events);
            delivered.countDown();
        };

        TriggerEvent first = event("a-1", "SBER");
        TriggerEvent second = event("a-2", "SBER");
        batcher.addToBatch("SBER", first, SHORT, listener);
        batcher.addToBatch("SBER", second, SHORT, listener);

        assertThat(batcher.pendingCount("SBER")).isEqualTo(2);
        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();

        // give a superseded timer the chance to misfire
        Thread.sleep(SHORT.toMillis() * 2);
        assertThat(deliveries).hasSize(1);
        assertThat(deliveries.get(0)).containsExactly(first, second);
        assertThat(batcher.pendingKeys()).isEmpty();
    }

    @Test
    @DisplayName("Each key should be debounced independently")
    void shouldBatchPerKey() throws InterruptedException {
        Map<String, List<TriggerEvent>> deliveries = new ConcurrentHashMap<>();
        CountDownLatch delivered = new CountDownLatch(2);
        BatchListener listener = (key, events) -> {
            deliveries.put(key, events);
            delivered.countDown();
        };

        batcher.addToBatch("SBER", event("a-1", "SBER"), SHORT, listener);
        batcher.addToBatch("GAZP", event("a-2", "GAZP"), SHORT, listener);

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(deliveries).containsOnlyKeys("SBER", "GAZP");
        assertThat(deliveries.get("SBER")).hasSize(1);
        assertThat(deliveries.get("GAZP")).hasSize(1);
    }

    @Test
    @DisplayName("flushAll should deliver every pending batch immediately and clear state")
    void flushAllShouldDeliverEverything() {
        BatchListener never = (key, events) -> {
            throw new AssertionError("timer should not fire");
        };
        batcher.addToBatch("SBER", event("a-1", "SBER"), 60, never);
        batcher.addToBatch("SBER", event("a-2", "SBER"), 60, never);
        batcher.addToBatch("GAZP", event("a-3", "GAZP"), 60, never);

        Map<String, Integer> flushed = new ConcurrentHashMap<>();
        batcher.flushAll((key, events) -> flushed.merge(key, events.size(), Integer::sum));

        assertThat(flushed).containsEntry("SBER", 2).containsEntry("GAZP", 1).hasSize(2);
        assertThat(batcher.pendingKeys()).isEmpty();
        assertThat(batcher.pendingCount("SBER")).isZero();
    }

    @Test
    @DisplayName("A failing listener should not leave pending state behind")
    void failingListenerShouldNotLeakState() throws InterruptedException {
        CountDownLatch called = new CountDownLatch(1);
        batcher.addToBatch("SBER", event("a-1", "SBER"), SHORT, (key, events) -> {
            called.countDown();
            throw new IllegalStateException("downstream unavailable");
        });

        assertThat(called.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(batcher.pendingKeys()).isEmpty();

        CountDownLatch again = new CountDownLatch(1);
        batcher.addToBatch("SBER", event("a-2", "SBER"), SHORT, (key, events) -> again.countDown());
        assertThat(again.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Non-positive windows should be rejected")
    void shouldRejectNonPositiveWindow() {
        BatchListener listener = (key, events) -> { };

        assertThatThrownBy(() -> batcher.addToBatch("SBER", event("a-1", "SBER"), 0, listener))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> batcher.addToBatch("SBER", event("a-1", "SBER"), Duration.ZERO, listener))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(batcher.pendingKeys()).isEmpty();
    }

    @Test
    @DisplayName("close should drop pending batches without delivering them")
    void closeShouldDropPendingBatches() throws InterruptedException {
        CountDownLatch delivered = new CountDownLatch(1);
        batcher.addToBatch("SBER", event("a-1", "SBER"), SHORT, (key, events) -> delivered.countDown());

        batcher.close();

        assertThat(batcher.pendingKeys()).isEmpty();
        assertThat(delivered.await(SHORT.toMillis() * 3, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    @DisplayName("A later event should restart the window so delivery waits for the last one")
    void shouldRestartWindowOnEachEvent() throws InterruptedException {
        Duration window = Duration.ofMillis(600);
        List<List<TriggerEvent>> deliveries = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(1);
        BatchListener listener = (key, events) -> {
            deliveries.add(events);
            delivered.countDown();
        };

        TriggerEvent first = event("a-1", "SBER");
        TriggerEvent second = event("a-2", "SBER");
        long start = System.nanoTime();
        batcher.addToBatch("SBER", first, window, listener);
        Thread.sleep(360);
        batcher.addToBatch("SBER", second, window, listener);

        // the first schedule would have fired by now
        long untilFirstDeadline = window.toMillis() + 50
                - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (untilFirstDeadline > 0) {
            Thread.sleep(untilFirstDeadline);
        }
        assertThat(deliveries).isEmpty();
        assertThat(batcher.pendingCount("SBER")).isEqualTo(2);

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(deliveries).hasSize(1);
        assertThat(deliveries.get(0)).containsExactly(first, second);
    }

    @Test
    @DisplayName("A timer overtaken by flushAll should not deliver a batch recreated under the same key")
    void staleTimerShouldNotFireRecreatedBatch() {
        CapturingScheduler scheduler = new CapturingScheduler();
        DebounceBatcher capturing = new DebounceBatcher(scheduler);
        try {
            List<List<TriggerEvent>> deliveries = new ArrayList<>();
            BatchListener listener = (key, events) -> deliveries.add(events);

            TriggerEvent first = event("a-1", "SBER");
            TriggerEvent second = event("a-2", "SBER");
            capturing.addToBatch("SBER", first, 60, listener);
            capturing.flushAll(listener);
            capturing.addToBatch("SBER", second, 60, listener);

            // the first timer was already running when flushAll cancelled it
            scheduler.commands.get(0).run();

            assertThat(deliveries).hasSize(1);
            assertThat(deliveries.get(0)).containsExactly(first);
            assertThat(capturing.pendingKeys()).containsExactly("SBER");
            assertThat(capturing.pendingCount("SBER")).isEqualTo(1);
        } finally {
            capturing.close();
            scheduler.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Records every scheduled command so a test can run it out of turn. */
    private static final class CapturingScheduler extends ScheduledThreadPoolExecutor {

        private final List<Runnable> commands = new CopyOnWriteArrayList<>();

        CapturingScheduler() {
            super(1);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            commands.add(command);
            return super.schedule(command, delay, unit);
        }
    }

    private static TriggerEvent event(String alertId, String ticker) {
        return TriggerEvent.builder()
                .alertId(alertId)
                .ticker(ticker)
                .triggeredAt(Instant.parse("2026-03-02T10:00:00Z"))
                .triggerReason("test")
                .priceAtTrigger(100.0)
                .build();
    }
}
