package com.alertsentinel.core.batch;

import com.alertsentinel.core.model.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Trailing-edge debouncer that groups trigger events per key.
 *
 * <p>
 * Each {@link #addToBatch} appends the event and restarts the key's timer, so
 * a batch is delivered once {@code window} has passed with no new event for
 * that key. A steady stream of events postpones delivery indefinitely.
 * </p>
 *
 * <h3>Delivery guarantees</h3>
 * <ul>
 * <li>every added event is delivered exactly once, by its timer or by
 * {@link #flushAll}</li>
 * <li>the listener is invoked outside the internal lock; an exception it
 * throws is logged and never leaves pending state behind</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All methods are thread-safe. Per-key state is guarded by one lock. Every
 * arm takes a fresh number from one batcher-wide generation sequence, so a
 * timer that was already running when its schedule was replaced or flushed
 * delivers nothing, even to a batch recreated later under the same key.
 * </p>
 *
 * @since 1.0.0
 */
public class DebounceBatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DebounceBatcher.class);

    private final Object lock = new Object();
    private final Map<String, PendingBatch> batches = new HashMap<>();
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    /** Guarded by {@link #lock}; never reused across batches. */
    private long generationSequence;

    /**
     * Create a batcher with its own single daemon timer thread.
     */
    public DebounceBatcher() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "alert-batcher");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    /**
     * Create a batcher on a caller-managed scheduler. {@link #close()} does
     * not shut it down.
     *
     * @param scheduler timer source; must not be {@code null}
     */
    public DebounceBatcher(ScheduledExecutorService scheduler) {
        this(scheduler, false);
    }

    private DebounceBatcher(ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.ownsScheduler = ownsScheduler;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Append {@code event} to the batch for {@code key} and restart its timer.
     *
     * @param key           batch key; must not be {@code null}
     * @param event         event to batch; must not be {@code null}
     * @param windowMinutes quiet period in minutes; must be positive
     * @param listener      receiver of the batch when the timer fires
     */
    public void addToBatch(String key, TriggerEvent event, int windowMinutes, BatchListener listener) {
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("windowMinutes must be > 0, got: " + windowMinutes);
        }
        addToBatch(key, event, Duration.ofMinutes(windowMinutes), listener);
    }

    /**
     * Variant of {@link #addToBatch(String, TriggerEvent, int, BatchListener)}
     * taking an arbitrary window.
     */
    public void addToBatch(String key, TriggerEvent event, Duration window, BatchListener listener) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }

        synchronized (lock) {
            PendingBatch batch = batches.computeIfAbsent(key, k -> new PendingBatch());
            batch.events.add(event);
            batch.listener = listener;
            batch.generation = ++generationSequence;
            if (batch.timer != null) {
                batch.timer.cancel(false);
            }
            long generation = batch.generation;
            batch.timer = scheduler.schedule(() -> fire(key, generation),
                    window.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Batch [{}] now holds {} event(s); fires in {}", key, batch.events.size(), window);
        }
    }

    /**
     * Deliver every pending batch to {@code listener} immediately, once per
     * key, and clear all state.
     *
     * @param listener receiver of the flushed batches; must not be {@code null}
     */
    public void flushAll(BatchListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        Map<String, List<TriggerEvent>> drained = new HashMap<>();
        synchronized (lock) {
            for (Map.Entry<String, PendingBatch> entry : batches.entrySet()) {
                PendingBatch batch = entry.getValue();
                if (batch.timer != null) {
                    batch.timer.cancel(false);
                }
                drained.put(entry.getKey(), batch.events);
            }
            batches.clear();
        }
        if (!drained.isEmpty()) {
            LOG.info("Flushing {} pending batch(es)", drained.size());
        }
        drained.forEach((key, events) -> deliver(key, events, listener));
    }

    /**
     * @return keys with a batch pending
     */
    public Set<String> pendingKeys() {
        synchronized (lock) {
            return Set.copyOf(batches.keySet());
        }
    }

    /**
     * @param key batch key
     * @return number of events pending for {@code key}
     */
    public int pendingCount(String key) {
        synchronized (lock) {
            PendingBatch batch = batches.get(key);
            return batch == null ? 0 : batch.events.size();
        }
    }

    /**
     * Cancel every timer and drop pending events without delivering them.
     * Call {@link #flushAll} first to keep them. Shuts the scheduler down if
     * this batcher created it.
     */
    @Override
    public void close() {
        int dropped;
        synchronized (lock) {
            dropped = batches.size();
            batches.values().forEach(b -> {
                if (b.timer != null) {
                    b.timer.cancel(false);
                }
            });
            batches.clear();
        }
        if (dropped > 0) {
            LOG.warn("Closing batcher with {} undelivered batch(es)", dropped);
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void fire(String key, long generation) {
        List<TriggerEvent> events;
        BatchListener listener;
        synchronized (lock) {
            PendingBatch batch = batches.get(key);
            if (batch == null || batch.generation != generation) {
                return;
            }
            batches.remove(key);
            events = batch.events;
            listener = batch.listener;
        }
        deliver(key, events, listener);
    }

    private static void deliver(String key, List<TriggerEvent> events, BatchListener listener) {
        try {
            listener.onReady(key, List.copyOf(events));
        } catch (RuntimeException e) {
            LOG.error("Batch listener failed for [{}] with {} event(s)", key, events.size(), e);
        }
    }

    private static final class PendingBatch {
        private final List<TriggerEvent> events = new ArrayList<>();
        private BatchListener listener;
        private ScheduledFuture<?> timer;
        private long generation;
    }
}
