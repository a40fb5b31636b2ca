package com.alertsentinel.core.gating;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DailyTriggerCounter} keeping recent trigger instants in memory.
 *
 * <p>
 * Instants older than {@value #RETENTION_HOURS} hours before the newest
 * recorded trigger of an alert are evicted on {@link #record}, which keeps
 * every calendar day in any zone countable. Thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryDailyTriggerCounter implements DailyTriggerCounter {

    static final long RETENTION_HOURS = 50;

    private final Map<String, Deque<Instant>> triggers = new ConcurrentHashMap<>();

    @Override
    public int countOn(String alertId, LocalDate day, ZoneId zone) {
        Objects.requireNonNull(day, "day must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        Deque<Instant> instants = triggers.get(alertId);
        if (instants == null) {
            return 0;
        }
        synchronized (instants) {
            return (int) instants.stream()
                    .filter(t -> LocalDate.ofInstant(t, zone).equals(day))
                    .count();
        }
    }

    @Override
    public void record(String alertId, Instant triggeredAt) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        Objects.requireNonNull(triggeredAt, "triggeredAt must not be null");
        Deque<Instant> instants = triggers.computeIfAbsent(alertId, id -> new ArrayDeque<>());
        synchronized (instants) {
            instants.addLast(triggeredAt);
            Instant horizon = triggeredAt.minus(Duration.ofHours(RETENTION_HOURS));
            instants.removeIf(t -> t.isBefore(horizon));
        }
    }

    /**
     * Forget every recorded trigger of {@code alertId}.
     *
     * @param alertId the alert
     */
    public void reset(String alertId) {
        triggers.remove(alertId);
    }
}
