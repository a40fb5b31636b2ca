package com.alertsentinel.flink;

import com.alertsentinel.core.gating.DailyTriggerCounter;
import org.apache.flink.api.common.state.MapState;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * {@link DailyTriggerCounter} over the current key's bookkeeping map state.
 * Only valid while Flink has a current key set, i.e. inside
 * {@code processElement}.
 */
class KeyedTriggerCounter implements DailyTriggerCounter {

    private final MapState<String, AlertBookkeeping> bookkeeping;

    KeyedTriggerCounter(MapState<String, AlertBookkeeping> bookkeeping) {
        this.bookkeeping = Objects.requireNonNull(bookkeeping, "bookkeeping state must not be null");
    }

    @Override
    public int countOn(String alertId, LocalDate day, ZoneId zone) {
        AlertBookkeeping entry = read(alertId);
        return entry == null ? 0 : entry.countOn(day, zone);
    }

    @Override
    public void record(String alertId, Instant triggeredAt) {
        try {
            AlertBookkeeping entry = bookkeeping.get(alertId);
            if (entry == null) {
                entry = new AlertBookkeeping();
            }
            entry.record(triggeredAt);
            bookkeeping.put(alertId, entry);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to record trigger of alert " + alertId, e);
        }
    }

    private AlertBookkeeping read(String alertId) {
        try {
            return bookkeeping.get(alertId);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read trigger history of alert " + alertId, e);
        }
    }
}
