package com.alertsentinel.core.gating;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Source of per-alert trigger counts for the daily cap.
 *
 * <p>
 * Normally backed by trigger-history persistence owned by the caller. The
 * engine records every trigger it creates through {@link #record}; an
 * implementation whose store is fed elsewhere may ignore that call.
 * </p>
 *
 * @since 1.0.0
 */
public interface DailyTriggerCounter {

    /**
     * @param alertId the alert
     * @param day     calendar day in {@code zone}
     * @param zone    zone that defines the day's boundaries
     * @return number of triggers of {@code alertId} on {@code day}
     */
    int countOn(String alertId, LocalDate day, ZoneId zone);

    /**
     * @param alertId     the alert that fired
     * @param triggeredAt when it fired
     */
    void record(String alertId, Instant triggeredAt);
}
