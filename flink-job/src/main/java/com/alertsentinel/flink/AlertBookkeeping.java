package com.alertsentinel.flink;

import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertStatus;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-alert fields kept in Flink keyed state, so that cooldown,
 * daily cap, snooze and expiry survive restarts while the alert definitions
 * themselves are reloaded from configuration.
 *
 * <p>
 * Flink POJO: public no-arg constructor plus getters and setters.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertBookkeeping implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Trigger instants older than this are not needed for any day in any zone. */
    static final Duration TRIGGER_RETENTION = Duration.ofHours(50);

    private AlertStatus status;
    private Instant lastTriggeredAt;
    private int triggeredCount;
    private Instant snoozedUntil;
    private List<Instant> recentTriggers = new ArrayList<>();

    public AlertBookkeeping() {
    }

    /**
     * @param alert alert to snapshot
     * @return bookkeeping holding the alert's current mutable fields
     */
    public static AlertBookkeeping of(Alert alert) {
        AlertBookkeeping bookkeeping = new AlertBookkeeping();
        bookkeeping.capture(alert);
        return bookkeeping;
    }

    /**
     * Copy the alert's mutable fields into this snapshot. Recorded trigger
     * instants are kept.
     */
    public void capture(Alert alert) {
        this.status = alert.getStatus();
        this.lastTriggeredAt = alert.getLastTriggeredAt();
        this.triggeredCount = alert.getTriggeredCount();
        this.snoozedUntil = alert.getSnoozedUntil();
    }

    /**
     * Overwrite the alert's mutable fields with this snapshot.
     */
    public void applyTo(Alert alert) {
        if (status != null) {
            alert.setStatus(status);
        }
        alert.setLastTriggeredAt(lastTriggeredAt);
        alert.setTriggeredCount(triggeredCount);
        alert.setSnoozedUntil(snoozedUntil);
    }

    /**
     * @return triggers recorded on {@code day} in {@code zone}
     */
    public int countOn(LocalDate day, ZoneId zone) {
        return (int) recentTriggers.stream()
                .filter(t -> LocalDate.ofInstant(t, zone).equals(day))
                .count();
    }

    /**
     * Remember a trigger and evict instants past retention.
     */
    public void record(Instant triggeredAt) {
        recentTriggers.add(triggeredAt);
        Instant horizon = triggeredAt.minus(TRIGGER_RETENTION);
        recentTriggers.removeIf(t -> t.isBefore(horizon));
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    public Instant getLastTriggeredAt() {
        return lastTriggeredAt;
    }

    public void setLastTriggeredAt(Instant lastTriggeredAt) {
        this.lastTriggeredAt = lastTriggeredAt;
    }

    public int getTriggeredCount() {
        return triggeredCount;
    }

    public void setTriggeredCount(int triggeredCount) {
        this.triggeredCount = triggeredCount;
    }

    public Instant getSnoozedUntil() {
        return snoozedUntil;
    }

    public void setSnoozedUntil(Instant snoozedUntil) {
        this.snoozedUntil = snoozedUntil;
    }

    public List<Instant> getRecentTriggers() {
        return recentTriggers;
    }

    public void setRecentTriggers(List<Instant> recentTriggers) {
        this.recentTriggers = recentTriggers != null ? new ArrayList<>(recentTriggers) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AlertBookkeeping{" +
                "status=" + status +
                ", lastTriggeredAt=" + lastTriggeredAt +
                ", triggeredCount=" + triggeredCount +
                ", snoozedUntil=" + snoozedUntil +
                ", recentTriggers=" + recentTriggers.size() +
                '}';
    }
}
