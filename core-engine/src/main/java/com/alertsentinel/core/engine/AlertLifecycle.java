package com.alertsentinel.core.engine;

import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The one mutation path for an alert's {@code status} outside of triggering.
 *
 * <p>
 * User actions (snooze, dismiss, toggle) and engine housekeeping (expiry,
 * resuming an elapsed snooze) all go through here so the bookkeeping fields
 * stay consistent.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertLifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLifecycle.class);

    private AlertLifecycle() {
        // utility class, not instantiable
    }

    /**
     * Suspend the alert for {@code hours}.
     *
     * @param alert the alert
     * @param hours snooze length; must be positive
     * @param now   current instant
     * @throws IllegalArgumentException if {@code hours} is not positive
     */
    public static void snooze(Alert alert, int hours, Instant now) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (hours <= 0) {
            throw new IllegalArgumentException("Snooze hours must be > 0, got: " + hours);
        }
        alert.setStatus(AlertStatus.SNOOZED);
        alert.setSnoozedUntil(now.plus(Duration.ofHours(hours)));
        LOG.info("Alert [{}] snoozed until {}", alert.getId(), alert.getSnoozedUntil());
    }

    /**
     * Reactivate a snoozed alert whose snooze has elapsed.
     *
     * @return {@code true} if the alert was resumed
     */
    public static boolean resumeIfDue(Alert alert, Instant now) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (alert.getStatus() != AlertStatus.SNOOZED) {
            return false;
        }
        Instant until = alert.getSnoozedUntil();
        if (until != null && until.isAfter(now)) {
            return false;
        }
        alert.setStatus(AlertStatus.ACTIVE);
        alert.setSnoozedUntil(null);
        LOG.debug("Alert [{}] resumed from snooze", alert.getId());
        return true;
    }

    public static void dismiss(Alert alert) {
        transition(alert, AlertStatus.DISMISSED);
        alert.setSnoozedUntil(null);
    }

    public static void disable(Alert alert) {
        transition(alert, AlertStatus.DISABLED);
        alert.setSnoozedUntil(null);
    }

    /**
     * Reactivate a disabled, dismissed or snoozed alert. Expired alerts stay
     * expired.
     *
     * @throws IllegalStateException if the alert has expired
     */
    public static void enable(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (alert.getStatus() == AlertStatus.EXPIRED) {
            throw new IllegalStateException("Alert '" + alert.getId() + "' has expired and cannot be enabled");
        }
        transition(alert, AlertStatus.ACTIVE);
        alert.setSnoozedUntil(null);
    }

    /**
     * Flip between {@code ACTIVE} and {@code DISABLED}.
     *
     * @return the new status
     */
    public static AlertStatus toggle(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (alert.getStatus() == AlertStatus.ACTIVE) {
            disable(alert);
        } else {
            enable(alert);
        }
        return alert.getStatus();
    }

    public static void expire(Alert alert) {
        transition(alert, AlertStatus.EXPIRED);
    }

    private static void transition(Alert alert, AlertStatus target) {
        Objects.requireNonNull(alert, "alert must not be null");
        AlertStatus previous = alert.getStatus();
        alert.setStatus(target);
        if (previous != target) {
            LOG.info("Alert [{}] {} -> {}", alert.getId(), previous, target);
        }
    }
}
