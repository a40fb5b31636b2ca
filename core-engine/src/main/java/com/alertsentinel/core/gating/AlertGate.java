package com.alertsentinel.core.gating;

import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertStatus;
import com.alertsentinel.core.model.QuietHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Decides whether an alert may be evaluated at all.
 *
 * <h3>Checks, in order</h3>
 * <ol>
 * <li>status is {@link AlertStatus#ACTIVE}</li>
 * <li>{@code expiresAt} is not in the past</li>
 * <li>not inside the quiet-hours window</li>
 * <li>at least {@code cooldownMinutes} since the last trigger</li>
 * <li>fewer than {@code maxPerDay} triggers today</li>
 * </ol>
 * <p>
 * The first failing check decides the verdict. Local time, weekday and the
 * day boundary for the daily cap are taken in the alert's quiet-hours zone,
 * or the gate's default zone when none is configured.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertGate {

    private static final Logger LOG = LoggerFactory.getLogger(AlertGate.class);

    private final DailyTriggerCounter triggerCounter;
    private final ZoneId defaultZone;

    /**
     * @param triggerCounter source of today's trigger counts; must not be {@code null}
     * @param defaultZone    zone for alerts without a configured one; must not be {@code null}
     */
    public AlertGate(DailyTriggerCounter triggerCounter, ZoneId defaultZone) {
        this.triggerCounter = Objects.requireNonNull(triggerCounter, "triggerCounter must not be null");
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    /**
     * @param alert the alert; must not be {@code null}
     * @param now   evaluation instant; must not be {@code null}
     * @return the first failing check, or {@link GateVerdict#OPEN}
     */
    public GateVerdict check(Alert alert, Instant now) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(now, "now must not be null");

        GateVerdict verdict = firstFailure(alert, now);
        if (!verdict.isOpen()) {
            LOG.debug("Alert [{}] gated: {}", alert.getId(), verdict);
        }
        return verdict;
    }

    private GateVerdict firstFailure(Alert alert, Instant now) {
        if (alert.getStatus() != AlertStatus.ACTIVE) {
            return GateVerdict.NOT_ACTIVE;
        }
        if (alert.getExpiresAt() != null && alert.getExpiresAt().isBefore(now)) {
            return GateVerdict.EXPIRED;
        }

        QuietHours quietHours = alert.getQuietHours();
        ZoneId zone = quietHours != null ? quietHours.zoneOr(defaultZone) : defaultZone;
        ZonedDateTime local = now.atZone(zone);

        if (isInQuietHours(quietHours, local)) {
            return GateVerdict.QUIET_HOURS;
        }
        if (isInCooldown(alert, now)) {
            return GateVerdict.COOLDOWN;
        }
        if (alert.getFrequency() != null
                && triggerCounter.countOn(alert.getId(), local.toLocalDate(), zone)
                        >= alert.getFrequency().getMaxPerDay()) {
            return GateVerdict.DAILY_LIMIT;
        }
        return GateVerdict.OPEN;
    }

    /**
     * Whether {@code local} falls inside the quiet-hours window. Comparison is
     * at minute precision with both ends inclusive; a window with start after
     * end runs through midnight.
     *
     * @param quietHours the window, may be {@code null}
     * @param local      local date-time in the window's zone
     * @return {@code true} if notifications are suppressed
     */
    public static boolean isInQuietHours(QuietHours quietHours, ZonedDateTime local) {
        if (quietHours == null || !quietHours.isEnabled()) {
            return false;
        }
        if (!quietHours.appliesOn(local.getDayOfWeek())) {
            return false;
        }

        LocalTime now = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        LocalTime start = quietHours.startTime();
        LocalTime end = quietHours.endTime();

        if (start.isAfter(end)) {
            return !now.isBefore(start) || !now.isAfter(end);
        }
        return !now.isBefore(start) && !now.isAfter(end);
    }

    /**
     * @param alert the alert
     * @param now   evaluation instant
     * @return {@code true} if less than the cooldown has elapsed since the last trigger
     */
    public static boolean isInCooldown(Alert alert, Instant now) {
        if (alert.getLastTriggeredAt() == null || alert.getFrequency() == null) {
            return false;
        }
        Duration cooldown = Duration.ofMinutes(alert.getFrequency().getCooldownMinutes());
        return Duration.between(alert.getLastTriggeredAt(), now).compareTo(cooldown) < 0;
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }
}
