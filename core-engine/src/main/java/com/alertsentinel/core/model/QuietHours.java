package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recurring do-not-disturb window of an {@link Alert}.
 *
 * <p>
 * Times are 24h {@code HH:mm} strings. A window whose start is after its end
 * runs through midnight, e.g. {@code 22:00} to {@code 08:00}. The window only
 * applies on the configured {@link #getDays() days}.
 * </p>
 *
 * <p>
 * {@code timezone} is the IANA zone used to derive the local time and the
 * weekday; when unset the engine's default zone is used.
 * </p>
 *
 * @since 1.0.0
 */
public class QuietHours implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");

    private boolean enabled;
    private String start = "22:00";
    private String end = "08:00";
    private Set<DayOfWeek> days = EnumSet.allOf(DayOfWeek.class);
    private String timezone;

    /** No-arg constructor required by SnakeYAML. */
    public QuietHours() {
    }

    /**
     * @param start start time, {@code HH:mm}
     * @param end   end time, {@code HH:mm}
     * @param days  days the window applies on; all days when empty
     * @return an enabled quiet-hours window
     */
    public static QuietHours between(String start, String end, DayOfWeek... days) {
        QuietHours quietHours = new QuietHours();
        quietHours.setEnabled(true);
        quietHours.setStart(start);
        quietHours.setEnd(end);
        if (days.length > 0) {
            quietHours.setDays(Arrays.asList(days));
        }
        return quietHours;
    }

    void collectErrors(String owner, List<String> errors) {
        if (start == null || !TIME_PATTERN.matcher(start).matches()) {
            errors.add("Alert '" + owner + "' quietHours 'start' must be HH:mm, got: " + start);
        }
        if (end == null || !TIME_PATTERN.matcher(end).matches()) {
            errors.add("Alert '" + owner + "' quietHours 'end' must be HH:mm, got: " + end);
        }
        if (timezone != null && !timezone.isBlank()) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                errors.add("Alert '" + owner + "' quietHours 'timezone' is not a valid zone: " + timezone);
            }
        }
    }

    /**
     * @return parsed start time
     * @throws java.time.format.DateTimeParseException if {@code start} is malformed
     */
    public LocalTime startTime() {
        return LocalTime.parse(start);
    }

    /**
     * @return parsed end time
     * @throws java.time.format.DateTimeParseException if {@code end} is malformed
     */
    public LocalTime endTime() {
        return LocalTime.parse(end);
    }

    /**
     * @param fallback zone to use when none is configured
     * @return the configured zone, or {@code fallback}
     */
    public ZoneId zoneOr(ZoneId fallback) {
        return timezone == null || timezone.isBlank() ? fallback : ZoneId.of(timezone);
    }

    /**
     * @param day a weekday
     * @return {@code true} if the window applies on {@code day}
     */
    public boolean appliesOn(DayOfWeek day) {
        return days.contains(day);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    /**
     * @return copy of the configured days, in weekday order
     */
    public List<DayOfWeek> getDays() {
        return new ArrayList<>(days);
    }

    /**
     * @param days the days the window applies on; {@code null} means none
     */
    public void setDays(List<DayOfWeek> days) {
        this.days = days == null || days.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(days);
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    @Override
    public String toString() {
        return "QuietHours{" +
                "enabled=" + enabled +
                ", start='" + start + '\'' +
                ", end='" + end + '\'' +
                ", days=" + days +
                ", timezone='" + timezone + '\'' +
                '}';
    }
}
