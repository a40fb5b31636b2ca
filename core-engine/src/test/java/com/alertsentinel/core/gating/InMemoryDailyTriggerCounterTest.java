package com.alertsentinel.core.gating;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryDailyTriggerCounter}.
 */
class InMemoryDailyTriggerCounterTest {

    private final InMemoryDailyTriggerCounter counter = new InMemoryDailyTriggerCounter();

    @Test
    @DisplayName("Should count triggers per alert and calendar day")
    void shouldCountPerAlertAndDay() {
        counter.record("a", Instant.parse("2026-03-02T09:00:00Z"));
        counter.record("a", Instant.parse("2026-03-02T15:00:00Z"));
        counter.record("b", Instant.parse("2026-03-02T15:00:00Z"));

        assertThat(counter.countOn("a", LocalDate.of(2026, 3, 2), ZoneOffset.UTC)).isEqualTo(2);
        assertThat(counter.countOn("b", LocalDate.of(2026, 3, 2), ZoneOffset.UTC)).isEqualTo(1);
        assertThat(counter.countOn("c", LocalDate.of(2026, 3, 2), ZoneOffset.UTC)).isZero();
    }

    @Test
    @DisplayName("Day boundaries should follow the requested zone")
    void shouldUseZoneForDayBoundaries() {
        counter.record("a", Instant.parse("2026-03-02T22:30:00Z"));

        assertThat(counter.countOn("a", LocalDate.of(2026, 3, 2), ZoneOffset.UTC)).isEqualTo(1);
        assertThat(counter.countOn("a", LocalDate.of(2026, 3, 3), ZoneId.of("Europe/Moscow"))).isEqualTo(1);
    }

    @Test
    @DisplayName("Old triggers should be evicted and reset should forget an alert")
    void shouldEvictAndReset() {
        counter.record("a", Instant.parse("2026-03-01T09:00:00Z"));
        counter.record("a", Instant.parse("2026-03-04T09:00:00Z"));

        assertThat(counter.countOn("a", LocalDate.of(2026, 3, 1), ZoneOffset.UTC)).isZero();

        counter.reset("a");
        assertThat(counter.countOn("a", LocalDate.of(2026, 3, 4), ZoneOffset.UTC)).isZero();
    }
}
