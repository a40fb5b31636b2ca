package com.alertsentinel.core.anomaly;

import com.alertsentinel.core.model.PricePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PriceStatistics}.
 */
class PriceStatisticsTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:00Z");

    @Test
    @DisplayName("Should compute population mean and standard deviation")
    void shouldComputePopulationStatistics() {
        PriceStatistics stats = PriceStatistics.of(points(2, 4, 4, 4, 5, 5, 7, 9));

        assertThat(stats.getMean()).isEqualTo(5.0);
        assertThat(stats.getStdDev()).isEqualTo(2.0);
        assertThat(stats.getSize()).isEqualTo(8);
        assertThat(stats.zScore(1)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("Flat history should score any other price as an infinite outlier")
    void flatHistoryShouldScoreDeviationAsInfinite() {
        PriceStatistics stats = PriceStatistics.of(points(50, 50, 50));

        assertThat(stats.getStdDev()).isZero();
        assertThat(stats.zScore(50)).isZero();
        assertThat(stats.zScore(50.01)).isInfinite();
    }

    @Test
    @DisplayName("Should reject an empty history")
    void shouldRejectEmptyHistory() {
        assertThatThrownBy(() -> PriceStatistics.of(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<PricePoint> points(double... prices) {
        return Arrays.stream(prices)
                .mapToObj(p -> new PricePoint(NOW, p, 0))
                .toList();
    }
}
