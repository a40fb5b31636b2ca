package com.alertsentinel.core.anomaly;

import com.alertsentinel.core.model.PricePoint;

import java.util.List;
import java.util.Objects;

/**
 * Population mean and standard deviation of a price history.
 *
 * @since 1.0.0
 */
public final class PriceStatistics {

    private final double mean;
    private final double stdDev;
    private final int size;

    private PriceStatistics(double mean, double stdDev, int size) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.size = size;
    }

    /**
     * @param history price history; must not be {@code null}
     * @return statistics over every point's price
     * @throws IllegalArgumentException if {@code history} is empty
     */
    public static PriceStatistics of(List<PricePoint> history) {
        Objects.requireNonNull(history, "history must not be null");
        if (history.isEmpty()) {
            throw new IllegalArgumentException("Price statistics require at least one data point");
        }

        double sum = 0;
        for (PricePoint point : history) {
            sum += point.getPrice();
        }
        double mean = sum / history.size();

        double sumSquaredDiff = 0;
        for (PricePoint point : history) {
            double diff = point.getPrice() - mean;
            sumSquaredDiff += diff * diff;
        }
        return new PriceStatistics(mean, Math.sqrt(sumSquaredDiff / history.size()), history.size());
    }

    /**
     * Absolute z-score of {@code value}. With a zero standard deviation the
     * score is 0 for the mean itself and infinite for anything else.
     *
     * @param value the value to score
     * @return {@code |value - mean| / stdDev}
     */
    public double zScore(double value) {
        double diff = Math.abs(value - mean);
        if (stdDev == 0) {
            return diff == 0 ? 0 : Double.POSITIVE_INFINITY;
        }
        return diff / stdDev;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "PriceStatistics{mean=" + mean + ", stdDev=" + stdDev + ", size=" + size + '}';
    }
}
