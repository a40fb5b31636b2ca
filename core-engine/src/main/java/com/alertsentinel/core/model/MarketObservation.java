package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of one ticker's market data for a single evaluation tick.
 *
 * <p>
 * Price, previous close and volume are always present. Indicator fields are
 * optional and exposed as {@link Optional}; an absent value must never be read
 * as zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class MarketObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ticker;
    private final double price;
    private final double previousClose;
    private final double volume;
    private final Double averageVolume;
    private final Double peRatio;
    private final Double rsi;
    private final Double movingAvg50;
    private final Double movingAvg200;
    private final Double marketCap;
    private final Instant timestamp;

    private MarketObservation(Builder b) {
        this.ticker = Objects.requireNonNull(b.ticker, "ticker must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.price = b.price;
        this.previousClose = b.previousClose;
        this.volume = b.volume;
        this.averageVolume = b.averageVolume;
        this.peRatio = b.peRatio;
        this.rsi = b.rsi;
        this.movingAvg50 = b.movingAvg50;
        this.movingAvg200 = b.movingAvg200;
        this.marketCap = b.marketCap;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder. {@code ticker} and {@code timestamp} are required.
     */
    public static class Builder {
        private String ticker;
        private double price;
        private double previousClose;
        private double volume;
        private Double averageVolume;
        private Double peRatio;
        private Double rsi;
        private Double movingAvg50;
        private Double movingAvg200;
        private Double marketCap;
        private Instant timestamp;

        public Builder ticker(String ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder price(double price) {
            this.price = price;
            return this;
        }

        public Builder previousClose(double previousClose) {
            this.previousClose = previousClose;
            return this;
        }

        public Builder volume(double volume) {
            this.volume = volume;
            return this;
        }

        public Builder averageVolume(Double averageVolume) {
            this.averageVolume = averageVolume;
            return this;
        }

        public Builder peRatio(Double peRatio) {
            this.peRatio = peRatio;
            return this;
        }

        public Builder rsi(Double rsi) {
            this.rsi = rsi;
            return this;
        }

        public Builder movingAvg50(Double movingAvg50) {
            this.movingAvg50 = movingAvg50;
            return this;
        }

        public Builder movingAvg200(Double movingAvg200) {
            this.movingAvg200 = movingAvg200;
            return this;
        }

        public Builder marketCap(Double marketCap) {
            this.marketCap = marketCap;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * @return the observation
         * @throws NullPointerException if {@code ticker} or {@code timestamp} is missing
         */
        public MarketObservation build() {
            return new MarketObservation(this);
        }
    }

    public String getTicker() {
        return ticker;
    }

    public double getPrice() {
        return price;
    }

    public double getPreviousClose() {
        return previousClose;
    }

    public double getVolume() {
        return volume;
    }

    public Optional<Double> getAverageVolume() {
        return Optional.ofNullable(averageVolume);
    }

    public Optional<Double> getPeRatio() {
        return Optional.ofNullable(peRatio);
    }

    public Optional<Double> getRsi() {
        return Optional.ofNullable(rsi);
    }

    public Optional<Double> getMovingAvg50() {
        return Optional.ofNullable(movingAvg50);
    }

    public Optional<Double> getMovingAvg200() {
        return Optional.ofNullable(movingAvg200);
    }

    public Optional<Double> getMarketCap() {
        return Optional.ofNullable(marketCap);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "MarketObservation{" +
                "ticker='" + ticker + '\'' +
                ", price=" + price +
                ", previousClose=" + previousClose +
                ", volume=" + volume +
                ", timestamp=" + timestamp +
                '}';
    }
}
