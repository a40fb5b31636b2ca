package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One historical price sample used for statistical outlier detection.
 *
 * @since 1.0.0
 */
public final class PricePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double price;
    private final double volume;

    public PricePoint(Instant timestamp, double price, double volume) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.price = price;
        this.volume = volume;
    }

    /**
     * @param observation a market observation
     * @return the price sample taken from {@code observation}
     */
    public static PricePoint of(MarketObservation observation) {
        return new PricePoint(observation.getTimestamp(), observation.getPrice(), observation.getVolume());
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getPrice() {
        return price;
    }

    public double getVolume() {
        return volume;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PricePoint that))
            return false;
        return Double.compare(price, that.price) == 0
                && Double.compare(volume, that.volume) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, price, volume);
    }

    @Override
    public String toString() {
        return "PricePoint{" + timestamp + ", price=" + price + ", volume=" + volume + '}';
    }
}
