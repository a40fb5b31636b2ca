package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.ConditionField;
import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Extracts the value of a {@link ConditionField} from the current tick.
 *
 * <p>
 * Returns empty when the value is not available: the indicator was not
 * supplied, a ratio would divide by zero, or the result is not finite.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldResolver {

    private FieldResolver() {
        // utility class, not instantiable
    }

    /**
     * @param field       the field; must not be {@code null}
     * @param observation current market data; must not be {@code null}
     * @param news        current news, may be {@code null}
     * @return the value, or empty if unavailable
     */
    public static Optional<Double> resolve(ConditionField field, MarketObservation observation, NewsContext news) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(observation, "observation must not be null");

        Optional<Double> value = switch (field) {
            case PRICE -> Optional.of(observation.getPrice());
            case PRICE_CHANGE -> priceChangePercent(observation);
            case VOLUME -> Optional.of(observation.getVolume());
            case VOLUME_RATIO -> observation.getAverageVolume()
                    .filter(avg -> avg != 0)
                    .map(avg -> observation.getVolume() / avg);
            case PE_RATIO -> observation.getPeRatio();
            case RSI -> observation.getRsi();
            case MOVING_AVG_50 -> observation.getMovingAvg50();
            case MOVING_AVG_200 -> observation.getMovingAvg200();
            case NEWS_SENTIMENT -> news != null ? news.getAverageSentiment() : Optional.empty();
            case MARKET_CAP -> observation.getMarketCap();
        };
        return value.filter(Double::isFinite);
    }

    /**
     * @param observation current market data
     * @return {@code (price - previousClose) × 100 / previousClose}, or empty
     *         when the previous close is zero
     */
    public static Optional<Double> priceChangePercent(MarketObservation observation) {
        double previousClose = observation.getPreviousClose();
        if (previousClose == 0) {
            return Optional.empty();
        }
        return Optional.of((observation.getPrice() - previousClose) * 100 / previousClose);
    }
}
