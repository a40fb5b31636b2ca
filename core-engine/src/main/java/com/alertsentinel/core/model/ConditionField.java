package com.alertsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Numeric fields a {@link Condition} can compare against.
 *
 * <p>
 * Values are extracted by
 * {@link com.alertsentinel.core.evaluation.FieldResolver}; every constant must
 * be handled there.
 * </p>
 *
 * @since 1.0.0
 */
public enum ConditionField {
    PRICE,
    /** Percentage change against the previous close. */
    PRICE_CHANGE,
    VOLUME,
    /** Current volume divided by average volume. */
    VOLUME_RATIO,
    PE_RATIO,
    RSI,
    MOVING_AVG_50,
    MOVING_AVG_200,
    NEWS_SENTIMENT,
    MARKET_CAP;

    /**
     * Look up a field by its configured name (case-insensitive).
     *
     * @param name field name, may be {@code null}
     * @return the field, or empty if the name is unknown
     */
    public static Optional<ConditionField> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
