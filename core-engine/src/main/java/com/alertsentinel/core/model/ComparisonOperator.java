package com.alertsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators supported by a {@link Condition}.
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_EQUAL("≥"),
    LESS_THAN_EQUAL("≤"),
    EQUAL("="),
    NOT_EQUAL("≠"),
    /** Magnitude of the actual value against the threshold: {@code |actual| >= threshold}. */
    PERCENTAGE_CHANGE("%Δ"),
    CROSSES_ABOVE("↑"),
    CROSSES_BELOW("↓");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return display symbol used in trigger descriptions
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Look up an operator by its configured name (case-insensitive).
     *
     * @param name operator name, may be {@code null}
     * @return the operator, or empty if the name is unknown
     */
    public static Optional<ComparisonOperator> fromName(String name) {
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
