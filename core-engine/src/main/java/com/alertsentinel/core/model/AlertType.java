package com.alertsentinel.core.model;

/**
 * Evaluation path taken for an {@link Alert}.
 *
 * <ul>
 * <li>{@code THRESHOLD}: single comparison, e.g. price &gt; X</li>
 * <li>{@code MULTI_CONDITION}: one or more AND/OR condition groups</li>
 * <li>{@code NEWS_TRIGGERED}: negative news sentiment</li>
 * <li>{@code ANOMALY}: price shock, volume shock or statistical outlier</li>
 * </ul>
 *
 * <p>
 * {@code THRESHOLD} and {@code MULTI_CONDITION} share the condition-group
 * evaluator; the distinction only matters to the rule-authoring surface.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertType {
    THRESHOLD,
    MULTI_CONDITION,
    NEWS_TRIGGERED,
    ANOMALY
}
