package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.Condition;
import com.alertsentinel.core.model.ConditionField;
import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a single {@link Condition} against the current tick.
 *
 * <p>
 * Fail-closed: an unknown field or operator, or a field whose value is not
 * available, yields an unmatched result. None of these cases throws.
 * </p>
 *
 * <p>
 * {@link ComparisonOperator#CROSSES_ABOVE} and
 * {@link ComparisonOperator#CROSSES_BELOW} need the previous tick's value,
 * which is not part of the evaluation input; they never match.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    /** Absolute tolerance for {@code EQUAL} / {@code NOT_EQUAL}. */
    static final double EQUALITY_TOLERANCE = 0.01;

    private ConditionEvaluator() {
        // utility class, not instantiable
    }

    /**
     * @param condition   the condition; must not be {@code null}
     * @param observation current market data; must not be {@code null}
     * @param news        current news, may be {@code null}
     * @return matched/unmatched verdict with a description
     */
    public static ConditionResult evaluate(Condition condition, MarketObservation observation, NewsContext news) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(observation, "observation must not be null");

        Optional<ConditionField> field = ConditionField.fromName(condition.getField());
        if (field.isEmpty()) {
            LOG.warn("Unknown condition field '{}' on {}; treating condition as unmatched",
                    condition.getField(), observation.getTicker());
            return ConditionResult.unmatched("Unknown field '" + condition.getField() + "'");
        }

        Optional<ComparisonOperator> operator = ComparisonOperator.fromName(condition.getOperator());
        if (operator.isEmpty()) {
            LOG.warn("Unknown condition operator '{}' on {}; treating condition as unmatched",
                    condition.getOperator(), observation.getTicker());
            return ConditionResult.unmatched(
                    "Unknown operator '" + condition.getOperator() + "' for " + field.get());
        }

        Optional<Double> actual = FieldResolver.resolve(field.get(), observation, news);
        if (actual.isEmpty()) {
            LOG.trace("Field {} not available for {}; condition unmatched", field.get(), observation.getTicker());
            return ConditionResult.unmatched(field.get() + " data unavailable");
        }

        boolean matched = compare(actual.get(), operator.get(), condition.getValue());
        String description = String.format(Locale.ROOT, "%s %s %s (actual: %.2f)",
                field.get(), operator.get().getSymbol(), plain(condition.getValue()), actual.get());
        return ConditionResult.of(matched, description);
    }

    /**
     * Compare {@code actual} with {@code threshold}.
     *
     * @param actual    resolved field value
     * @param operator  the operator; must not be {@code null}
     * @param threshold configured threshold
     * @return {@code true} if the comparison holds
     */
    public static boolean compare(double actual, ComparisonOperator operator, double threshold) {
        return switch (Objects.requireNonNull(operator, "operator must not be null")) {
            case GREATER_THAN -> actual > threshold;
            case LESS_THAN -> actual < threshold;
            case GREATER_THAN_EQUAL -> actual >= threshold;
            case LESS_THAN_EQUAL -> actual <= threshold;
            case EQUAL -> Math.abs(actual - threshold) < EQUALITY_TOLERANCE;
            case NOT_EQUAL -> Math.abs(actual - threshold) >= EQUALITY_TOLERANCE;
            case PERCENTAGE_CHANGE -> Math.abs(actual) >= threshold;
            // TODO: match on a sign change of (value - threshold) once the previous tick's value is threaded in
            case CROSSES_ABOVE, CROSSES_BELOW -> false;
        };
    }

    private static String plain(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
