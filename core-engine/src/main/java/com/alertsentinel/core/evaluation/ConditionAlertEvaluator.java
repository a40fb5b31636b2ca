package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.Alert;

import java.util.Objects;

/**
 * Evaluation path for {@code THRESHOLD} and {@code MULTI_CONDITION} alerts.
 *
 * @since 1.0.0
 */
public class ConditionAlertEvaluator implements AlertEvaluator {

    @Override
    public EvaluationResult evaluate(Alert alert, EvaluationContext context) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(context, "context must not be null");
        return ConditionGroupEvaluator.evaluate(
                alert.getConditionGroups(), context.getObservation(), context.getNews());
    }
}
