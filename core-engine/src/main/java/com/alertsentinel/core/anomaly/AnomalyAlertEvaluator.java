package com.alertsentinel.core.anomaly;

import com.alertsentinel.core.evaluation.AlertEvaluator;
import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.evaluation.EvaluationResult;
import com.alertsentinel.core.model.Alert;

import java.util.Objects;

/**
 * Evaluation path for {@code ANOMALY} alerts. Alerts without an anomaly
 * configuration use the defaults.
 *
 * @since 1.0.0
 */
public class AnomalyAlertEvaluator implements AlertEvaluator {

    @Override
    public EvaluationResult evaluate(Alert alert, EvaluationContext context) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(context, "context must not be null");
        return AnomalyDetector.assess(alert.effectiveAnomalyConfig(), context.getObservation(),
                context.getNews(), context.getHistory()).toResult();
    }
}
