package com.alertsentinel.core.engine;

import com.alertsentinel.core.anomaly.AnomalyAlertEvaluator;
import com.alertsentinel.core.config.SentimentSettings;
import com.alertsentinel.core.evaluation.AlertEvaluator;
import com.alertsentinel.core.evaluation.ConditionAlertEvaluator;
import com.alertsentinel.core.evaluation.NewsAlertEvaluator;
import com.alertsentinel.core.model.AlertType;
import com.alertsentinel.core.sentiment.SentimentAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that creates the {@link AlertEvaluator} for each {@link AlertType}.
 *
 * <p>
 * This is the single point of extension when adding a new alert type: add
 * the enum constant and map it here. The switch is exhaustive, so the
 * compiler flags a type without an evaluator.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluatorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluatorFactory.class);

    private EvaluatorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the evaluator for one alert type.
     *
     * @param type     the alert type; must not be {@code null}
     * @param settings sentiment lexicon and threshold; must not be {@code null}
     * @return the evaluator for {@code type}
     */
    public static AlertEvaluator create(AlertType type, SentimentSettings settings) {
        Objects.requireNonNull(type, "AlertType must not be null");
        Objects.requireNonNull(settings, "SentimentSettings must not be null");

        return switch (type) {
            case THRESHOLD, MULTI_CONDITION -> new ConditionAlertEvaluator();
            case NEWS_TRIGGERED -> new NewsAlertEvaluator(
                    SentimentAnalyzer.from(settings), settings.getTriggerThreshold());
            case ANOMALY -> new AnomalyAlertEvaluator();
        };
    }

    /**
     * Create one evaluator per alert type. Condition-based types share an
     * instance.
     *
     * @param settings sentiment lexicon and threshold; must not be {@code null}
     * @return unmodifiable map covering every {@link AlertType}
     */
    public static Map<AlertType, AlertEvaluator> createAll(SentimentSettings settings) {
        Objects.requireNonNull(settings, "SentimentSettings must not be null");
        Map<AlertType, AlertEvaluator> evaluators = new EnumMap<>(AlertType.class);
        AlertEvaluator conditions = new ConditionAlertEvaluator();
        for (AlertType type : AlertType.values()) {
            evaluators.put(type, type == AlertType.THRESHOLD || type == AlertType.MULTI_CONDITION
                    ? conditions
                    : create(type, settings));
        }
        LOG.info("Created evaluators for {} alert type(s)", evaluators.size());
        return Collections.unmodifiableMap(evaluators);
    }
}
