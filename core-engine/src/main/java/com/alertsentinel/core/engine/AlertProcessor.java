package com.alertsentinel.core.engine;

import com.alertsentinel.core.evaluation.AlertEvaluator;
import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.evaluation.EvaluationResult;
import com.alertsentinel.core.gating.AlertGate;
import com.alertsentinel.core.gating.DailyTriggerCounter;
import com.alertsentinel.core.gating.GateVerdict;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertType;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.model.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one alert through gate, evaluation and trigger creation.
 *
 * <p>
 * On a trigger the processor updates {@code lastTriggeredAt} and
 * {@code triggeredCount} on the alert and records the trigger with the
 * {@link DailyTriggerCounter}. An {@code ACTIVE} alert found past its expiry
 * is marked {@code EXPIRED}. Exceptions from an evaluator propagate; callers
 * isolate failures per alert.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(AlertProcessor.class);

    private final Map<AlertType, AlertEvaluator> evaluators;
    private final AlertGate gate;
    private final DailyTriggerCounter triggerCounter;

    /**
     * @param evaluators     evaluator per alert type; must not be {@code null}
     * @param triggerCounter daily trigger counts; must not be {@code null}
     * @param defaultZone    zone for alerts without one; must not be {@code null}
     */
    public AlertProcessor(Map<AlertType, AlertEvaluator> evaluators,
            DailyTriggerCounter triggerCounter, ZoneId defaultZone) {
        Objects.requireNonNull(evaluators, "evaluators must not be null");
        this.evaluators = new EnumMap<>(AlertType.class);
        this.evaluators.putAll(evaluators);
        this.triggerCounter = Objects.requireNonNull(triggerCounter, "triggerCounter must not be null");
        this.gate = new AlertGate(triggerCounter, defaultZone);
    }

    /**
     * Process {@code alert} against one tick.
     *
     * @param alert   the alert; must not be {@code null}
     * @param context the tick; must not be {@code null}
     * @return the outcome, never {@link AlertOutcome.Status#FAILED}
     * @throws IllegalStateException if no evaluator is registered for the alert type
     */
    public AlertOutcome process(Alert alert, EvaluationContext context) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Instant now = context.getEvaluatedAt();

        GateVerdict verdict = gate.check(alert, now);
        if (verdict == GateVerdict.EXPIRED) {
            AlertLifecycle.expire(alert);
        }
        if (!verdict.isOpen()) {
            return AlertOutcome.gated(alert.getId(), verdict);
        }

        AlertEvaluator evaluator = evaluators.get(alert.getType());
        if (evaluator == null) {
            throw new IllegalStateException("No evaluator registered for alert type " + alert.getType());
        }

        EvaluationResult result = evaluator.evaluate(alert, context);
        if (!result.isTriggered()) {
            LOG.debug("Alert [{}] not triggered: {}", alert.getId(), result.getTriggerReason());
            return AlertOutcome.notTriggered(alert.getId(), result);
        }

        TriggerEvent event = createEvent(alert, context, result, now);
        alert.recordTrigger(now);
        triggerCounter.record(alert.getId(), now);

        LOG.info("Alert [{}] triggered for {}: {}", alert.getId(), alert.getTicker(), result.getTriggerReason());
        return AlertOutcome.triggered(alert.getId(), result, event);
    }

    public AlertGate getGate() {
        return gate;
    }

    private static TriggerEvent createEvent(Alert alert, EvaluationContext context,
            EvaluationResult result, Instant now) {
        NewsContext news = context.getNews();
        return TriggerEvent.builder()
                .alertId(alert.getId())
                .ticker(alert.getTicker())
                .triggeredAt(now)
                .triggerReason(result.getTriggerReason())
                .conditionsMet(result.getConditionsMet())
                .priceAtTrigger(context.getObservation().getPrice())
                .volumeAtTrigger(context.getObservation().getVolume())
                .newsCount(news.getNewsCount())
                .sentiment(news.getAverageSentiment().orElse(null))
                .build();
    }
}
