package com.alertsentinel.core.engine;

import com.alertsentinel.core.batch.BatchListener;
import com.alertsentinel.core.batch.DebounceBatcher;
import com.alertsentinel.core.config.SentimentSettings;
import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.gating.DailyTriggerCounter;
import com.alertsentinel.core.gating.InMemoryDailyTriggerCounter;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.Frequency;
import com.alertsentinel.core.model.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-process entry point: evaluates alerts per tick and hands triggers to
 * delivery through the {@link DebounceBatcher}.
 *
 * <h3>Per tick</h3>
 * <ol>
 * <li>elapsed snoozes are resumed</li>
 * <li>each alert is looked up by ticker in the supplied contexts; alerts
 * without one are skipped</li>
 * <li>each alert is processed by {@link AlertProcessor}; an exception is
 * logged, counted and never stops the other alerts</li>
 * <li>trigger events of alerts with batching enabled are debounced per
 * ticker; all others are delivered at once as a single-event batch</li>
 * </ol>
 *
 * <p>
 * The engine performs no I/O. The caller persists the alert bookkeeping
 * fields after each tick and supplies the delivery {@link BatchListener}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    private final AlertProcessor processor;
    private final DebounceBatcher batcher;
    private final BatchListener delivery;

    private AlertEngine(Builder builder) {
        this.processor = new AlertProcessor(
                EvaluatorFactory.createAll(builder.sentimentSettings),
                builder.triggerCounter,
                builder.defaultZone);
        this.batcher = builder.batcher != null ? builder.batcher : new DebounceBatcher();
        this.delivery = Objects.requireNonNull(builder.delivery, "delivery listener must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Process one alert without handing its event to delivery.
     *
     * @param alert   the alert; must not be {@code null}
     * @param context the tick; must not be {@code null}
     * @return the outcome; {@link AlertOutcome.Status#FAILED} if evaluation threw
     */
    public AlertOutcome evaluate(Alert alert, EvaluationContext context) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(context, "context must not be null");
        try {
            return processor.process(alert, context);
        } catch (RuntimeException e) {
            LOG.error("Evaluation of alert [{}] failed", alert.getId(), e);
            return AlertOutcome.failed(alert.getId(), e.toString());
        }
    }

    /**
     * Evaluate every alert against the context of its ticker and dispatch the
     * resulting triggers.
     *
     * @param alerts   the current rule set; must not be {@code null}
     * @param contexts tick data keyed by ticker; must not be {@code null}
     * @return counts and the created events
     */
    public TickReport evaluateTick(Collection<Alert> alerts, Map<String, EvaluationContext> contexts) {
        Objects.requireNonNull(alerts, "alerts must not be null");
        Objects.requireNonNull(contexts, "contexts must not be null");
        TickReport.Builder report = TickReport.builder();

        for (Alert alert : alerts) {
            if (alert == null) {
                continue;
            }
            EvaluationContext context = contexts.get(alert.getTicker());
            if (context == null) {
                LOG.warn("No market data for {} in this tick; skipping alert [{}]",
                        alert.getTicker(), alert.getId());
                report.skip();
                continue;
            }

            AlertLifecycle.resumeIfDue(alert, context.getEvaluatedAt());
            AlertOutcome outcome = evaluate(alert, context);
            if (outcome.getEvent().isPresent()) {
                TriggerEvent event = outcome.getEvent().get();
                try {
                    dispatch(alert, event);
                } catch (RuntimeException e) {
                    LOG.error("Dispatch of trigger [{}] for alert [{}] failed", event.getId(), alert.getId(), e);
                    outcome = AlertOutcome.failed(alert.getId(), "Dispatch failed: " + e);
                }
            }
            report.add(outcome);
        }

        TickReport result = report.build();
        LOG.debug("Tick complete: {}", result);
        return result;
    }

    /**
     * Deliver every pending batch now.
     */
    public void flush() {
        batcher.flushAll(delivery);
    }

    /**
     * @return tickers with a batch waiting for its window to go quiet
     */
    public Set<String> pendingTickers() {
        return batcher.pendingKeys();
    }

    /**
     * Flush pending batches and release the batcher.
     */
    @Override
    public void close() {
        flush();
        batcher.close();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void dispatch(Alert alert, TriggerEvent event) {
        Frequency frequency = alert.getFrequency();
        if (frequency != null && frequency.isBatchingEnabled()) {
            batcher.addToBatch(event.getTicker(), event, frequency.getBatchingWindowMinutes(), delivery);
            return;
        }
        try {
            delivery.onReady(event.getTicker(), List.of(event));
        } catch (RuntimeException e) {
            LOG.error("Delivery failed for trigger [{}] of alert [{}]", event.getId(), alert.getId(), e);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private SentimentSettings sentimentSettings = SentimentSettings.defaults();
        private DailyTriggerCounter triggerCounter = new InMemoryDailyTriggerCounter();
        private ZoneId defaultZone = ZoneOffset.UTC;
        private DebounceBatcher batcher;
        private BatchListener delivery;

        public Builder sentimentSettings(SentimentSettings sentimentSettings) {
            this.sentimentSettings = Objects.requireNonNull(sentimentSettings, "sentimentSettings must not be null");
            return this;
        }

        public Builder triggerCounter(DailyTriggerCounter triggerCounter) {
            this.triggerCounter = Objects.requireNonNull(triggerCounter, "triggerCounter must not be null");
            return this;
        }

        public Builder defaultZone(ZoneId defaultZone) {
            this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
            return this;
        }

        /** Defaults to a batcher with its own timer thread. */
        public Builder batcher(DebounceBatcher batcher) {
            this.batcher = batcher;
            return this;
        }

        public Builder delivery(BatchListener delivery) {
            this.delivery = delivery;
            return this;
        }

        public AlertEngine build() {
            return new AlertEngine(this);
        }
    }
}
