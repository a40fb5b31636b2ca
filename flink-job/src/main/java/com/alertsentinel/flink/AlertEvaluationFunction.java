package com.alertsentinel.flink;

import com.alertsentinel.core.config.SentimentSettings;
import com.alertsentinel.core.engine.AlertLifecycle;
import com.alertsentinel.core.engine.AlertOutcome;
import com.alertsentinel.core.engine.AlertProcessor;
import com.alertsentinel.core.engine.EvaluatorFactory;
import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.model.PricePoint;
import com.alertsentinel.core.sentiment.SentimentAnalyzer;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.state.MapState;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Flink {@link KeyedProcessFunction} that evaluates every alert of a ticker
 * against each incoming {@link MarketTick}.
 *
 * <p>
 * The stream is keyed by ticker, so all alerts on one ticker are evaluated by
 * one subtask and share its keyed state. Each alert goes through the core
 * {@link AlertProcessor}; a trigger is emitted as a {@link PendingTrigger}
 * for the batching stage.
 * </p>
 *
 * <h3>State Management</h3>
 * <ul>
 * <li>{@code ListState<PricePoint>}: rolling price history of the ticker,
 * bounded to the configured capacity and appended <em>after</em> evaluation
 * so the current tick is never part of its own baseline</li>
 * <li>{@code MapState<String, AlertBookkeeping>}: per-alert status,
 * last trigger, trigger count, snooze and recent trigger instants for the
 * daily cap</li>
 * </ul>
 *
 * <h3>Metrics</h3>
 * <p>
 * Custom Flink metrics are registered in {@link #open(Configuration)} and
 * updated per tick and per alert outcome.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEvaluationFunction
        extends KeyedProcessFunction<String, MarketTick, PendingTrigger> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertEvaluationFunction.class);

    /** Alert definitions (serializable config, not runtime state). */
    private final List<Alert> alerts;
    private final SentimentSettings sentimentSettings;
    private final ZoneId defaultZone;
    private final int historyCapacity;

    private transient Map<String, List<Alert>> alertsByTicker;
    private transient SentimentAnalyzer analyzer;
    private transient AlertProcessor processor;

    private transient ListState<PricePoint> historyState;
    private transient MapState<String, AlertBookkeeping> bookkeepingState;

    private transient SentinelMetrics metrics;

    /**
     * @param alerts            alert definitions; must not be {@code null} or empty
     * @param sentimentSettings lexicon and news threshold; must not be {@code null}
     * @param defaultZone       zone for alerts without one; must not be {@code null}
     * @param historyCapacity   price points kept per ticker; must be positive
     */
    public AlertEvaluationFunction(List<Alert> alerts, SentimentSettings sentimentSettings,
            ZoneId defaultZone, int historyCapacity) {
        Objects.requireNonNull(alerts, "Alerts list must not be null");
        if (alerts.isEmpty()) {
            throw new IllegalArgumentException("Alerts list must not be empty");
        }
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be >= 1, got: " + historyCapacity);
        }
        this.alerts = Collections.unmodifiableList(new ArrayList<>(alerts));
        this.sentimentSettings = Objects.requireNonNull(sentimentSettings, "sentimentSettings must not be null");
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        this.historyCapacity = historyCapacity;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        historyState = getRuntimeContext().getListState(
                new ListStateDescriptor<>("price-history", PricePoint.class));
        bookkeepingState = getRuntimeContext().getMapState(
                new MapStateDescriptor<>("alert-bookkeeping", String.class, AlertBookkeeping.class));

        alertsByTicker = alerts.stream().collect(Collectors.groupingBy(Alert::getTicker));
        analyzer = SentimentAnalyzer.from(sentimentSettings);
        processor = new AlertProcessor(EvaluatorFactory.createAll(sentimentSettings),
                new KeyedTriggerCounter(bookkeepingState), defaultZone);

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AlertEvaluationFunction opened with {} alert(s) on {} ticker(s)",
                alerts.size(), alertsByTicker.size());
    }

    @Override
    public void close() {
        LOG.info("AlertEvaluationFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MarketTick tick,
            KeyedProcessFunction<String, MarketTick, PendingTrigger>.Context ctx,
            Collector<PendingTrigger> out) throws Exception {
        long startNanos = System.nanoTime();
        String ticker = ctx.getCurrentKey();

        MarketObservation observation = tick.toObservation();
        List<PricePoint> history = new ArrayList<>();
        for (PricePoint point : historyState.get()) {
            history.add(point);
        }
        NewsContext news = analyzer.contextFor(ticker, tick.getNews());
        EvaluationContext context = EvaluationContext.of(observation, news, history);

        for (Alert alert : alertsByTicker.getOrDefault(ticker, List.of())) {
            try {
                evaluate(alert, context, out);
            } catch (RuntimeException e) {
                metrics.incrementEvaluationFailures();
                LOG.error("Evaluation of alert [{}] failed, continuing with next alert", alert.getId(), e);
            }
        }

        history.add(PricePoint.of(observation));
        historyState.update(trim(history, historyCapacity));

        metrics.incrementTicksProcessed();
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    private void evaluate(Alert alert, EvaluationContext context, Collector<PendingTrigger> out) throws Exception {
        AlertBookkeeping stored = bookkeepingState.get(alert.getId());
        if (stored != null) {
            stored.applyTo(alert);
        }
        AlertLifecycle.resumeIfDue(alert, context.getEvaluatedAt());

        AlertOutcome outcome = processor.process(alert, context);
        switch (outcome.getStatus()) {
            case GATED -> metrics.incrementAlertsGated();
            case TRIGGERED -> {
                metrics.incrementAlertsTriggered();
                outcome.getEvent().ifPresent(event -> out.collect(PendingTrigger.of(event, alert.getFrequency())));
            }
            default -> {
                // not triggered; reason logged by the processor
            }
        }

        // re-read: the trigger counter may have written this entry during processing
        AlertBookkeeping updated = bookkeepingState.get(alert.getId());
        if (updated == null) {
            updated = new AlertBookkeeping();
        }
        updated.capture(alert);
        bookkeepingState.put(alert.getId(), updated);
    }

    static List<PricePoint> trim(List<PricePoint> history, int capacity) {
        if (history.size() <= capacity) {
            return history;
        }
        return new ArrayList<>(history.subList(history.size() - capacity, history.size()));
    }
}
