package com.alertsentinel.core.engine;

import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertStatus;
import com.alertsentinel.core.model.AlertType;
import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.Condition;
import com.alertsentinel.core.model.ConditionField;
import com.alertsentinel.core.model.ConditionGroup;
import com.alertsentinel.core.model.Frequency;
import com.alertsentinel.core.model.GroupLogic;
import com.alertsentinel.core.model.TriggerEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertEngine}.
 */
class AlertEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final List<List<TriggerEvent>> delivered = new CopyOnWriteArrayList<>();
    private AlertEngine engine;

    @BeforeEach
    void setUp() {
        engine = AlertEngine.builder()
                .delivery((ticker, events) -> delivered.add(events))
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Batched triggers for one ticker should be held and delivered together on flush")
    void shouldBatchTriggersPerTicker() {
        Alert first = priceAbove("e-1", 250, true);
        Alert second = priceAbove("e-2", 255, true);

        TickReport report = engine.evaluateTick(List.of(first, second), Map.of("SBER", tick(260)));

        assertThat(report.getEvaluated()).isEqualTo(2);
        assertThat(report.getTriggered()).isEqualTo(2);
        assertThat(engine.pendingTickers()).containsExactly("SBER");
        assertThat(delivered).isEmpty();

        engine.flush();

        assertThat(delivered).hasSize(1);
        assertThat(delivered.get(0)).extracting(TriggerEvent::getAlertId).containsExactly("e-1", "e-2");
        assertThat(engine.pendingTickers()).isEmpty();
    }

    @Test
    @DisplayName("Triggers with batching disabled should be delivered at once")
    void shouldDeliverUnbatchedImmediately() {
        TickReport report = engine.evaluateTick(List.of(priceAbove("e-1", 250, false)), Map.of("SBER", tick(260)));

        assertThat(report.getTriggered()).isEqualTo(1);
        assertThat(delivered).hasSize(1);
        assertThat(delivered.get(0)).hasSize(1);
        assertThat(engine.pendingTickers()).isEmpty();
    }

    @Test
    @DisplayName("Alerts without market data in the tick should be skipped")
    void shouldSkipAlertsWithoutContext() {
        Alert other = Alert.builder()
                .id("e-3")
                .ticker("GAZP")
                .name("GAZP news")
                .type(AlertType.NEWS_TRIGGERED)
                .build();

        TickReport report = engine.evaluateTick(List.of(other, priceAbove("e-1", 300, true)),
                Map.of("SBER", tick(260)));

        assertThat(report.getSkipped()).isEqualTo(1);
        assertThat(report.getEvaluated()).isEqualTo(1);
        assertThat(report.getTriggered()).isZero();
        assertThat(report.getOutcomes()).hasSize(1);
    }

    @Test
    @DisplayName("A failing alert should be counted and not stop the others")
    void shouldIsolateFailures() {
        Alert broken = priceAbove("e-bad", 250, false);
        broken.setType(null);
        Alert healthy = priceAbove("e-1", 250, false);

        TickReport report = engine.evaluateTick(List.of(broken, healthy), Map.of("SBER", tick(260)));

        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getTriggered()).isEqualTo(1);
        assertThat(report.getOutcomes().get(0).getFailure()).isPresent();
        assertThat(delivered).hasSize(1);
    }

    @Test
    @DisplayName("A trigger that cannot be dispatched should count as failed and not stop the others")
    void shouldIsolateDispatchFailures() {
        Alert undeliverable = priceAbove("e-bad", 250, true);
        undeliverable.getFrequency().setBatchingWindowMinutes(0);
        Alert healthy = priceAbove("e-1", 250, false);

        TickReport report = engine.evaluateTick(List.of(undeliverable, healthy), Map.of("SBER", tick(260)));

        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getTriggered()).isEqualTo(1);
        assertThat(report.getOutcomes().get(0).getFailure()).hasValueSatisfying(
                failure -> assertThat(failure).startsWith("Dispatch failed"));
        assertThat(report.getEvents()).extracting(TriggerEvent::getAlertId).containsExactly("e-1");
        assertThat(delivered).hasSize(1);
        assertThat(engine.pendingTickers()).isEmpty();
    }

    @Test
    @DisplayName("An elapsed snooze should be resumed before gating")
    void shouldResumeElapsedSnooze() {
        Alert alert = priceAbove("e-1", 250, false);
        AlertLifecycle.snooze(alert, 1, NOW.minus(Duration.ofHours(2)));

        TickReport report = engine.evaluateTick(List.of(alert), Map.of("SBER", tick(260)));

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(report.getTriggered()).isEqualTo(1);
    }

    @Test
    @DisplayName("A still-running snooze should gate the alert")
    void shouldGateSnoozedAlert() {
        Alert alert = priceAbove("e-1", 250, false);
        AlertLifecycle.snooze(alert, 4, NOW.minus(Duration.ofHours(1)));

        TickReport report = engine.evaluateTick(List.of(alert), Map.of("SBER", tick(260)));

        assertThat(report.getGated()).isEqualTo(1);
        assertThat(delivered).isEmpty();
    }

    @Test
    @DisplayName("Closing the engine should flush pending batches")
    void closeShouldFlush() {
        engine.evaluateTick(List.of(priceAbove("e-1", 250, true)), Map.of("SBER", tick(260)));

        engine.close();

        assertThat(delivered).hasSize(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Alert priceAbove(String id, double level, boolean batching) {
        Frequency frequency = new Frequency();
        frequency.setBatchingEnabled(batching);
        return Alert.builder()
                .id(id)
                .ticker("SBER")
                .name("SBER above " + level)
                .type(AlertType.THRESHOLD)
                .frequency(frequency)
                .conditionGroup(ConditionGroup.of(GroupLogic.AND,
                        Condition.of(ConditionField.PRICE, ComparisonOperator.GREATER_THAN, level)))
                .build();
    }

    private static EvaluationContext tick(double price) {
        return AlertProcessorTest.context(price, NOW, null);
    }
}
