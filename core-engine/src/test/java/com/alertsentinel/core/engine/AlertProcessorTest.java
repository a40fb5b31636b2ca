package com.alertsentinel.core.engine;

import com.alertsentinel.core.config.SentimentSettings;
import com.alertsentinel.core.evaluation.EvaluationContext;
import com.alertsentinel.core.gating.GateVerdict;
import com.alertsentinel.core.gating.InMemoryDailyTriggerCounter;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertStatus;
import com.alertsentinel.core.model.AlertType;
import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.Condition;
import com.alertsentinel.core.model.ConditionField;
import com.alertsentinel.core.model.ConditionGroup;
import com.alertsentinel.core.model.GroupLogic;
import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.model.TriggerEvent;
import com.alertsentinel.core.model.UserAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertProcessor}.
 */
class AlertProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private InMemoryDailyTriggerCounter counter;
    private AlertProcessor processor;

    @BeforeEach
    void setUp() {
        counter = new InMemoryDailyTriggerCounter();
        processor = new AlertProcessor(
                EvaluatorFactory.createAll(SentimentSettings.defaults()), counter, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("A satisfied threshold alert should produce a pending trigger event and update bookkeeping")
    void shouldTriggerAndRecord() {
        Alert alert = priceAbove(250);

        AlertOutcome outcome = processor.process(alert, context(260, NOW, NewsContext.of("SBER", 2, -0.1)));

        assertThat(outcome.getStatus()).isEqualTo(AlertOutcome.Status.TRIGGERED);
        TriggerEvent event = outcome.getEvent().orElseThrow();
        assertThat(event.getAlertId()).isEqualTo("proc-1");
        assertThat(event.getTicker()).isEqualTo("SBER");
        assertThat(event.getTriggeredAt()).isEqualTo(NOW);
        assertThat(event.getPriceAtTrigger()).isEqualTo(260.0);
        assertThat(event.getVolumeAtTrigger()).isEqualTo(1_000.0);
        assertThat(event.getNewsCount()).isEqualTo(2);
        assertThat(event.getSentiment()).isEqualTo(-0.1);
        assertThat(event.getConditionsMet()).hasSize(1);
        assertThat(event.getTriggerReason()).startsWith("Conditions met: ");
        assertThat(event.getUserAction()).isEqualTo(UserAction.PENDING);

        assertThat(alert.getLastTriggeredAt()).isEqualTo(NOW);
        assertThat(alert.getTriggeredCount()).isEqualTo(1);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(counter.countOn("proc-1", LocalDate.of(2026, 3, 2), ZoneOffset.UTC)).isEqualTo(1);
    }

    @Test
    @DisplayName("Without news the event should carry a zero news count and no sentiment")
    void shouldReportZeroNewsCountWithoutNews() {
        AlertOutcome outcome = processor.process(priceAbove(250), context(260, NOW, null));

        TriggerEvent event = outcome.getEvent().orElseThrow();
        assertThat(event.getNewsCount()).isZero();
        assertThat(event.getSentiment()).isNull();
    }

    @Test
    @DisplayName("An unsatisfied alert should leave bookkeeping untouched")
    void shouldNotTouchBookkeepingWhenNotTriggered() {
        Alert alert = priceAbove(250);

        AlertOutcome outcome = processor.process(alert, context(240, NOW, null));

        assertThat(outcome.getStatus()).isEqualTo(AlertOutcome.Status.NOT_TRIGGERED);
        assertThat(outcome.getEvent()).isEmpty();
        assertThat(outcome.getResult()).isPresent();
        assertThat(alert.getTriggeredCount()).isZero();
        assertThat(alert.getLastTriggeredAt()).isNull();
    }

    @Test
    @DisplayName("The cooldown should gate the next tick after a trigger")
    void shouldGateDuringCooldown() {
        Alert alert = priceAbove(250);
        processor.process(alert, context(260, NOW, null));

        AlertOutcome second = processor.process(alert, context(270, NOW.plus(Duration.ofMinutes(5)), null));

        assertThat(second.getStatus()).isEqualTo(AlertOutcome.Status.GATED);
        assertThat(second.getVerdict()).contains(GateVerdict.COOLDOWN);
        assertThat(alert.getTriggeredCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("An expired alert should be gated and marked expired")
    void shouldExpireAlert() {
        Alert alert = Alert.builder()
                .id("proc-2")
                .ticker("SBER")
                .name("Expiring")
                .type(AlertType.THRESHOLD)
                .conditionGroup(ConditionGroup.of(GroupLogic.AND,
                        Condition.of(ConditionField.PRICE, ComparisonOperator.GREATER_THAN, 1)))
                .expiresAt(NOW.minusSeconds(1))
                .build();

        AlertOutcome outcome = processor.process(alert, context(260, NOW, null));

        assertThat(outcome.getVerdict()).contains(GateVerdict.EXPIRED);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.EXPIRED);
    }

    @Test
    @DisplayName("A missing evaluator should fail loudly")
    void shouldThrowWithoutEvaluator() {
        AlertProcessor partial = new AlertProcessor(Map.of(), counter, ZoneOffset.UTC);

        assertThatThrownBy(() -> partial.process(priceAbove(250), context(260, NOW, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("THRESHOLD");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Alert priceAbove(double level) {
        return Alert.builder()
                .id("proc-1")
                .ticker("SBER")
                .name("SBER above " + level)
                .type(AlertType.THRESHOLD)
                .conditionGroup(ConditionGroup.of(GroupLogic.AND,
                        Condition.of(ConditionField.PRICE, ComparisonOperator.GREATER_THAN, level)))
                .build();
    }

    static EvaluationContext context(double price, Instant at, NewsContext news) {
        MarketObservation observation = MarketObservation.builder()
                .ticker("SBER")
                .price(price)
                .previousClose(price)
                .volume(1_000)
                .timestamp(at)
                .build();
        return EvaluationContext.of(observation, news, null, at);
    }
}
