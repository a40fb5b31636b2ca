package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.Condition;
import com.alertsentinel.core.model.ConditionField;
import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConditionEvaluator}.
 */
class ConditionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:00Z");

    @Test
    @DisplayName("Should match and describe a satisfied comparison")
    void shouldMatchSatisfiedComparison() {
        ConditionResult result = ConditionEvaluator.evaluate(
                Condition.of(ConditionField.PRICE, ComparisonOperator.GREATER_THAN, 200),
                observation(210.5, 200), null);

        assertThat(result.isMatched()).isTrue();
        assertThat(result.getDescription()).isEqualTo("PRICE > 200 (actual: 210.50)");
    }

    @Test
    @DisplayName("Should NOT match when the comparison fails")
    void shouldNotMatchFailedComparison() {
        ConditionResult result = ConditionEvaluator.evaluate(
                Condition.of(ConditionField.PRICE, ComparisonOperator.LESS_THAN, 200),
                observation(210.5, 200), null);

        assertThat(result.isMatched()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(ComparisonOperator.class)
    @DisplayName("Should never match a condition on a missing field, whatever the operator")
    void shouldNeverMatchMissingField(ComparisonOperator operator) {
        MarketObservation noPe = observation(100, 100);

        ConditionResult result = ConditionEvaluator.evaluate(
                Condition.of(ConditionField.PE_RATIO, operator, 0), noPe, null);

        assertThat(result.isMatched()).isFalse();
        assertThat(result.getDescription()).isEqualTo("PE_RATIO data unavailable");
    }

    @Test
    @DisplayName("Should treat a missing sentiment as unavailable, not as zero")
    void shouldNotTreatMissingSentimentAsZero() {
        ConditionResult result = ConditionEvaluator.evaluate(
                Condition.of(ConditionField.NEWS_SENTIMENT, ComparisonOperator.EQUAL, 0),
                observation(100, 100), NewsContext.empty("SBER"));

        assertThat(result.isMatched()).isFalse();
        assertThat(result.getDescription()).contains("data unavailable");
    }

    @Test
    @DisplayName("EQUAL should tolerate differences below 0.01 in either direction")
    void equalShouldUseTolerance() {
        assertThat(ConditionEvaluator.compare(100.005, ComparisonOperator.EQUAL, 100)).isTrue();
        assertThat(ConditionEvaluator.compare(99.995, ComparisonOperator.EQUAL, 100)).isTrue();
        assertThat(ConditionEvaluator.compare(100.02, ComparisonOperator.EQUAL, 100)).isFalse();
        assertThat(ConditionEvaluator.compare(99.98, ComparisonOperator.EQUAL, 100)).isFalse();
    }

    @Test
    @DisplayName("NOT_EQUAL should be the exact complement of EQUAL")
    void notEqualShouldComplementEqual() {
        assertThat(ConditionEvaluator.compare(100.005, ComparisonOperator.NOT_EQUAL, 100)).isFalse();
        assertThat(ConditionEvaluator.compare(99.995, ComparisonOperator.NOT_EQUAL, 100)).isFalse();
        assertThat(ConditionEvaluator.compare(100.02, ComparisonOperator.NOT_EQUAL, 100)).isTrue();
    }

    @Test
    @DisplayName("PERCENTAGE_CHANGE should compare the magnitude, not the direction")
    void percentageChangeShouldCompareMagnitude() {
        assertThat(ConditionEvaluator.compare(-6, ComparisonOperator.PERCENTAGE_CHANGE, 5)).isTrue();
        assertThat(ConditionEvaluator.compare(6, ComparisonOperator.PERCENTAGE_CHANGE, 5)).isTrue();
        assertThat(ConditionEvaluator.compare(5, ComparisonOperator.PERCENTAGE_CHANGE, 5)).isTrue();
        assertThat(ConditionEvaluator.compare(-4.9, ComparisonOperator.PERCENTAGE_CHANGE, 5)).isFalse();
    }

    @Test
    @DisplayName("Inclusive operators should match at the threshold")
    void inclusiveOperatorsShouldMatchAtThreshold() {
        assertThat(ConditionEvaluator.compare(30, ComparisonOperator.GREATER_THAN_EQUAL, 30)).isTrue();
        assertThat(ConditionEvaluator.compare(30, ComparisonOperator.LESS_THAN_EQUAL, 30)).isTrue();
        assertThat(ConditionEvaluator.compare(30, ComparisonOperator.GREATER_THAN, 30)).isFalse();
        assertThat(ConditionEvaluator.compare(30, ComparisonOperator.LESS_THAN, 30)).isFalse();
    }

    @Test
    @DisplayName("Crossing operators should never match without the previous value")
    void crossingOperatorsShouldNeverMatch() {
        assertThat(ConditionEvaluator.compare(250, ComparisonOperator.CROSSES_ABOVE, 200)).isFalse();
        assertThat(ConditionEvaluator.compare(150, ComparisonOperator.CROSSES_BELOW, 200)).isFalse();
    }

    @Test
    @DisplayName("Should evaluate an unknown field as unmatched instead of throwing")
    void shouldTolerateUnknownField() {
        Condition condition = new Condition();
        condition.setField("SHORT_INTEREST");
        condition.setOperator("GREATER_THAN");
        condition.setValue(1);

        ConditionResult result = ConditionEvaluator.evaluate(condition, observation(100, 100), null);

        assertThat(result.isMatched()).isFalse();
        assertThat(result.getDescription()).contains("SHORT_INTEREST");
    }

    @Test
    @DisplayName("Should evaluate an unknown operator as unmatched instead of throwing")
    void shouldTolerateUnknownOperator() {
        Condition condition = new Condition();
        condition.setField("PRICE");
        condition.setOperator("ROUGHLY");
        condition.setValue(1);

        ConditionResult result = ConditionEvaluator.evaluate(condition, observation(100, 100), null);

        assertThat(result.isMatched()).isFalse();
        assertThat(result.getDescription()).contains("ROUGHLY");
    }

    @Test
    @DisplayName("Should accept field and operator names in any case")
    void shouldAcceptNamesCaseInsensitively() {
        Condition condition = new Condition();
        condition.setField("price");
        condition.setOperator("greater_than");
        condition.setValue(50);

        assertThat(ConditionEvaluator.evaluate(condition, observation(100, 100), null).isMatched()).isTrue();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static MarketObservation observation(double price, double previousClose) {
        return MarketObservation.builder()
                .ticker("SBER")
                .price(price)
                .previousClose(previousClose)
                .volume(1_000)
                .timestamp(NOW)
                .build();
    }
}
