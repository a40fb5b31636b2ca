package com.alertsentinel.core.evaluation;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one alert against one tick.
 *
 * <p>
 * {@code conditionsMet} may be non-empty even when {@code triggered} is
 * {@code false}: an anomaly explained by news keeps the signals it detected.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationResult {

    private final boolean triggered;
    private final String triggerReason;
    private final List<String> conditionsMet;

    private EvaluationResult(boolean triggered, String triggerReason, List<String> conditionsMet) {
        this.triggered = triggered;
        this.triggerReason = Objects.requireNonNull(triggerReason, "triggerReason must not be null");
        this.conditionsMet = List.copyOf(conditionsMet);
    }

    public static EvaluationResult triggered(String reason, List<String> conditionsMet) {
        return new EvaluationResult(true, reason, conditionsMet);
    }

    public static EvaluationResult notTriggered(String reason) {
        return new EvaluationResult(false, reason, List.of());
    }

    public static EvaluationResult notTriggered(String reason, List<String> conditionsMet) {
        return new EvaluationResult(false, reason, conditionsMet);
    }

    public boolean isTriggered() {
        return triggered;
    }

    public String getTriggerReason() {
        return triggerReason;
    }

    public List<String> getConditionsMet() {
        return conditionsMet;
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "triggered=" + triggered +
                ", triggerReason='" + triggerReason + '\'' +
                ", conditionsMet=" + conditionsMet +
                '}';
    }
}
