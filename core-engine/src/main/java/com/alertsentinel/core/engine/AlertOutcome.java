package com.alertsentinel.core.engine;

import com.alertsentinel.core.evaluation.EvaluationResult;
import com.alertsentinel.core.gating.GateVerdict;
import com.alertsentinel.core.model.TriggerEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one alert on one tick.
 *
 * @since 1.0.0
 */
public final class AlertOutcome {

    /** Disposition of the alert. */
    public enum Status {
        /** Stopped by the gate; see {@link #getVerdict()}. */
        GATED,
        NOT_TRIGGERED,
        TRIGGERED,
        /** Evaluation threw; the alert is skipped for this tick. */
        FAILED
    }

    private final String alertId;
    private final Status status;
    private final GateVerdict verdict;
    private final EvaluationResult result;
    private final TriggerEvent event;
    private final String failure;

    private AlertOutcome(String alertId, Status status, GateVerdict verdict,
            EvaluationResult result, TriggerEvent event, String failure) {
        this.alertId = alertId;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.verdict = verdict;
        this.result = result;
        this.event = event;
        this.failure = failure;
    }

    static AlertOutcome gated(String alertId, GateVerdict verdict) {
        return new AlertOutcome(alertId, Status.GATED, verdict, null, null, null);
    }

    static AlertOutcome notTriggered(String alertId, EvaluationResult result) {
        return new AlertOutcome(alertId, Status.NOT_TRIGGERED, GateVerdict.OPEN, result, null, null);
    }

    static AlertOutcome triggered(String alertId, EvaluationResult result, TriggerEvent event) {
        return new AlertOutcome(alertId, Status.TRIGGERED, GateVerdict.OPEN, result, event, null);
    }

    static AlertOutcome failed(String alertId, String failure) {
        return new AlertOutcome(alertId, Status.FAILED, null, null, null, failure);
    }

    public String getAlertId() {
        return alertId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isTriggered() {
        return status == Status.TRIGGERED;
    }

    /**
     * @return the gate verdict, empty when evaluation failed
     */
    public Optional<GateVerdict> getVerdict() {
        return Optional.ofNullable(verdict);
    }

    /**
     * @return the evaluation result, empty when gated or failed
     */
    public Optional<EvaluationResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<TriggerEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return "AlertOutcome{" +
                "alertId='" + alertId + '\'' +
                ", status=" + status +
                ", verdict=" + verdict +
                (result != null ? ", reason='" + result.getTriggerReason() + '\'' : "") +
                (failure != null ? ", failure='" + failure + '\'' : "") +
                '}';
    }
}
