package com.alertsentinel.core.engine;

import com.alertsentinel.core.model.TriggerEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one {@link AlertEngine#evaluateTick} call.
 *
 * @since 1.0.0
 */
public final class TickReport {

    private final int evaluated;
    private final int gated;
    private final int triggered;
    private final int failed;
    private final int skipped;
    private final List<TriggerEvent> events;
    private final List<AlertOutcome> outcomes;

    private TickReport(Builder builder) {
        this.evaluated = builder.evaluated;
        this.gated = builder.gated;
        this.triggered = builder.events.size();
        this.failed = builder.failed;
        this.skipped = builder.skipped;
        this.events = List.copyOf(builder.events);
        this.outcomes = List.copyOf(builder.outcomes);
    }

    /** Alerts that passed the gate and were evaluated, triggered or not. */
    public int getEvaluated() {
        return evaluated;
    }

    public int getGated() {
        return gated;
    }

    public int getTriggered() {
        return triggered;
    }

    public int getFailed() {
        return failed;
    }

    /** Alerts with no context for their ticker in this tick. */
    public int getSkipped() {
        return skipped;
    }

    public List<TriggerEvent> getEvents() {
        return events;
    }

    public List<AlertOutcome> getOutcomes() {
        return outcomes;
    }

    @Override
    public String toString() {
        return "TickReport{" +
                "evaluated=" + evaluated +
                ", gated=" + gated +
                ", triggered=" + triggered +
                ", failed=" + failed +
                ", skipped=" + skipped +
                '}';
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private int evaluated;
        private int gated;
        private int failed;
        private int skipped;
        private final List<TriggerEvent> events = new ArrayList<>();
        private final List<AlertOutcome> outcomes = new ArrayList<>();

        void add(AlertOutcome outcome) {
            outcomes.add(outcome);
            switch (outcome.getStatus()) {
                case GATED -> gated++;
                case NOT_TRIGGERED -> evaluated++;
                case TRIGGERED -> {
                    evaluated++;
                    outcome.getEvent().ifPresent(events::add);
                }
                case FAILED -> failed++;
            }
        }

        void skip() {
            skipped++;
        }

        TickReport build() {
            return new TickReport(this);
        }
    }
}
