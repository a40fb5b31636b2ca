package com.alertsentinel.flink;

import com.alertsentinel.core.model.Frequency;
import com.alertsentinel.core.model.TriggerEvent;

import java.io.Serializable;
import java.util.Objects;

/**
 * A trigger event on its way to the batching stage, with the batching policy
 * of the alert that produced it.
 *
 * @since 1.0.0
 */
public class PendingTrigger implements Serializable {

    private static final long serialVersionUID = 1L;

    private TriggerEvent event;
    private boolean batchingEnabled;
    private int windowMinutes;

    public PendingTrigger() {
    }

    /**
     * @param event     the event; must not be {@code null}
     * @param frequency frequency policy of the originating alert, may be {@code null}
     * @return a pending trigger; batching is off when {@code frequency} is {@code null}
     */
    public static PendingTrigger of(TriggerEvent event, Frequency frequency) {
        PendingTrigger pending = new PendingTrigger();
        pending.event = Objects.requireNonNull(event, "event must not be null");
        if (frequency != null) {
            pending.batchingEnabled = frequency.isBatchingEnabled();
            pending.windowMinutes = frequency.getBatchingWindowMinutes();
        }
        return pending;
    }

    public String getTicker() {
        return event.getTicker();
    }

    public TriggerEvent getEvent() {
        return event;
    }

    public void setEvent(TriggerEvent event) {
        this.event = event;
    }

    public boolean isBatchingEnabled() {
        return batchingEnabled;
    }

    public void setBatchingEnabled(boolean batchingEnabled) {
        this.batchingEnabled = batchingEnabled;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    @Override
    public String toString() {
        return "PendingTrigger{" +
                "event=" + event.getId() +
                ", batchingEnabled=" + batchingEnabled +
                ", windowMinutes=" + windowMinutes +
                '}';
    }
}
