package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Record of one alert firing.
 *
 * <p>
 * Created by the engine and never changed by it afterwards. The only mutable
 * part is the user action, owned by the presentation layer and changed through
 * {@link #applyUserAction(UserAction, Instant, Instant)}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code alertId}, {@code ticker} and
 * {@code triggeredAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time. The id defaults to a random
 * UUID.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TriggerEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String alertId;
    private final String ticker;
    private final Instant triggeredAt;
    private final String triggerReason;
    private final ArrayList<String> conditionsMet;
    private final double priceAtTrigger;
    private final Double volumeAtTrigger;
    private final Integer newsCount;
    private final Double sentiment;

    private UserAction userAction = UserAction.PENDING;
    private Instant actionAt;
    private Instant snoozedUntil;

    private TriggerEvent(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.alertId = Objects.requireNonNull(builder.alertId, "alertId must not be null");
        this.ticker = Objects.requireNonNull(builder.ticker, "ticker must not be null");
        this.triggeredAt = Objects.requireNonNull(builder.triggeredAt, "triggeredAt must not be null");
        this.triggerReason = builder.triggerReason;
        this.conditionsMet = builder.conditionsMet != null ? new ArrayList<>(builder.conditionsMet) : new ArrayList<>();
        this.priceAtTrigger = builder.priceAtTrigger;
        this.volumeAtTrigger = builder.volumeAtTrigger;
        this.newsCount = builder.newsCount;
        this.sentiment = builder.sentiment;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String alertId;
        private String ticker;
        private Instant triggeredAt;
        private String triggerReason;
        private List<String> conditionsMet;
        private double priceAtTrigger;
        private Double volumeAtTrigger;
        private Integer newsCount;
        private Double sentiment;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder ticker(String ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        public Builder triggerReason(String triggerReason) {
            this.triggerReason = triggerReason;
            return this;
        }

        public Builder conditionsMet(List<String> conditionsMet) {
            this.conditionsMet = conditionsMet;
            return this;
        }

        public Builder priceAtTrigger(double priceAtTrigger) {
            this.priceAtTrigger = priceAtTrigger;
            return this;
        }

        public Builder volumeAtTrigger(Double volumeAtTrigger) {
            this.volumeAtTrigger = volumeAtTrigger;
            return this;
        }

        public Builder newsCount(Integer newsCount) {
            this.newsCount = newsCount;
            return this;
        }

        public Builder sentiment(Double sentiment) {
            this.sentiment = sentiment;
            return this;
        }

        /**
         * @return a new {@link TriggerEvent} in {@link UserAction#PENDING} state
         * @throws NullPointerException if a required field is missing
         */
        public TriggerEvent build() {
            return new TriggerEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // User action
    // ---------------------------------------------------------------

    /**
     * Record what the user did with this event.
     *
     * @param action       the action; must not be {@code null}
     * @param at           when it happened; must not be {@code null}
     * @param snoozedUntil end of the snooze for {@link UserAction#SNOOZED},
     *                     otherwise ignored
     */
    public synchronized void applyUserAction(UserAction action, Instant at, Instant snoozedUntil) {
        this.userAction = Objects.requireNonNull(action, "action must not be null");
        this.actionAt = Objects.requireNonNull(at, "action instant must not be null");
        this.snoozedUntil = action == UserAction.SNOOZED ? snoozedUntil : null;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getTicker() {
        return ticker;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public String getTriggerReason() {
        return triggerReason;
    }

    /**
     * @return unmodifiable list of satisfied-condition descriptions
     */
    public List<String> getConditionsMet() {
        return Collections.unmodifiableList(conditionsMet);
    }

    public double getPriceAtTrigger() {
        return priceAtTrigger;
    }

    public Double getVolumeAtTrigger() {
        return volumeAtTrigger;
    }

    public Integer getNewsCount() {
        return newsCount;
    }

    public Double getSentiment() {
        return sentiment;
    }

    public synchronized UserAction getUserAction() {
        return userAction;
    }

    public synchronized Instant getActionAt() {
        return actionAt;
    }

    public synchronized Instant getSnoozedUntil() {
        return snoozedUntil;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TriggerEvent that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "TriggerEvent{" +
                "id='" + id + '\'' +
                ", alertId='" + alertId + '\'' +
                ", ticker='" + ticker + '\'' +
                ", triggeredAt=" + triggeredAt +
                ", triggerReason='" + triggerReason + '\'' +
                '}';
    }
}
