package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A user-defined watch rule on one ticker.
 *
 * <p>
 * Definition fields are authored outside the engine and loaded from
 * configuration. The bookkeeping fields {@code status},
 * {@code lastTriggeredAt}, {@code triggeredCount} and {@code snoozedUntil} are
 * mutated only by the engine ({@link #recordTrigger(Instant)}) and by
 * {@link com.alertsentinel.core.engine.AlertLifecycle}; the caller is
 * responsible for persisting them.
 * </p>
 *
 * <h3>Evaluation path</h3>
 * <p>
 * Exactly one path is taken per {@link AlertType}: condition groups for
 * {@code THRESHOLD}/{@code MULTI_CONDITION}, sentiment for
 * {@code NEWS_TRIGGERED} and the anomaly detector for {@code ANOMALY}.
 * {@code conditionGroups} is ignored by the latter two.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. A given alert must not be evaluated by two threads at
 * once; different alerts may be evaluated concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String userId;
    private String ticker;
    private String name;
    private String description;

    private AlertType type;
    private AlertPriority priority = AlertPriority.MEDIUM;
    private AlertStatus status = AlertStatus.ACTIVE;

    private List<ConditionGroup> conditionGroups = new ArrayList<>();
    private AnomalyConfig anomalyConfig;

    private Frequency frequency = new Frequency();
    private QuietHours quietHours = new QuietHours();

    private boolean notifyViaApp = true;
    private boolean notifyViaPush = true;
    private boolean notifyViaEmail;

    private Instant createdAt;
    private Instant expiresAt;

    // --- bookkeeping ---
    private Instant lastTriggeredAt;
    private int triggeredCount;
    private Instant snoozedUntil;

    /** No-arg constructor required by SnakeYAML. */
    public Alert() {
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the definition is complete and its policies are within
     * legal ranges.
     *
     * <p>
     * Condition field and operator names are deliberately not checked here;
     * an unknown name only disables that one condition at evaluation time.
     * </p>
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String owner = name != null ? name : id;

        if (id == null || id.isBlank()) {
            errors.add("Alert 'id' is required");
        }
        if (ticker == null || ticker.isBlank()) {
            errors.add("Alert '" + owner + "' requires 'ticker'");
        }
        if (name == null || name.isBlank() || name.length() > 100) {
            errors.add("Alert '" + owner + "' requires a 'name' of 1 to 100 characters");
        }
        if (description != null && description.length() > 500) {
            errors.add("Alert '" + owner + "' 'description' must be at most 500 characters");
        }
        if (type == null) {
            errors.add("Alert '" + owner + "' requires 'type'");
        } else if ((type == AlertType.THRESHOLD || type == AlertType.MULTI_CONDITION)
                && conditionGroups.stream().allMatch(g -> g.getConditions().isEmpty())) {
            errors.add("Alert '" + owner + "' of type " + type + " requires at least one condition");
        }
        if (status == null) {
            errors.add("Alert '" + owner + "' requires 'status'");
        }
        if (triggeredCount < 0) {
            errors.add("Alert '" + owner + "' 'triggeredCount' must be >= 0");
        }

        if (frequency == null) {
            errors.add("Alert '" + owner + "' requires 'frequency'");
        } else {
            frequency.collectErrors(owner, errors);
        }
        if (quietHours == null) {
            errors.add("Alert '" + owner + "' requires 'quietHours'");
        } else {
            quietHours.collectErrors(owner, errors);
        }
        if (anomalyConfig != null) {
            anomalyConfig.collectErrors(owner, errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid Alert: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Bookkeeping
    // ---------------------------------------------------------------

    /**
     * Record that the alert fired at {@code at}.
     *
     * @param at trigger instant; must not be {@code null}
     */
    public void recordTrigger(Instant at) {
        this.lastTriggeredAt = Objects.requireNonNull(at, "trigger instant must not be null");
        this.triggeredCount++;
    }

    /**
     * @return the anomaly configuration, or the defaults when none is set
     */
    public AnomalyConfig effectiveAnomalyConfig() {
        return anomalyConfig != null ? anomalyConfig : AnomalyConfig.defaults();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for programmatic construction, mainly in tests and
     * embedding code. Policies not set keep their defaults.
     */
    public static class Builder {
        private final Alert alert = new Alert();

        public Builder id(String id) {
            alert.setId(id);
            return this;
        }

        public Builder userId(String userId) {
            alert.setUserId(userId);
            return this;
        }

        public Builder ticker(String ticker) {
            alert.setTicker(ticker);
            return this;
        }

        public Builder name(String name) {
            alert.setName(name);
            return this;
        }

        public Builder type(AlertType type) {
            alert.setType(type);
            return this;
        }

        public Builder priority(AlertPriority priority) {
            alert.setPriority(priority);
            return this;
        }

        public Builder status(AlertStatus status) {
            alert.setStatus(status);
            return this;
        }

        public Builder conditionGroup(ConditionGroup group) {
            alert.conditionGroups.add(Objects.requireNonNull(group, "group must not be null"));
            return this;
        }

        public Builder anomalyConfig(AnomalyConfig anomalyConfig) {
            alert.setAnomalyConfig(anomalyConfig);
            return this;
        }

        public Builder frequency(Frequency frequency) {
            alert.setFrequency(frequency);
            return this;
        }

        public Builder quietHours(QuietHours quietHours) {
            alert.setQuietHours(quietHours);
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            alert.setExpiresAt(expiresAt);
            return this;
        }

        public Builder lastTriggeredAt(Instant lastTriggeredAt) {
            alert.setLastTriggeredAt(lastTriggeredAt);
            return this;
        }

        /**
         * @return the validated alert
         * @throws IllegalStateException if the alert is invalid
         */
        public Alert build() {
            alert.validate();
            return alert;
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTicker() {
        return ticker;
    }

    public void setTicker(String ticker) {
        this.ticker = ticker;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public AlertType getType() {
        return type;
    }

    public void setType(AlertType type) {
        this.type = type;
    }

    public AlertPriority getPriority() {
        return priority;
    }

    public void setPriority(AlertPriority priority) {
        this.priority = priority;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    /**
     * @return unmodifiable view of the condition groups
     */
    public List<ConditionGroup> getConditionGroups() {
        return Collections.unmodifiableList(conditionGroups);
    }

    public void setConditionGroups(List<ConditionGroup> conditionGroups) {
        this.conditionGroups = conditionGroups != null ? new ArrayList<>(conditionGroups) : new ArrayList<>();
    }

    public AnomalyConfig getAnomalyConfig() {
        return anomalyConfig;
    }

    public void setAnomalyConfig(AnomalyConfig anomalyConfig) {
        this.anomalyConfig = anomalyConfig;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public void setFrequency(Frequency frequency) {
        this.frequency = frequency;
    }

    public QuietHours getQuietHours() {
        return quietHours;
    }

    public void setQuietHours(QuietHours quietHours) {
        this.quietHours = quietHours;
    }

    public boolean isNotifyViaApp() {
        return notifyViaApp;
    }

    public void setNotifyViaApp(boolean notifyViaApp) {
        this.notifyViaApp = notifyViaApp;
    }

    public boolean isNotifyViaPush() {
        return notifyViaPush;
    }

    public void setNotifyViaPush(boolean notifyViaPush) {
        this.notifyViaPush = notifyViaPush;
    }

    public boolean isNotifyViaEmail() {
        return notifyViaEmail;
    }

    public void setNotifyViaEmail(boolean notifyViaEmail) {
        this.notifyViaEmail = notifyViaEmail;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getLastTriggeredAt() {
        return lastTriggeredAt;
    }

    public void setLastTriggeredAt(Instant lastTriggeredAt) {
        this.lastTriggeredAt = lastTriggeredAt;
    }

    public int getTriggeredCount() {
        return triggeredCount;
    }

    public void setTriggeredCount(int triggeredCount) {
        this.triggeredCount = triggeredCount;
    }

    public Instant getSnoozedUntil() {
        return snoozedUntil;
    }

    public void setSnoozedUntil(Instant snoozedUntil) {
        this.snoozedUntil = snoozedUntil;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", ticker='" + ticker + '\'' +
                ", name='" + name + '\'' +
                ", type=" + type +
                ", status=" + status +
                ", triggeredCount=" + triggeredCount +
                '}';
    }
}
