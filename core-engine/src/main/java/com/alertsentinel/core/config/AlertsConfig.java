package com.alertsentinel.core.config;

import com.alertsentinel.core.model.Alert;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the alerts YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * sentiment:
 *   triggerThreshold: -0.3
 * alerts:
 *   - id: aapl-breakout
 *     ticker: AAPL
 *     name: AAPL breakout
 *     type: THRESHOLD
 *     conditionGroups:
 *       - logic: AND
 *         conditions:
 *           - field: PRICE
 *             operator: GREATER_THAN
 *             value: 200
 *     frequency:
 *       maxPerDay: 3
 *       cooldownMinutes: 60
 *     quietHours:
 *       enabled: true
 *       start: "22:00"
 *       end: "08:00"
 * </pre>
 *
 * <p>
 * Times must be quoted; unquoted {@code 22:00} is read by YAML 1.1 as a
 * base-60 integer.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<Alert> alerts = new ArrayList<>();
    private SentimentSettings sentiment = SentimentSettings.defaults();

    /**
     * @return unmodifiable list of alert definitions
     */
    public List<Alert> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    /**
     * Set the alerts list (used by SnakeYAML during deserialization).
     *
     * @param alerts the alert definitions
     */
    public void setAlerts(List<Alert> alerts) {
        this.alerts = alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
    }

    public SentimentSettings getSentiment() {
        return sentiment;
    }

    public void setSentiment(SentimentSettings sentiment) {
        this.sentiment = sentiment != null ? sentiment : SentimentSettings.defaults();
    }

    /**
     * Validate every alert and the sentiment section.
     *
     * <p>
     * Collects all errors, including duplicate alert ids, and throws a single
     * exception listing them.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < alerts.size(); i++) {
            Alert alert = alerts.get(i);
            if (alert == null) {
                errors.add("Alert at index " + i + " is null");
                continue;
            }
            try {
                alert.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (alert.getId() != null && !ids.add(alert.getId())) {
                errors.add("Duplicate alert id '" + alert.getId() + "'");
            }
        }

        try {
            sentiment.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Alerts configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "AlertsConfig{alerts=" + alerts.size() + ", sentiment=" + sentiment + '}';
    }
}
