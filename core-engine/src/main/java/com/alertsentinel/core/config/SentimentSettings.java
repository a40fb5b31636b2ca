package com.alertsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sentiment section of the alerts configuration.
 *
 * <pre>
 * sentiment:
 *   triggerThreshold: -0.3
 *   negativeKeywords: [lawsuit, downgrade]
 *   positiveKeywords: [upgrade, record profit]
 * </pre>
 *
 * <p>
 * Empty keyword lists mean "use the built-in lexicon".
 * </p>
 *
 * @since 1.0.0
 */
public class SentimentSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** News alerts fire when the averaged sentiment is strictly below this value. */
    public static final double DEFAULT_TRIGGER_THRESHOLD = -0.3;

    private double triggerThreshold = DEFAULT_TRIGGER_THRESHOLD;
    private List<String> positiveKeywords = new ArrayList<>();
    private List<String> negativeKeywords = new ArrayList<>();

    /**
     * @return settings with the default threshold and the built-in lexicon
     */
    public static SentimentSettings defaults() {
        return new SentimentSettings();
    }

    /**
     * @throws IllegalStateException if the threshold is outside [-1, 1]
     */
    public void validate() {
        if (triggerThreshold < -1 || triggerThreshold > 1) {
            throw new IllegalStateException(
                    "Sentiment 'triggerThreshold' must be in [-1, 1], got: " + triggerThreshold);
        }
    }

    public double getTriggerThreshold() {
        return triggerThreshold;
    }

    public void setTriggerThreshold(double triggerThreshold) {
        this.triggerThreshold = triggerThreshold;
    }

    public List<String> getPositiveKeywords() {
        return Collections.unmodifiableList(positiveKeywords);
    }

    public void setPositiveKeywords(List<String> positiveKeywords) {
        this.positiveKeywords = positiveKeywords != null ? new ArrayList<>(positiveKeywords) : new ArrayList<>();
    }

    public List<String> getNegativeKeywords() {
        return Collections.unmodifiableList(negativeKeywords);
    }

    public void setNegativeKeywords(List<String> negativeKeywords) {
        this.negativeKeywords = negativeKeywords != null ? new ArrayList<>(negativeKeywords) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "SentimentSettings{" +
                "triggerThreshold=" + triggerThreshold +
                ", positiveKeywords=" + positiveKeywords.size() +
                ", negativeKeywords=" + negativeKeywords.size() +
                '}';
    }
}
