package com.alertsentinel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Tuning for {@link AlertType#ANOMALY} alerts.
 *
 * <p>
 * Field defaults are the values used when an anomaly alert carries no
 * explicit configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Absolute day-over-day price move, in percent, that counts as a shock. */
    private double priceChangeThreshold = 15;

    /** Volume at or above {@code averageVolume × multiplier} counts as a shock. */
    private double volumeSpikeMultiplier = 5;

    /** Z-score at or above which the current price is an outlier. */
    private double statisticalSigma = 2;

    /** Suppress the trigger when recent news explains the move. */
    private boolean requiresNoNews = true;

    private int newsLookbackHours = 24;

    /**
     * @return a configuration holding the default values
     */
    public static AnomalyConfig defaults() {
        return new AnomalyConfig();
    }

    /**
     * Append validation errors to {@code errors}.
     *
     * @param owner  alert name used in messages
     * @param errors sink for error messages
     */
    void collectErrors(String owner, List<String> errors) {
        if (priceChangeThreshold < 0 || priceChangeThreshold > 100) {
            errors.add("Alert '" + owner + "' anomaly 'priceChangeThreshold' must be in [0, 100]");
        }
        if (volumeSpikeMultiplier < 1 || volumeSpikeMultiplier > 100) {
            errors.add("Alert '" + owner + "' anomaly 'volumeSpikeMultiplier' must be in [1, 100]");
        }
        if (statisticalSigma < 0.5 || statisticalSigma > 5) {
            errors.add("Alert '" + owner + "' anomaly 'statisticalSigma' must be in [0.5, 5]");
        }
        if (newsLookbackHours < 1 || newsLookbackHours > 168) {
            errors.add("Alert '" + owner + "' anomaly 'newsLookbackHours' must be in [1, 168]");
        }
    }

    public double getPriceChangeThreshold() {
        return priceChangeThreshold;
    }

    public void setPriceChangeThreshold(double priceChangeThreshold) {
        this.priceChangeThreshold = priceChangeThreshold;
    }

    public double getVolumeSpikeMultiplier() {
        return volumeSpikeMultiplier;
    }

    public void setVolumeSpikeMultiplier(double volumeSpikeMultiplier) {
        this.volumeSpikeMultiplier = volumeSpikeMultiplier;
    }

    public double getStatisticalSigma() {
        return statisticalSigma;
    }

    public void setStatisticalSigma(double statisticalSigma) {
        this.statisticalSigma = statisticalSigma;
    }

    public boolean isRequiresNoNews() {
        return requiresNoNews;
    }

    public void setRequiresNoNews(boolean requiresNoNews) {
        this.requiresNoNews = requiresNoNews;
    }

    public int getNewsLookbackHours() {
        return newsLookbackHours;
    }

    public void setNewsLookbackHours(int newsLookbackHours) {
        this.newsLookbackHours = newsLookbackHours;
    }

    @Override
    public String toString() {
        return "AnomalyConfig{" +
                "priceChangeThreshold=" + priceChangeThreshold +
                ", volumeSpikeMultiplier=" + volumeSpikeMultiplier +
                ", statisticalSigma=" + statisticalSigma +
                ", requiresNoNews=" + requiresNoNews +
                ", newsLookbackHours=" + newsLookbackHours +
                '}';
    }
}
