package com.alertsentinel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Rate limiting and batching policy of an {@link Alert}.
 *
 * @since 1.0.0
 */
public class Frequency implements Serializable {

    private static final long serialVersionUID = 1L;

    private int maxPerDay = 3;
    private int cooldownMinutes = 60;
    private boolean batchingEnabled = true;
    private int batchingWindowMinutes = 15;

    void collectErrors(String owner, List<String> errors) {
        if (maxPerDay < 1 || maxPerDay > 100) {
            errors.add("Alert '" + owner + "' frequency 'maxPerDay' must be in [1, 100]");
        }
        if (cooldownMinutes < 0) {
            errors.add("Alert '" + owner + "' frequency 'cooldownMinutes' must be >= 0");
        }
        if (batchingWindowMinutes < 1 || batchingWindowMinutes > 1440) {
            errors.add("Alert '" + owner + "' frequency 'batchingWindowMinutes' must be in [1, 1440]");
        }
    }

    public int getMaxPerDay() {
        return maxPerDay;
    }

    public void setMaxPerDay(int maxPerDay) {
        this.maxPerDay = maxPerDay;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public boolean isBatchingEnabled() {
        return batchingEnabled;
    }

    public void setBatchingEnabled(boolean batchingEnabled) {
        this.batchingEnabled = batchingEnabled;
    }

    public int getBatchingWindowMinutes() {
        return batchingWindowMinutes;
    }

    public void setBatchingWindowMinutes(int batchingWindowMinutes) {
        this.batchingWindowMinutes = batchingWindowMinutes;
    }

    @Override
    public String toString() {
        return "Frequency{" +
                "maxPerDay=" + maxPerDay +
                ", cooldownMinutes=" + cooldownMinutes +
                ", batchingEnabled=" + batchingEnabled +
                ", batchingWindowMinutes=" + batchingWindowMinutes +
                '}';
    }
}
