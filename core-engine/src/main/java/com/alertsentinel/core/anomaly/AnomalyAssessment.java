package com.alertsentinel.core.anomaly;

import com.alertsentinel.core.evaluation.EvaluationResult;

import java.util.List;
import java.util.Optional;

/**
 * The three anomaly signals for one tick and the news gate applied to them.
 *
 * <p>
 * An anomaly is <em>present</em> when any signal fired and
 * <em>triggerable</em> when it is present and not explained by news.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyAssessment {

    static final String EXPLAINED_BY_NEWS = "Anomaly detected but explained by news";

    private final double priceChangePercent;
    private final boolean priceShock;
    private final boolean volumeShock;
    private final boolean statisticalOutlier;
    private final Double zScore;
    private final int recentNewsCount;
    private final boolean explainedByNews;
    private final List<String> signals;

    AnomalyAssessment(double priceChangePercent, boolean priceShock, boolean volumeShock,
            boolean statisticalOutlier, Double zScore, int recentNewsCount,
            boolean explainedByNews, List<String> signals) {
        this.priceChangePercent = priceChangePercent;
        this.priceShock = priceShock;
        this.volumeShock = volumeShock;
        this.statisticalOutlier = statisticalOutlier;
        this.zScore = zScore;
        this.recentNewsCount = recentNewsCount;
        this.explainedByNews = explainedByNews;
        this.signals = List.copyOf(signals);
    }

    public boolean isAnomalyPresent() {
        return priceShock || volumeShock || statisticalOutlier;
    }

    public boolean isTriggerable() {
        return isAnomalyPresent() && !explainedByNews;
    }

    /**
     * @return the evaluation result reported for an anomaly alert
     */
    public EvaluationResult toResult() {
        if (explainedByNews) {
            return EvaluationResult.notTriggered(EXPLAINED_BY_NEWS, signals);
        }
        if (isTriggerable()) {
            return EvaluationResult.triggered("Anomaly detected: " + String.join("; ", signals), signals);
        }
        return EvaluationResult.notTriggered("No anomaly detected");
    }

    public double getPriceChangePercent() {
        return priceChangePercent;
    }

    public boolean isPriceShock() {
        return priceShock;
    }

    public boolean isVolumeShock() {
        return volumeShock;
    }

    public boolean isStatisticalOutlier() {
        return statisticalOutlier;
    }

    /**
     * @return the z-score, or empty when the history was too short
     */
    public Optional<Double> getZScore() {
        return Optional.ofNullable(zScore);
    }

    public int getRecentNewsCount() {
        return recentNewsCount;
    }

    public boolean isExplainedByNews() {
        return explainedByNews;
    }

    public List<String> getSignals() {
        return signals;
    }

    @Override
    public String toString() {
        return "AnomalyAssessment{" +
                "priceShock=" + priceShock +
                ", volumeShock=" + volumeShock +
                ", statisticalOutlier=" + statisticalOutlier +
                ", explainedByNews=" + explainedByNews +
                ", signals=" + signals +
                '}';
    }
}
