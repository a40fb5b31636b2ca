package com.alertsentinel.core.anomaly;

import com.alertsentinel.core.model.AnomalyConfig;
import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.model.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Price-shock, volume-shock and z-score outlier detection.
 *
 * <h3>Signals</h3>
 * <ul>
 * <li><strong>Price shock</strong>: {@code |priceChange%| >= priceChangeThreshold};
 * the change is 0 when the previous close is 0</li>
 * <li><strong>Volume shock</strong>: {@code volume >= averageVolume × multiplier};
 * skipped without a positive average volume</li>
 * <li><strong>Statistical outlier</strong>: {@code zScore >= statisticalSigma}
 * over the supplied history; skipped below {@value #MIN_HISTORY_SIZE} points</li>
 * </ul>
 *
 * <h3>News gate</h3>
 * <p>
 * With {@code requiresNoNews}, a present anomaly is reported as explained by
 * news, and not triggered, when any article was published within
 * {@code newsLookbackHours} before the observation.
 * </p>
 *
 * <p>
 * This detector is <strong>stateless</strong>; history is supplied by the
 * caller on every call.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /** Minimum number of history points before the outlier signal engages. */
    public static final int MIN_HISTORY_SIZE = 20;

    private AnomalyDetector() {
        // utility class, not instantiable
    }

    /**
     * @param config      anomaly tuning; must not be {@code null}
     * @param observation current market data; must not be {@code null}
     * @param news        current news, may be {@code null}
     * @param history     price history, may be {@code null}
     * @return the assessment
     */
    public static AnomalyAssessment assess(AnomalyConfig config, MarketObservation observation,
            NewsContext news, List<PricePoint> history) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(observation, "observation must not be null");

        List<String> signals = new ArrayList<>();

        // 1. Price shock
        double previousClose = observation.getPreviousClose();
        double priceChange = previousClose == 0
                ? 0
                : (observation.getPrice() - previousClose) * 100 / previousClose;
        boolean priceShock = Math.abs(priceChange) >= config.getPriceChangeThreshold();
        if (priceShock) {
            signals.add(String.format(Locale.ROOT, "Price change: %.2f%% (threshold: %s%%)",
                    priceChange, trim(config.getPriceChangeThreshold())));
        }

        // 2. Volume shock
        double averageVolume = observation.getAverageVolume().orElse(0.0);
        boolean volumeShock = averageVolume > 0
                && observation.getVolume() >= averageVolume * config.getVolumeSpikeMultiplier();
        if (volumeShock) {
            signals.add(String.format(Locale.ROOT, "Volume spike: %.1fx average",
                    observation.getVolume() / averageVolume));
        }

        // 3. Statistical outlier
        boolean outlier = false;
        Double zScore = null;
        if (history != null && history.size() >= MIN_HISTORY_SIZE) {
            PriceStatistics stats = PriceStatistics.of(history);
            zScore = stats.zScore(observation.getPrice());
            outlier = zScore >= config.getStatisticalSigma();
            if (outlier) {
                signals.add(String.format(Locale.ROOT, "Statistical outlier: %.2fσ from mean (mean=%.2f, stdDev=%.2f)",
                        zScore, stats.getMean(), stats.getStdDev()));
            }
        } else {
            LOG.trace("{}: {} history point(s), statistical outlier check skipped",
                    observation.getTicker(), history == null ? 0 : history.size());
        }

        // 4. News gate
        int recentNews = recentNewsCount(config, observation, news);
        boolean anomalyPresent = priceShock || volumeShock || outlier;
        boolean explainedByNews = anomalyPresent && config.isRequiresNoNews() && recentNews > 0;
        if (explainedByNews) {
            LOG.debug("{}: anomaly explained by {} recent news article(s)", observation.getTicker(), recentNews);
        }

        return new AnomalyAssessment(priceChange, priceShock, volumeShock, outlier, zScore,
                recentNews, explainedByNews, signals);
    }

    private static int recentNewsCount(AnomalyConfig config, MarketObservation observation, NewsContext news) {
        if (news == null || !news.hasNews()) {
            return 0;
        }
        Instant until = observation.getTimestamp();
        Instant since = until.minus(Duration.ofHours(config.getNewsLookbackHours()));
        return news.countPublishedBetween(since, until);
    }

    private static String trim(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
