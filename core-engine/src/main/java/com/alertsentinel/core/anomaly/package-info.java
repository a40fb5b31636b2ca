/**
 * Statistical anomaly detection for {@code ANOMALY} alerts.
 *
 * <p>
 * {@link com.alertsentinel.core.anomaly.AnomalyDetector} computes three
 * independent signals over the current observation and a caller-supplied
 * price history, then applies the news gate. The z-score signal is computed
 * by {@link com.alertsentinel.core.anomaly.PriceStatistics}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.anomaly;
