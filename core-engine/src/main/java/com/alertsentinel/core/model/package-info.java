/**
 * Domain model of the alert engine.
 *
 * <ul>
 * <li>{@link com.alertsentinel.core.model.Alert}: watch rule with its
 * condition groups, anomaly tuning, frequency and quiet-hours policies</li>
 * <li>{@link com.alertsentinel.core.model.MarketObservation},
 * {@link com.alertsentinel.core.model.NewsContext},
 * {@link com.alertsentinel.core.model.PricePoint}: per-tick inputs</li>
 * <li>{@link com.alertsentinel.core.model.TriggerEvent}: output of a
 * firing alert</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.model;
