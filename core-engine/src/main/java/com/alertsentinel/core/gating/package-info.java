/**
 * Pre-evaluation gating: status, expiry, quiet hours, cooldown and the daily
 * trigger cap.
 *
 * <p>
 * The daily cap consults a
 * {@link com.alertsentinel.core.gating.DailyTriggerCounter}; the count is never
 * assumed to be zero.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.gating;
