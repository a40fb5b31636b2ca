/**
 * Lightweight keyword-based news sentiment.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.sentiment;
