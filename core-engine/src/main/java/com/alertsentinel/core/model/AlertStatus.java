package com.alertsentinel.core.model;

/**
 * Lifecycle status of an {@link Alert}. Only {@link #ACTIVE} alerts are
 * evaluated.
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    ACTIVE,
    TRIGGERED,
    SNOOZED,
    DISMISSED,
    EXPIRED,
    DISABLED
}
