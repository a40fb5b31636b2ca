package com.alertsentinel.core.model;

/**
 * @since 1.0.0
 */
public enum AlertPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
