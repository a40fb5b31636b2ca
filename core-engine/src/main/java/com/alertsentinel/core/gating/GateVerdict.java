package com.alertsentinel.core.gating;

/**
 * Result of the pre-evaluation gate, in check order. Only {@link #OPEN} lets
 * the alert be evaluated.
 *
 * @since 1.0.0
 */
public enum GateVerdict {
    OPEN,
    NOT_ACTIVE,
    EXPIRED,
    QUIET_HOURS,
    COOLDOWN,
    DAILY_LIMIT;

    public boolean isOpen() {
        return this == OPEN;
    }
}
