package com.alertsentinel.core.model;

/**
 * What the user did with a {@link TriggerEvent}. The engine always creates
 * events as {@link #PENDING}; the other values are set by the presentation
 * layer.
 *
 * @since 1.0.0
 */
public enum UserAction {
    PENDING,
    VIEWED,
    DISMISSED,
    SNOOZED
}
