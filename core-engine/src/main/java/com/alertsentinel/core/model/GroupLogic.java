package com.alertsentinel.core.model;

/**
 * Boolean combinator for the conditions of a {@link ConditionGroup}.
 *
 * @since 1.0.0
 */
public enum GroupLogic {
    /** Every condition must match. */
    AND,
    /** At least one condition must match. */
    OR
}
