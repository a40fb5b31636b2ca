/**
 * Field resolution, condition and condition-group evaluation, and the
 * per-type {@link com.alertsentinel.core.evaluation.AlertEvaluator} contract.
 *
 * <p>
 * Everything here is stateless and safe to call concurrently for different
 * alerts. A condition whose field is missing, or whose field or operator name
 * is unknown, evaluates unmatched instead of throwing.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.evaluation;
