package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.Alert;

/**
 * Contract for the per-type evaluation paths.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: the result depends only on
 * the alert definition and the context, so one instance may be shared by
 * every alert of its type and called from several threads at once.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertEvaluator {

    /**
     * Decide whether {@code alert} fires for the given tick. Gating (status,
     * quiet hours, cooldown, daily cap) has already been applied.
     *
     * @param alert   the alert definition
     * @param context the tick
     * @return the evaluation result
     */
    EvaluationResult evaluate(Alert alert, EvaluationContext context);
}
