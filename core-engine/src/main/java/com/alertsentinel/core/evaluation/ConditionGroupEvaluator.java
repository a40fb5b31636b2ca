package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.Condition;
import com.alertsentinel.core.model.ConditionGroup;
import com.alertsentinel.core.model.GroupLogic;
import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates condition groups: each group is combined with its own
 * {@link GroupLogic}, and the alert fires when any group is satisfied.
 *
 * <p>
 * {@code conditionsMet} collects the matched descriptions of satisfied groups
 * only, in group order. A group without conditions is never satisfied.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConditionGroupEvaluator {

    private ConditionGroupEvaluator() {
        // utility class, not instantiable
    }

    /**
     * @param groups      condition groups; must not be {@code null}
     * @param observation current market data; must not be {@code null}
     * @param news        current news, may be {@code null}
     * @return the combined result
     */
    public static EvaluationResult evaluate(List<ConditionGroup> groups, MarketObservation observation,
            NewsContext news) {
        Objects.requireNonNull(groups, "groups must not be null");

        List<String> conditionsMet = new ArrayList<>();
        boolean triggered = false;

        for (ConditionGroup group : groups) {
            List<ConditionResult> results = new ArrayList<>();
            for (Condition condition : group.getConditions()) {
                results.add(ConditionEvaluator.evaluate(condition, observation, news));
            }

            if (isSatisfied(group.getLogic(), results)) {
                triggered = true;
                results.stream()
                        .filter(ConditionResult::isMatched)
                        .map(ConditionResult::getDescription)
                        .forEach(conditionsMet::add);
            }
        }

        return triggered
                ? EvaluationResult.triggered("Conditions met: " + String.join(", ", conditionsMet), conditionsMet)
                : EvaluationResult.notTriggered("No conditions met");
    }

    private static boolean isSatisfied(GroupLogic logic, List<ConditionResult> results) {
        if (results.isEmpty()) {
            return false;
        }
        return logic == GroupLogic.OR
                ? results.stream().anyMatch(ConditionResult::isMatched)
                : results.stream().allMatch(ConditionResult::isMatched);
    }
}
