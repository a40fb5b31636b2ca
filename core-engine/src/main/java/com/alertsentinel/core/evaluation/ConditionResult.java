package com.alertsentinel.core.evaluation;

import java.util.Objects;

/**
 * Verdict of a single condition with its human-readable description.
 *
 * @since 1.0.0
 */
public final class ConditionResult {

    private final boolean matched;
    private final String description;

    private ConditionResult(boolean matched, String description) {
        this.matched = matched;
        this.description = Objects.requireNonNull(description, "description must not be null");
    }

    public static ConditionResult matched(String description) {
        return new ConditionResult(true, description);
    }

    public static ConditionResult unmatched(String description) {
        return new ConditionResult(false, description);
    }

    static ConditionResult of(boolean matched, String description) {
        return new ConditionResult(matched, description);
    }

    public boolean isMatched() {
        return matched;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return (matched ? "MATCHED " : "UNMATCHED ") + description;
    }
}
