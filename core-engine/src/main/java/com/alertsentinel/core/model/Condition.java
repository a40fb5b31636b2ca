package com.alertsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * A single comparison of a market field against a threshold.
 *
 * <p>
 * {@code field} and {@code operator} are kept as the raw configured names so
 * that one misspelled condition does not reject the whole rule set at load
 * time. They are resolved against {@link ConditionField} and
 * {@link ComparisonOperator} at evaluation time; an unknown name makes the
 * condition evaluate as unmatched.
 * </p>
 *
 * @since 1.0.0
 */
public class Condition implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String field;
    private String operator;
    private double value;

    /** No-arg constructor required by SnakeYAML. */
    public Condition() {
    }

    /**
     * Create a condition from typed field and operator.
     *
     * @param field    the field to compare; must not be {@code null}
     * @param operator the operator; must not be {@code null}
     * @param value    the threshold
     * @return a new condition with a random id
     */
    public static Condition of(ConditionField field, ComparisonOperator operator, double value) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Condition condition = new Condition();
        condition.setId(UUID.randomUUID().toString());
        condition.setField(field.name());
        condition.setOperator(operator.name());
        condition.setValue(value);
        return condition;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Condition that))
            return false;
        return Double.compare(value, that.value) == 0
                && Objects.equals(field, that.field)
                && Objects.equals(operator, that.operator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return "Condition{" + field + ' ' + operator + ' ' + value + '}';
    }
}
