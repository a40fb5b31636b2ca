package com.alertsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Ordered list of {@link Condition}s combined with {@link GroupLogic}.
 *
 * @since 1.0.0
 */
public class ConditionGroup implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private GroupLogic logic = GroupLogic.AND;
    private List<Condition> conditions = new ArrayList<>();

    /** No-arg constructor required by SnakeYAML. */
    public ConditionGroup() {
    }

    /**
     * @param logic      how the conditions combine; must not be {@code null}
     * @param conditions the conditions, in evaluation order
     * @return a new group with a random id
     */
    public static ConditionGroup of(GroupLogic logic, Condition... conditions) {
        ConditionGroup group = new ConditionGroup();
        group.setId(UUID.randomUUID().toString());
        group.setLogic(Objects.requireNonNull(logic, "logic must not be null"));
        group.setConditions(Arrays.asList(conditions));
        return group;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public GroupLogic getLogic() {
        return logic;
    }

    public void setLogic(GroupLogic logic) {
        this.logic = logic != null ? logic : GroupLogic.AND;
    }

    /**
     * @return unmodifiable view of the conditions
     */
    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ConditionGroup{logic=" + logic + ", conditions=" + conditions + '}';
    }
}
