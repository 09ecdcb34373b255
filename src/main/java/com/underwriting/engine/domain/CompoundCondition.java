package com.underwriting.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AND/OR combination of ordered sub-conditions.
 */
public final class CompoundCondition extends Condition {

    public enum Logic {
        AND, OR;

        /**
         * @return the logic for {@code "AND"} / {@code "OR"}, or {@code null} otherwise
         */
        public static Logic fromString(String value) {
            if ("AND".equals(value)) {
                return AND;
            }
            if ("OR".equals(value)) {
                return OR;
            }
            return null;
        }
    }

    private final Logic logic;
    private final List<Condition> conditions;

    public CompoundCondition(Logic logic, List<Condition> conditions) {
        this.logic = Objects.requireNonNull(logic, "logic");
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public static CompoundCondition and(Condition... conditions) {
        return new CompoundCondition(Logic.AND, List.of(conditions));
    }

    public static CompoundCondition or(Condition... conditions) {
        return new CompoundCondition(Logic.OR, List.of(conditions));
    }

    @Override
    public boolean isCompound() {
        return true;
    }

    public Logic getLogic() {
        return logic;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompoundCondition that = (CompoundCondition) o;
        return logic == that.logic && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logic, conditions);
    }

    @Override
    public String toString() {
        return logic + conditions.toString();
    }
}
