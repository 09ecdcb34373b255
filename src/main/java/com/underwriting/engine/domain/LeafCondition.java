package com.underwriting.engine.domain;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compares a single field of the case context against a value.
 * <p>
 * Field paths support three shapes besides plain dot paths:
 * <ul>
 *   <li>{@code medicalDisclosures[].conditionName} - per-element comparison</li>
 *   <li>{@code riskFactors[severity=high].count} - filtered element count</li>
 *   <li>{@code medications.count} - list length</li>
 * </ul>
 * <p>
 * For {@link Operator#MATCHES} the pattern is compiled once here, so an invalid
 * expression fails when the rule is loaded rather than during evaluation.
 * Patterns are taken verbatim from rule configuration; building rules from
 * untrusted input would expose the engine to catastrophic backtracking
 * (ReDoS) and should not be done without vetting the expressions first.
 */
public final class LeafCondition extends Condition {

    private final String field;
    private final Operator operator;
    private final ConditionValue value;
    private final boolean caseInsensitive;
    private final Pattern pattern;

    public LeafCondition(String field, Operator operator, ConditionValue value, boolean caseInsensitive) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value;
        this.caseInsensitive = caseInsensitive;
        this.pattern = operator == Operator.MATCHES && value != null
                ? Pattern.compile(value.asText(), caseInsensitive ? Pattern.CASE_INSENSITIVE : 0)
                : null;
    }

    public LeafCondition(String field, Operator operator, ConditionValue value) {
        this(field, operator, value, false);
    }

    public static LeafCondition of(String field, String operator, Object value) {
        return of(field, operator, value, false);
    }

    public static LeafCondition of(String field, String operator, Object value, boolean caseInsensitive) {
        Operator op = Operator.fromSymbol(operator);
        if (op == null) {
            throw new IllegalArgumentException("Unknown operator: " + operator);
        }
        return new LeafCondition(field, op, ConditionValue.of(value), caseInsensitive);
    }

    @Override
    public boolean isCompound() {
        return false;
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public ConditionValue getValue() {
        return value;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Precompiled pattern for {@code matches}, {@code null} for other operators.
     */
    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LeafCondition that = (LeafCondition) o;
        return caseInsensitive == that.caseInsensitive &&
               field.equals(that.field) &&
               operator == that.operator &&
               Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value, caseInsensitive);
    }

    @Override
    public String toString() {
        return field + " " + operator.symbol() + " " + value + (caseInsensitive ? " (ci)" : "");
    }
}
