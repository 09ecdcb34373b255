package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.underwriting.engine.domain.Condition.Operator;
import com.underwriting.engine.domain.ConditionValue;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Applies a leaf operator to a resolved field value.
 * <p>
 * Equality is strict: a number never equals its string form. Ordering
 * operators coerce both sides to numbers first, and an operand that does not
 * coerce makes the comparison false.
 */
final class ValueComparator {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private ValueComparator() {
    }

    static boolean compare(Optional<JsonNode> fieldValue, Operator operator, ConditionValue compareValue,
                           boolean caseInsensitive, Pattern pattern) {
        if (operator == Operator.EXISTS) {
            return fieldValue.isPresent();
        }
        if (operator == Operator.NOT_EXISTS) {
            return fieldValue.isEmpty();
        }
        if (fieldValue.isEmpty()) {
            return operator == Operator.NE && compareValue != null;
        }

        JsonNode field = fieldValue.get();
        return switch (operator) {
            case EQ -> strictEquals(field, compareValue, caseInsensitive);
            case NE -> !strictEquals(field, compareValue, caseInsensitive);
            case LT -> {
                double a = toNumber(field), b = toNumber(compareValue);
                yield a < b;
            }
            case GT -> {
                double a = toNumber(field), b = toNumber(compareValue);
                yield a > b;
            }
            case LTE -> {
                double a = toNumber(field), b = toNumber(compareValue);
                yield a <= b;
            }
            case GTE -> {
                double a = toNumber(field), b = toNumber(compareValue);
                yield a >= b;
            }
            case CONTAINS -> contains(field, compareValue, caseInsensitive);
            case IN -> in(field, compareValue, caseInsensitive);
            case MATCHES -> pattern != null && field.isTextual() && pattern.matcher(field.textValue()).find();
            default -> false;
        };
    }

    private static boolean contains(JsonNode field, ConditionValue compareValue, boolean caseInsensitive) {
        if (compareValue == null) {
            return false;
        }
        String needle = caseInsensitive && compareValue instanceof ConditionValue.Text text
                ? text.lowerCase().value()
                : compareValue.asText();
        if (field.isTextual()) {
            String haystack = caseInsensitive ? lower(field.textValue()) : field.textValue();
            return haystack.contains(needle);
        }
        if (field.isArray()) {
            for (JsonNode item : field) {
                boolean hit = caseInsensitive && item.isTextual()
                        ? lower(item.textValue()).contains(needle)
                        : strictEquals(item, compareValue, false);
                if (hit) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean in(JsonNode field, ConditionValue compareValue, boolean caseInsensitive) {
        if (!(compareValue instanceof ConditionValue.ListValue list)) {
            return false;
        }
        if (caseInsensitive && field.isTextual()) {
            String candidate = lower(field.textValue());
            for (ConditionValue option : list.values()) {
                boolean hit = option instanceof ConditionValue.Text text
                        ? text.lowerCase().value().equals(candidate)
                        : strictEquals(field, option, false);
                if (hit) {
                    return true;
                }
            }
            return false;
        }
        for (ConditionValue option : list.values()) {
            if (strictEquals(field, option, false)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Same-type equality. Lists never equal a field value.
     */
    static boolean strictEquals(JsonNode field, ConditionValue value, boolean caseInsensitive) {
        if (value == null) {
            return false;
        }
        return switch (value.kind()) {
            case TEXT -> {
                if (!field.isTextual()) {
                    yield false;
                }
                String expected = ((ConditionValue.Text) value).value();
                yield caseInsensitive
                        ? lower(field.textValue()).equals(lower(expected))
                        : field.textValue().equals(expected);
            }
            case NUMBER -> field.isNumber() && field.doubleValue() == ((ConditionValue.Numeric) value).value();
            case BOOL -> field.isBoolean() && field.booleanValue() == ((ConditionValue.Bool) value).value();
            case LIST -> false;
        };
    }

    static double toNumber(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1 : 0;
        }
        if (node.isTextual()) {
            return parseNumber(node.textValue());
        }
        return Double.NaN;
    }

    static double toNumber(ConditionValue value) {
        if (value == null) {
            return Double.NaN;
        }
        return switch (value.kind()) {
            case NUMBER -> ((ConditionValue.Numeric) value).value();
            case BOOL -> ((ConditionValue.Bool) value).value() ? 1 : 0;
            case TEXT -> parseNumber(((ConditionValue.Text) value).value());
            case LIST -> Double.NaN;
        };
    }

    /**
     * Numeric reading of a string: blank is zero, anything that is not a plain
     * decimal or an infinity is NaN.
     */
    static double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        switch (trimmed) {
            case "Infinity", "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        if (!DECIMAL.matcher(trimmed).matches()) {
            return Double.NaN;
        }
        return Double.parseDouble(trimmed);
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
