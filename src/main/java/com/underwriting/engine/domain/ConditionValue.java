package com.underwriting.engine.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Comparison operand of a leaf condition.
 * <p>
 * Closed set of kinds: text, number, boolean, or a list of further values.
 * The constructor is private so the only subclasses are the nested ones below,
 * and operator dispatch can switch exhaustively over {@link Kind}.
 */
public abstract class ConditionValue {

    public enum Kind {
        TEXT, NUMBER, BOOL, LIST
    }

    private ConditionValue() {
    }

    public abstract Kind kind();

    /**
     * String form as used by substring and regex operators.
     */
    public abstract String asText();

    public static ConditionValue text(String value) {
        return new Text(value);
    }

    public static ConditionValue number(double value) {
        return new Numeric(value);
    }

    public static ConditionValue bool(boolean value) {
        return new Bool(value);
    }

    public static ConditionValue list(List<ConditionValue> values) {
        return new ListValue(values);
    }

    public static ConditionValue list(ConditionValue... values) {
        return new ListValue(List.of(values));
    }

    /**
     * Converts a JSON operand. JSON null or a missing node yields {@code null}.
     *
     * @throws IllegalArgumentException for JSON objects, which are not valid operands
     */
    public static ConditionValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return new Text(node.textValue());
        }
        if (node.isNumber()) {
            return new Numeric(node.doubleValue());
        }
        if (node.isBoolean()) {
            return new Bool(node.booleanValue());
        }
        if (node.isArray()) {
            List<ConditionValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new ListValue(items);
        }
        throw new IllegalArgumentException("Unsupported condition value: " + node);
    }

    /**
     * Converts a plain Java operand (String, Number, Boolean, List).
     */
    public static ConditionValue of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof ConditionValue conditionValue) {
            return conditionValue;
        }
        if (value instanceof String s) {
            return new Text(s);
        }
        if (value instanceof Number n) {
            return new Numeric(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return new Bool(b);
        }
        if (value instanceof List<?> list) {
            List<ConditionValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        throw new IllegalArgumentException("Unsupported condition value type: " + value.getClass().getName());
    }

    public static final class Text extends ConditionValue {
        private final String value;

        private Text(String value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public String value() {
            return value;
        }

        public Text lowerCase() {
            return new Text(value.toLowerCase(Locale.ROOT));
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Text other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "'" + value + "'";
        }
    }

    public static final class Numeric extends ConditionValue {
        private final double value;

        private Numeric(double value) {
            this.value = value;
        }

        public double value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String asText() {
            return formatNumber(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Numeric other && Double.compare(value, other.value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    public static final class Bool extends ConditionValue {
        private final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bool other && value == other.value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    public static final class ListValue extends ConditionValue {
        private final List<ConditionValue> values;

        private ListValue(List<ConditionValue> values) {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public List<ConditionValue> values() {
            return values;
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public String asText() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                ConditionValue item = values.get(i);
                sb.append(item != null ? item.asText() : "");
            }
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ListValue other && values.equals(other.values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    /**
     * Formats a number the way it reads in rule configuration: integral values
     * without a fractional part.
     */
    public static String formatNumber(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
