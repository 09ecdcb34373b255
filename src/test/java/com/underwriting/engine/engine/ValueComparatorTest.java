package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.underwriting.engine.domain.Condition.Operator;
import com.underwriting.engine.domain.ConditionValue;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ValueComparatorTest {

    private static boolean compare(JsonNode field, Operator op, ConditionValue value) {
        return ValueComparator.compare(Optional.ofNullable(field), op, value, false, null);
    }

    @Test
    void orderingCoercesNumericStrings() {
        assertThat(compare(TextNode.valueOf("42"), Operator.GT, ConditionValue.number(40))).isTrue();
        assertThat(compare(IntNode.valueOf(42), Operator.LTE, ConditionValue.text("42"))).isTrue();
    }

    @Test
    void orderingWithNonNumericIsFalse() {
        assertThat(compare(TextNode.valueOf("abc"), Operator.LT, ConditionValue.number(1))).isFalse();
        assertThat(compare(TextNode.valueOf("abc"), Operator.GTE, ConditionValue.number(1))).isFalse();
    }

    @Test
    void blankStringReadsAsZero() {
        assertThat(compare(TextNode.valueOf(" "), Operator.LT, ConditionValue.number(1))).isTrue();
    }

    @Test
    void containsOnArrayUsesStrictEquality() {
        JsonNode tags = JsonNodeFactory.instance.arrayNode().add("smoker").add(3);

        assertThat(compare(tags, Operator.CONTAINS, ConditionValue.text("smoker"))).isTrue();
        assertThat(compare(tags, Operator.CONTAINS, ConditionValue.number(3))).isTrue();
        assertThat(compare(tags, Operator.CONTAINS, ConditionValue.text("smo"))).isFalse();
    }

    @Test
    void containsOnArrayIgnoringCaseMatchesSubstrings() {
        JsonNode tags = JsonNodeFactory.instance.arrayNode().add("Former Smoker");

        assertThat(ValueComparator.compare(Optional.of(tags), Operator.CONTAINS,
                ConditionValue.text("SMOKER"), true, null)).isTrue();
    }

    @Test
    void inRequiresList() {
        assertThat(compare(TextNode.valueOf("a"), Operator.IN, ConditionValue.text("a"))).isFalse();
        assertThat(compare(TextNode.valueOf("a"), Operator.IN,
                ConditionValue.list(ConditionValue.text("b"), ConditionValue.text("a")))).isTrue();
    }

    @Test
    void booleansCompareByValue() {
        assertThat(compare(BooleanNode.TRUE, Operator.EQ, ConditionValue.bool(true))).isTrue();
        assertThat(compare(BooleanNode.TRUE, Operator.EQ, ConditionValue.text("true"))).isFalse();
    }

    @Test
    void absentFieldOnlyMatchesNotEqualsAndNotExists() {
        for (Operator op : Operator.values()) {
            boolean expected = op == Operator.NE || op == Operator.NOT_EXISTS;
            assertThat(compare(null, op, ConditionValue.text("x"))).as(op.symbol()).isEqualTo(expected);
        }
    }

    @Test
    void matchesWithoutPatternIsFalse() {
        assertThat(compare(TextNode.valueOf("abc"), Operator.MATCHES, ConditionValue.text("a"))).isFalse();
    }

    @Test
    void parseNumberHandlesEdgeForms() {
        assertThat(ValueComparator.parseNumber("1e3")).isEqualTo(1000.0);
        assertThat(ValueComparator.parseNumber("-Infinity")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(ValueComparator.parseNumber(".5")).isEqualTo(0.5);
        assertThat(ValueComparator.parseNumber("12abc")).isNaN();
    }
}
