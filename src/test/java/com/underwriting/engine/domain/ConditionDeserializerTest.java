package com.underwriting.engine.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionDeserializerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readsCompoundTree() throws Exception {
        Condition condition = mapper.readValue("""
                {"operator": "OR", "conditions": [
                  {"field": "applicant.age", "operator": ">=", "value": 50},
                  {"field": "applicant.occupation", "operator": "in", "value": ["Miner", "Diver"], "caseInsensitive": true}
                ]}
                """, Condition.class);

        assertThat(condition).isInstanceOf(CompoundCondition.class);
        CompoundCondition compound = (CompoundCondition) condition;
        assertThat(compound.getLogic()).isEqualTo(CompoundCondition.Logic.OR);
        assertThat(compound.getConditions()).hasSize(2);

        LeafCondition in = (LeafCondition) compound.getConditions().get(1);
        assertThat(in.getOperator()).isEqualTo(Condition.Operator.IN);
        assertThat(in.isCaseInsensitive()).isTrue();
        assertThat(in.getValue()).isEqualTo(ConditionValue.list(List.of(
                ConditionValue.text("Miner"), ConditionValue.text("Diver"))));
    }

    @Test
    void presenceCheckNeedsNoValue() throws Exception {
        LeafCondition condition = (LeafCondition) mapper.readValue(
                "{\"field\": \"applicant.bmi\", \"operator\": \"notExists\"}", Condition.class);

        assertThat(condition.getOperator().isPresenceCheck()).isTrue();
        assertThat(condition.getValue()).isNull();
    }

    @Test
    void compilesRegexWhenRead() throws Exception {
        LeafCondition condition = (LeafCondition) mapper.readValue(
                "{\"field\": \"a\", \"operator\": \"matches\", \"value\": \"^diab\", \"caseInsensitive\": true}",
                Condition.class);

        assertThat(condition.getPattern()).isNotNull();
        assertThat(condition.getPattern().matcher("Diabetes").find()).isTrue();
    }

    @Test
    void rejectsInvalidRegex() {
        assertThatThrownBy(() -> mapper.readValue(
                "{\"field\": \"a\", \"operator\": \"matches\", \"value\": \"[\"}", Condition.class))
                .isInstanceOf(MismatchedInputException.class)
                .hasMessageContaining("Invalid regex");
    }

    @Test
    void rejectsUnknownOperatorAndObjectValue() {
        assertThatThrownBy(() -> mapper.readValue(
                "{\"field\": \"a\", \"operator\": \"~=\", \"value\": 1}", Condition.class))
                .isInstanceOf(MismatchedInputException.class);
        assertThatThrownBy(() -> mapper.readValue(
                "{\"field\": \"a\", \"operator\": \"==\", \"value\": {\"x\": 1}}", Condition.class))
                .isInstanceOf(MismatchedInputException.class);
        assertThatThrownBy(() -> mapper.readValue(
                "{\"operator\": \"NOT\", \"conditions\": []}", Condition.class))
                .isInstanceOf(MismatchedInputException.class);
    }
}
