package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateSubstitutorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TemplateSubstitutor substitutor = new TemplateSubstitutor();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    void replacesResolvedPlaceholders() throws Exception {
        JsonNode context = json("{\"applicant\":{\"age\":45,\"bmi\":31.4,\"name\":\"A. Smith\"}}");

        String result = substitutor.substitute(
                "{{applicant.name}} aged {{ applicant.age }} with BMI {{applicant.bmi}}", context);

        assertThat(result).isEqualTo("A. Smith aged 45 with BMI 31.4");
    }

    @Test
    void unresolvedPlaceholderReadsNotSpecified() throws Exception {
        JsonNode context = json("{\"applicant\":{\"occupation\":null}}");

        assertThat(substitutor.substitute("Occupation: {{applicant.occupation}}, {{missing.path}}", context))
                .isEqualTo("Occupation: Not specified, Not specified");
    }

    @Test
    void replacementTextIsLiteral() throws Exception {
        JsonNode context = json("{\"note\":\"cost $5 \\\\ fee\"}");

        assertThat(substitutor.substitute("{{note}}", context)).isEqualTo("cost $5 \\ fee");
    }

    @Test
    void substitutesNestedStructuresWithoutTouchingInput() throws Exception {
        JsonNode template = json("{\"name\":\"{{applicant.name}}\",\"weight\":0.4,"
                + "\"evidence\":[{\"value\":\"Age {{applicant.age}}\"},true]}");
        JsonNode original = template.deepCopy();
        JsonNode context = json("{\"applicant\":{\"name\":\"B\",\"age\":60}}");

        JsonNode result = substitutor.substituteDeep(template, context);

        assertThat(result).isEqualTo(json("{\"name\":\"B\",\"weight\":0.4,\"evidence\":[{\"value\":\"Age 60\"},true]}"));
        assertThat(template).isEqualTo(original);
    }

    @Test
    void contextForExposesMatchedItemAndEvaluationValues() throws Exception {
        JsonNode context = json("{\"applicant\":{\"age\":45}}");
        JsonNode disclosure = json("{\"conditionName\":\"Asthma\"}");

        JsonNode templateContext = substitutor.contextFor(context, Map.of("count", IntNode.valueOf(3)), disclosure);

        assertThat(substitutor.substitute("{{matchedDisclosure.conditionName}} / {{count}} / {{applicant.age}}",
                templateContext)).isEqualTo("Asthma / 3 / 45");
        assertThat(context.has(ConditionEvaluator.MATCHED_DISCLOSURE)).isFalse();
    }
}
