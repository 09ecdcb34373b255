package com.underwriting.engine.domain;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Reads a condition tree from rule configuration JSON.
 * <p>
 * A node with a {@code conditions} array is compound; anything else is a leaf.
 * Unknown operators, object-valued operands and invalid regular expressions
 * are reported as mapping errors so the whole catalog fails to load.
 */
public class ConditionDeserializer extends StdDeserializer<Condition> {

    public ConditionDeserializer() {
        super(Condition.class);
    }

    @Override
    public Condition deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return toCondition(node, parser, ctxt);
    }

    private Condition toCondition(JsonNode node, JsonParser parser, DeserializationContext ctxt) throws IOException {
        if (node == null || !node.isObject()) {
            return ctxt.reportInputMismatch(Condition.class, "Condition must be a JSON object, got: %s", node);
        }

        JsonNode children = node.get("conditions");
        if (children != null && children.isArray()) {
            String operator = node.path("operator").asText(null);
            CompoundCondition.Logic logic = CompoundCondition.Logic.fromString(operator);
            if (logic == null) {
                return ctxt.reportInputMismatch(Condition.class,
                        "Compound condition operator must be 'AND' or 'OR', got '%s'", operator);
            }
            List<Condition> subConditions = new ArrayList<>(children.size());
            for (JsonNode child : children) {
                subConditions.add(toCondition(child, parser, ctxt));
            }
            return new CompoundCondition(logic, subConditions);
        }

        String field = node.path("field").asText(null);
        if (field == null || field.isEmpty()) {
            return ctxt.reportInputMismatch(Condition.class, "Condition field is required");
        }
        String symbol = node.path("operator").asText(null);
        Condition.Operator operator = Condition.Operator.fromSymbol(symbol);
        if (operator == null) {
            return ctxt.reportInputMismatch(Condition.class,
                    "Invalid operator '%s'. Valid operators: %s", symbol, String.join(", ", Condition.Operator.symbols()));
        }

        ConditionValue value;
        try {
            value = ConditionValue.fromJson(node.get("value"));
        } catch (IllegalArgumentException e) {
            return ctxt.reportInputMismatch(Condition.class, "Field '%s': %s", field, e.getMessage());
        }
        boolean caseInsensitive = node.path("caseInsensitive").asBoolean(false);

        try {
            return new LeafCondition(field, operator, value, caseInsensitive);
        } catch (PatternSyntaxException e) {
            return ctxt.reportInputMismatch(Condition.class,
                    "Invalid regex pattern for field '%s': %s", field, e.getDescription());
        }
    }
}
