package com.underwriting.engine.ruleset;

import com.fasterxml.jackson.databind.JsonNode;
import com.underwriting.engine.domain.Condition.Operator;
import com.underwriting.engine.domain.RuleType;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks raw rule configuration before it is turned into {@code Rule} objects.
 * <p>
 * Works on the JSON tree so that every problem in a file is reported at once,
 * with the path of the offending field, instead of stopping at the first
 * mapping error.
 */
@ApplicationScoped
public class RuleValidator {

    static final List<String> RISK_CATEGORIES =
            List.of("MEDICAL", "LIFESTYLE", "FAMILY_HISTORY", "FINANCIAL", "OCCUPATIONAL");
    static final List<String> SEVERITIES = List.of("LOW", "MODERATE", "HIGH", "CRITICAL");
    static final List<String> REQUIREMENT_TYPES = List.of("MANDATORY", "CONDITIONAL", "SUGGESTED", "ADDITIONAL");
    static final List<String> DECISION_TYPES =
            List.of("STANDARD_ACCEPTANCE", "MODIFIED_ACCEPTANCE", "DEFERRAL", "REFERRAL", "DECLINE");

    private static final Pattern RULE_ID = Pattern.compile("^[A-Z]+_\\d{3}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIELD_PATH = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_]*(\\[\\]|\\[[^\\]]+\\])?(\\.[a-zA-Z_][a-zA-Z0-9_]*(\\[\\]|\\[[^\\]]+\\])?)*$");

    public ValidationResult validate(RuleType type, JsonNode rule) {
        Issues issues = new Issues();
        validateCommonFields(rule, issues);
        switch (type) {
            case RISK -> validateRiskRule(rule, issues);
            case TEST_PROTOCOL -> validateTestProtocol(rule, issues);
            case DECISION -> validateDecisionRule(rule, issues);
        }
        return issues.toResult();
    }

    /**
     * Validates every rule of a catalog. Issue paths are prefixed with
     * {@code rules[i].} and repeated ids are reported as errors.
     */
    public ValidationResult validateBatch(RuleType type, JsonNode rules) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        if (rules == null || !rules.isArray()) {
            errors.add(ValidationIssue.error("rules", "Rules must be a list"));
            return new ValidationResult(errors, warnings);
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            JsonNode rule = rules.get(i);
            String prefix = "rules[" + i + "].";
            JsonNode id = rule.get("id");
            if (truthy(id)) {
                String key = id.asText();
                if (!ids.add(key)) {
                    errors.add(ValidationIssue.error(prefix + "id", "Duplicate rule ID: " + key));
                }
            }

            ValidationResult result = validate(type, rule);
            result.getErrors().forEach(issue -> errors.add(issue.withPrefix(prefix)));
            result.getWarnings().forEach(issue -> warnings.add(issue.withPrefix(prefix)));
        }
        return new ValidationResult(errors, warnings);
    }

    private void validateCommonFields(JsonNode rule, Issues issues) {
        JsonNode id = rule.get("id");
        if (!isNonEmptyText(id)) {
            issues.error("id", "Rule ID is required and must be a string");
        } else if (!RULE_ID.matcher(id.textValue()).matches()) {
            issues.warning("id", "Rule ID should follow pattern: PREFIX_NNN (e.g., AGE_001)");
        }

        if (!isNonEmptyText(rule.get("name"))) {
            issues.error("name", "Rule name is required and must be a string");
        }

        JsonNode enabled = rule.get("enabled");
        if (enabled == null || !enabled.isBoolean()) {
            issues.error("enabled", "Rule enabled must be a boolean");
        }

        JsonNode priority = rule.get("priority");
        if (priority == null || !priority.isNumber() || priority.doubleValue() < 0) {
            issues.error("priority", "Rule priority must be a non-negative number");
        }

        JsonNode conditions = rule.get("conditions");
        if (!truthy(conditions)) {
            issues.error("conditions", "Rule conditions are required");
        } else {
            validateCondition(conditions, "conditions", issues);
        }
    }

    void validateCondition(JsonNode condition, String path, Issues issues) {
        if (!condition.isObject()) {
            issues.error(path, "Condition must be an object");
            return;
        }
        JsonNode subConditions = condition.get("conditions");
        if (subConditions != null && subConditions.isArray()) {
            validateCompoundCondition(condition, subConditions, path, issues);
        } else {
            validateLeafCondition(condition, path, issues);
        }
    }

    private void validateCompoundCondition(JsonNode condition, JsonNode subConditions, String path, Issues issues) {
        String operator = condition.path("operator").asText(null);
        if (!"AND".equals(operator) && !"OR".equals(operator)) {
            issues.error(path + ".operator",
                    "Compound condition operator must be 'AND' or 'OR', got '" + operator + "'");
        }

        if (subConditions.isEmpty()) {
            issues.error(path + ".conditions", "Compound condition must have at least one sub-condition");
            return;
        }
        for (int i = 0; i < subConditions.size(); i++) {
            validateCondition(subConditions.get(i), path + ".conditions[" + i + "]", issues);
        }
    }

    private void validateLeafCondition(JsonNode condition, String path, Issues issues) {
        JsonNode field = condition.get("field");
        boolean hasField = isNonEmptyText(field);
        if (!hasField) {
            issues.error(path + ".field", "Condition field is required and must be a string");
        }

        JsonNode operatorNode = condition.get("operator");
        Operator operator = operatorNode != null && operatorNode.isTextual()
                ? Operator.fromSymbol(operatorNode.textValue())
                : null;
        if (operator == null) {
            issues.error(path + ".operator", "Invalid operator '" + (operatorNode != null ? operatorNode.asText() : null)
                    + "'. Valid operators: " + String.join(", ", Operator.symbols()));
        }

        JsonNode value = condition.get("value");
        if (value == null && (operator == null || !operator.isPresenceCheck())) {
            issues.error(path + ".value", "Condition value is required (except for exists/notExists operators)");
        }

        if (hasField && !FIELD_PATH.matcher(field.textValue()).matches()) {
            issues.warning(path + ".field", "Field path '" + field.textValue()
                    + "' may be invalid. Expected format: field.subfield or field[].subfield");
        }

        if (operator == Operator.MATCHES && value != null && value.isTextual()) {
            try {
                Pattern.compile(value.textValue());
            } catch (PatternSyntaxException e) {
                issues.error(path + ".value", "Invalid regex pattern: " + value.textValue());
            }
        }
    }

    private void validateRiskRule(JsonNode rule, Issues issues) {
        JsonNode category = rule.get("category");
        if (!isOneOf(category, RISK_CATEGORIES)) {
            issues.error("category", "Invalid category '" + textOf(category) + "'. Valid categories: "
                    + String.join(", ", RISK_CATEGORIES));
        }

        JsonNode actions = rule.get("actions");
        if (!truthy(actions)) {
            issues.error("actions", "Risk rule must have actions defined");
            return;
        }

        JsonNode factor = actions.get("createRiskFactor");
        if (!truthy(factor)) {
            issues.error("actions.createRiskFactor", "Risk rule must define createRiskFactor action");
            return;
        }
        if (!truthy(factor.get("factorName"))) {
            issues.error("actions.createRiskFactor.factorName", "Factor name is required");
        }
        if (!truthy(factor.get("factorDescriptionTemplate"))) {
            issues.error("actions.createRiskFactor.factorDescriptionTemplate", "Factor description template is required");
        }
        JsonNode factorCategory = factor.get("category");
        if (truthy(factorCategory) && !isOneOf(factorCategory, RISK_CATEGORIES)) {
            issues.error("actions.createRiskFactor.category", "Invalid category '" + textOf(factorCategory) + "'");
        }
        JsonNode severity = factor.get("severity");
        if (truthy(severity) && !isOneOf(severity, SEVERITIES)) {
            issues.error("actions.createRiskFactor.severity", "Invalid severity '" + textOf(severity) + "'");
        }

        JsonNode severityRules = actions.get("severityRules");
        if (severityRules != null && severityRules.isArray()) {
            for (int i = 0; i < severityRules.size(); i++) {
                JsonNode severityRule = severityRules.get(i);
                String path = "actions.severityRules[" + i + "]";
                JsonNode ruleSeverity = severityRule.get("severity");
                if (truthy(ruleSeverity) && !isOneOf(ruleSeverity, SEVERITIES)) {
                    issues.error(path + ".severity", "Invalid severity '" + textOf(ruleSeverity) + "'");
                }
                JsonNode condition = severityRule.get("condition");
                if (truthy(condition)) {
                    validateCondition(condition, path + ".condition", issues);
                }
            }
        }
    }

    private void validateTestProtocol(JsonNode rule, Issues issues) {
        JsonNode tests = rule.get("tests");
        if (tests == null || !tests.isArray() || tests.isEmpty()) {
            issues.error("tests", "Test protocol must have at least one test defined");
            return;
        }

        for (int i = 0; i < tests.size(); i++) {
            JsonNode test = tests.get(i);
            String path = "tests[" + i + "]";
            if (!truthy(test.get("testCode"))) {
                issues.error(path + ".testCode", "Test code is required");
            }
            if (!truthy(test.get("testName"))) {
                issues.error(path + ".testName", "Test name is required");
            }
            JsonNode requirementType = test.get("requirementType");
            if (!isOneOf(requirementType, REQUIREMENT_TYPES)) {
                issues.error(path + ".requirementType", "Invalid requirement type '" + textOf(requirementType) + "'");
            }
            if (!isNonNegativeNumber(test.get("estimatedCost"))) {
                issues.warning(path + ".estimatedCost", "Estimated cost should be a non-negative number");
            }
            if (!isNonNegativeNumber(test.get("estimatedTurnaroundDays"))) {
                issues.warning(path + ".estimatedTurnaroundDays",
                        "Estimated turnaround days should be a non-negative number");
            }
        }
    }

    private void validateDecisionRule(JsonNode rule, Issues issues) {
        JsonNode decisionType = rule.get("decisionType");
        if (!isOneOf(decisionType, DECISION_TYPES)) {
            issues.error("decisionType", "Invalid decision type '" + textOf(decisionType) + "'. Valid types: "
                    + String.join(", ", DECISION_TYPES));
        }

        JsonNode output = rule.get("output");
        if (!truthy(output)) {
            issues.error("output", "Decision rule must have output defined");
            return;
        }
        if (!truthy(output.get("name"))) {
            issues.error("output.name", "Output name is required");
        }
        if (!truthy(output.get("description"))) {
            issues.error("output.description", "Output description is required");
        }
        if (!truthy(output.get("guidelineReference"))) {
            issues.warning("output.guidelineReference", "Guideline reference is recommended");
        }
        if (!truthy(output.get("authorityRequired"))) {
            issues.warning("output.authorityRequired", "Authority required is recommended");
        }

        JsonNode weighing = output.path("weighingFactorsCondition").get("condition");
        if (truthy(weighing)) {
            validateCondition(weighing, "output.weighingFactorsCondition.condition", issues);
        }
        JsonNode recommended = output.path("recommendedCondition").get("condition");
        if (truthy(recommended)) {
            validateCondition(recommended, "output.recommendedCondition.condition", issues);
        }
    }

    /**
     * Present and not an empty string, false, zero or null.
     */
    private static boolean truthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0;
        }
        return true;
    }

    private static boolean isNonEmptyText(JsonNode node) {
        return node != null && node.isTextual() && !node.textValue().isEmpty();
    }

    private static boolean isOneOf(JsonNode node, List<String> allowed) {
        return node != null && node.isTextual() && allowed.contains(node.textValue());
    }

    private static boolean isNonNegativeNumber(JsonNode node) {
        return node != null && node.isNumber() && node.doubleValue() >= 0;
    }

    private static String textOf(JsonNode node) {
        return node == null || node.isNull() ? "undefined" : node.asText();
    }

    static final class Issues {
        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<ValidationIssue> warnings = new ArrayList<>();

        void error(String field, String message) {
            errors.add(ValidationIssue.error(field, message));
        }

        void warning(String field, String message) {
            warnings.add(ValidationIssue.warning(field, message));
        }

        ValidationResult toResult() {
            return new ValidationResult(errors, warnings);
        }
    }
}
