package com.underwriting.engine.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * One entry of a rule evaluation: the rule, whether its conditions matched,
 * and the evidence collected while matching.
 * <p>
 * Non-matching entries only appear for rules flagged {@code alwaysInclude}.
 */
public final class RuleMatch {

    private final Rule rule;
    private final boolean matched;
    private final List<JsonNode> matchedItems;
    private final Map<String, JsonNode> evaluationContext;

    public RuleMatch(Rule rule, ConditionResult result) {
        this.rule = rule;
        this.matched = result.isMatched();
        this.matchedItems = result.getMatchedItems();
        this.evaluationContext = result.getContext();
    }

    public Rule getRule() {
        return rule;
    }

    public boolean isMatched() {
        return matched;
    }

    public List<JsonNode> getMatchedItems() {
        return matchedItems;
    }

    public Map<String, JsonNode> getEvaluationContext() {
        return evaluationContext;
    }

    @Override
    public String toString() {
        return "RuleMatch{" +
               "rule=" + rule.getId() +
               ", matched=" + matched +
               ", matchedItems=" + matchedItems.size() +
               '}';
    }
}
