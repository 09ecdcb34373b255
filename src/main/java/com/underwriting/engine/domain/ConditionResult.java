package com.underwriting.engine.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating a condition tree.
 * <p>
 * {@code matchedItems} holds the array elements that satisfied array-field
 * leaves; {@code context} holds values exposed for template substitution
 * (e.g. {@code matchedDisclosure}). Both are empty when nothing was collected.
 */
public final class ConditionResult {

    private static final ConditionResult NO_MATCH = new ConditionResult(false, List.of(), Map.of());
    private static final ConditionResult MATCH = new ConditionResult(true, List.of(), Map.of());

    private final boolean matched;
    private final List<JsonNode> matchedItems;
    private final Map<String, JsonNode> context;

    private ConditionResult(boolean matched, List<JsonNode> matchedItems, Map<String, JsonNode> context) {
        this.matched = matched;
        this.matchedItems = matchedItems;
        this.context = context;
    }

    public static ConditionResult noMatch() {
        return NO_MATCH;
    }

    public static ConditionResult of(boolean matched) {
        return matched ? MATCH : NO_MATCH;
    }

    public static ConditionResult of(boolean matched, List<JsonNode> matchedItems, Map<String, JsonNode> context) {
        List<JsonNode> items = matchedItems == null || matchedItems.isEmpty()
                ? List.of()
                : List.copyOf(matchedItems);
        Map<String, JsonNode> ctx = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        return new ConditionResult(matched, items, ctx);
    }

    public boolean isMatched() {
        return matched;
    }

    public List<JsonNode> getMatchedItems() {
        return matchedItems;
    }

    public Map<String, JsonNode> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConditionResult that = (ConditionResult) o;
        return matched == that.matched &&
               matchedItems.equals(that.matchedItems) &&
               context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(matched) * 31 * 31 + matchedItems.hashCode() * 31 + context.hashCode();
    }

    @Override
    public String toString() {
        return "ConditionResult{" +
               "matched=" + matched +
               ", matchedItems=" + matchedItems.size() +
               ", context=" + context.keySet() +
               '}';
    }
}
