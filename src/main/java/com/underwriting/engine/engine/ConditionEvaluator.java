package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.underwriting.engine.domain.CompoundCondition;
import com.underwriting.engine.domain.Condition;
import com.underwriting.engine.domain.ConditionResult;
import com.underwriting.engine.domain.ConditionValue;
import com.underwriting.engine.domain.LeafCondition;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates condition trees against a case context.
 * <p>
 * Leaf fields are dispatched on their shape:
 * <ol>
 *   <li>{@code array[].property} compares every element and collects the
 *       matching ones as {@code matchedItems}, exposing the first under
 *       {@code matchedDisclosure};</li>
 *   <li>{@code array[key=value].count} counts elements whose {@code key}
 *       equals {@code value} (ignoring case) and compares the count;</li>
 *   <li>{@code field.count} compares the length of a list; a missing or non-list
 *       {@code field} never matches;</li>
 *   <li>anything else is a plain dot path.</li>
 * </ol>
 * AND stops at the first failing sub-condition and drops whatever earlier
 * branches collected. OR returns the first matching branch's result as is.
 * <p>
 * Stateless and safe for concurrent use.
 */
@ApplicationScoped
public class ConditionEvaluator {

    private static final Logger LOG = Logger.getLogger(ConditionEvaluator.class);

    public static final String MATCHED_DISCLOSURE = "matchedDisclosure";

    private static final String COUNT_SUFFIX = ".count";
    private static final Pattern BRACKET_SEGMENT = Pattern.compile("\\[[^\\]]+\\]");
    private static final Pattern ELEMENT_PATH = Pattern.compile("^([^\\[\\]]+)\\[\\]\\.(.+)$");
    private static final Pattern FILTERED_PATH = Pattern.compile("^([^\\[\\]]+)\\[([^=]+)=([^\\]]+)\\]\\.(.+)$");

    public ConditionResult evaluate(Condition condition, JsonNode context) {
        if (condition instanceof CompoundCondition compound) {
            return evaluateCompound(compound, context);
        }
        return evaluateLeaf((LeafCondition) condition, context);
    }

    private ConditionResult evaluateCompound(CompoundCondition condition, JsonNode context) {
        if (condition.getLogic() == CompoundCondition.Logic.OR) {
            for (Condition sub : condition.getConditions()) {
                ConditionResult result = evaluate(sub, context);
                if (result.isMatched()) {
                    return result;
                }
            }
            return ConditionResult.noMatch();
        }

        List<JsonNode> items = new ArrayList<>();
        Map<String, JsonNode> merged = new LinkedHashMap<>();
        for (Condition sub : condition.getConditions()) {
            ConditionResult result = evaluate(sub, context);
            if (!result.isMatched()) {
                return ConditionResult.noMatch();
            }
            items.addAll(result.getMatchedItems());
            merged.putAll(result.getContext());
        }
        return ConditionResult.of(true, items, merged);
    }

    private ConditionResult evaluateLeaf(LeafCondition condition, JsonNode context) {
        String field = condition.getField();

        if (field.contains("[]") || BRACKET_SEGMENT.matcher(field).find()) {
            return evaluateArrayField(condition, context);
        }

        if (field.endsWith(COUNT_SUFFIX)) {
            String listField = field.substring(0, field.length() - COUNT_SUFFIX.length());
            Optional<JsonNode> list = FieldPathResolver.resolve(listField, context);
            if (list.isEmpty() || !list.get().isArray()) {
                return ConditionResult.noMatch();
            }
            return ConditionResult.of(compare(condition, Optional.of(IntNode.valueOf(list.get().size())), false));
        }

        Optional<JsonNode> value = FieldPathResolver.resolve(field, context);
        return ConditionResult.of(compare(condition, value, condition.isCaseInsensitive()));
    }

    private ConditionResult evaluateArrayField(LeafCondition condition, JsonNode context) {
        Matcher element = ELEMENT_PATH.matcher(condition.getField());
        if (!element.matches()) {
            return evaluateFilteredCount(condition, context);
        }

        Optional<JsonNode> array = FieldPathResolver.resolve(element.group(1), context);
        if (array.isEmpty() || !array.get().isArray()) {
            return ConditionResult.noMatch();
        }

        String property = element.group(2);
        List<JsonNode> matchedItems = new ArrayList<>();
        for (JsonNode item : array.get()) {
            if (compare(condition, FieldPathResolver.resolve(property, item), condition.isCaseInsensitive())) {
                matchedItems.add(item);
            }
        }
        if (matchedItems.isEmpty()) {
            return ConditionResult.noMatch();
        }
        return ConditionResult.of(true, matchedItems, Map.of(MATCHED_DISCLOSURE, matchedItems.get(0)));
    }

    private ConditionResult evaluateFilteredCount(LeafCondition condition, JsonNode context) {
        Matcher filtered = FILTERED_PATH.matcher(condition.getField());
        if (!filtered.matches()) {
            LOG.debugf("Unsupported array field path: %s", condition.getField());
            return ConditionResult.noMatch();
        }

        String arrayField = filtered.group(1);
        String filterKey = filtered.group(2);
        String filterValue = filtered.group(3);
        String aggregate = filtered.group(4);

        Optional<JsonNode> array = FieldPathResolver.resolve(arrayField, context);
        if (array.isEmpty() || !array.get().isArray() || !"count".equals(aggregate)) {
            return ConditionResult.noMatch();
        }

        String expected = filterValue.toLowerCase(Locale.ROOT);
        int count = 0;
        for (JsonNode item : array.get()) {
            String actual = FieldPathResolver.stringifyLenient(FieldPathResolver.resolveRaw(filterKey, item));
            if (actual.toLowerCase(Locale.ROOT).equals(expected)) {
                count++;
            }
        }

        IntNode countNode = IntNode.valueOf(count);
        String contextKey = arrayField + "." + filterKey + "=" + filterValue + COUNT_SUFFIX;
        return ConditionResult.of(compare(condition, Optional.of(countNode), false), List.of(), Map.of(contextKey, countNode));
    }

    private boolean compare(LeafCondition condition, Optional<JsonNode> value, boolean caseInsensitive) {
        ConditionValue compareValue = condition.getValue();
        return ValueComparator.compare(value, condition.getOperator(), compareValue, caseInsensitive, condition.getPattern());
    }
}
