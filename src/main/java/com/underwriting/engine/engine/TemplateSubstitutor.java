package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{path}}} placeholders against a case context.
 */
@ApplicationScoped
public class TemplateSubstitutor {

    public static final String NOT_SPECIFIED = "Not specified";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    /**
     * Replaces every placeholder with the resolved value, or
     * {@value #NOT_SPECIFIED} when the path does not resolve.
     */
    public String substitute(String template, JsonNode context) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = FieldPathResolver.resolve(matcher.group(1).trim(), context)
                    .map(FieldPathResolver::stringify)
                    .orElse(NOT_SPECIFIED);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Applies {@link #substitute(String, JsonNode)} to every string inside
     * {@code value}, returning a new tree. Non-string leaves are kept as they are.
     */
    public JsonNode substituteDeep(JsonNode value, JsonNode context) {
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return TextNode.valueOf(substitute(value.textValue(), context));
        }
        if (value.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), substituteDeep(field.getValue(), context));
            }
            return copy;
        }
        if (value.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(value.size());
            for (JsonNode item : value) {
                copy.add(substituteDeep(item, context));
            }
            return copy;
        }
        return value;
    }

    /**
     * Template context for one matched element: a copy of {@code context} with
     * the values collected during evaluation laid over it and
     * {@code matchedDisclosure} pointing at {@code matchedItem}.
     */
    public JsonNode contextFor(JsonNode context, Map<String, JsonNode> evaluationContext, JsonNode matchedItem) {
        ObjectNode templateContext = context != null && context.isObject()
                ? ((ObjectNode) context).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        if (evaluationContext != null) {
            evaluationContext.forEach(templateContext::set);
        }
        if (matchedItem != null) {
            templateContext.set(ConditionEvaluator.MATCHED_DISCLOSURE, matchedItem);
        }
        return templateContext;
    }
}
