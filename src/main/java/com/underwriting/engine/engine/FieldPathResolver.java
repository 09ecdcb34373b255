package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.underwriting.engine.domain.ConditionValue;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves dot-separated field paths against a case context.
 * <p>
 * A path that runs into a missing key, a JSON null or a scalar yields
 * {@link Optional#empty()}. Malformed paths never throw; absence is an
 * ordinary evaluation outcome.
 */
public final class FieldPathResolver {

    private static final Pattern ARRAY_INDEX = Pattern.compile("\\d+");

    private FieldPathResolver() {
    }

    /**
     * Walks {@code path} through {@code root}.
     *
     * @param path dot path such as {@code applicant.age}; array elements are
     *             addressed by numeric segments ({@code riskFactors.0.severity})
     * @param root context node, may be {@code null}
     * @return the resolved value, or empty when any segment is absent or null
     */
    public static Optional<JsonNode> resolve(String path, JsonNode root) {
        JsonNode value = resolveRaw(path, root);
        return isDefined(value) ? Optional.of(value) : Optional.empty();
    }

    /**
     * Like {@link #resolve(String, JsonNode)} but keeps a JSON null at the end
     * of the path, so callers can tell an explicit null from an absent key.
     *
     * @return the node, a {@code NullNode}, or {@code null} when absent
     */
    public static JsonNode resolveRaw(String path, JsonNode root) {
        if (root == null || path == null || path.isEmpty()) {
            return null;
        }
        JsonNode current = root;
        for (String part : path.split("\\.", -1)) {
            if (!isDefined(current)) {
                return null;
            }
            if (current.isObject()) {
                current = current.get(part);
            } else if (current.isArray() && ARRAY_INDEX.matcher(part).matches()) {
                current = current.get(Integer.parseInt(part));
            } else {
                return null;
            }
        }
        return current == null || current.isMissingNode() ? null : current;
    }

    public static boolean isDefined(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    /**
     * String form of a resolved value as it appears in templates and filter
     * comparisons. Numbers print without a trailing {@code .0} when integral;
     * containers print as JSON.
     */
    public static String stringify(JsonNode node) {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return ConditionValue.formatNumber(node.doubleValue());
        }
        if (node.isBoolean()) {
            return Boolean.toString(node.booleanValue());
        }
        return node.toString();
    }

    /**
     * Like {@link #stringify(JsonNode)} but renders absence as
     * {@code undefined} and JSON null as {@code null}.
     */
    public static String stringifyLenient(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "undefined";
        }
        if (node.isNull()) {
            return "null";
        }
        return stringify(node);
    }
}
