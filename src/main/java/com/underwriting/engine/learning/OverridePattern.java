package com.underwriting.engine.learning;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A recurring override shape: same type, direction and primary reasoning tag.
 *
 * @param pattern         readable form, e.g. {@code upgrade complexity_tier due to family_history}
 * @param percentage      share of all analyzed overrides, 0 to 100
 * @param suggestedAction set only for frequent patterns
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OverridePattern(
        String overrideType,
        String direction,
        String reason,
        String pattern,
        int count,
        double percentage,
        List<Example> examples,
        String suggestedAction) {

    public OverridePattern {
        examples = List.copyOf(examples);
    }

    public record Example(String caseId, String reasoning, String underwriterName) {
    }
}
