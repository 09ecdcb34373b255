package com.underwriting.engine.learning;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A precedent case found for a target case.
 *
 * @param outcome  case status
 * @param decision most recent decision type, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimilarCase(
        String caseId,
        String caseReference,
        int similarity,
        String outcome,
        String decision,
        List<AppliedOverride> overridesApplied) {

    public SimilarCase {
        overridesApplied = overridesApplied != null ? List.copyOf(overridesApplied) : List.of();
    }

    /**
     * @param description {@code recommendation → choice}
     */
    public record AppliedOverride(String type, String description, String reasoning) {
    }
}
