package com.underwriting.engine.learning;

import java.util.List;

/**
 * What similar cases suggest about the system's recommendation for a case.
 *
 * @param confidenceAdjustment zero or negative; how much to dampen confidence
 */
public record LearningInsights(
        int similarCasesCount,
        List<CommonOverride> commonOverrides,
        List<String> suggestedActions,
        double confidenceAdjustment) {

    public LearningInsights {
        commonOverrides = List.copyOf(commonOverrides);
        suggestedActions = List.copyOf(suggestedActions);
    }

    /**
     * @param frequency occurrences per similar case
     */
    public record CommonOverride(String type, double frequency, String reasoning) {
    }
}
