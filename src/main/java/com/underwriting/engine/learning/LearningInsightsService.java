package com.underwriting.engine.learning;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives learning insights for a case from the overrides applied to its
 * precedents.
 * <p>
 * An override type counts as common when it occurs at least once per five
 * similar cases; from one per two similar cases on, an action is suggested.
 * The confidence adjustment is a fifth of the average frequency of the common
 * types, negated.
 */
@ApplicationScoped
public class LearningInsightsService {

    static final double COMMON_FREQUENCY = 0.2;
    static final double SUGGESTION_FREQUENCY = 0.5;
    static final double CONFIDENCE_WEIGHT = 0.2;
    static final String VARIOUS_REASONS = "Various reasons";

    @Inject
    SimilarCaseFinder similarCaseFinder;

    @ConfigProperty(name = "app.learning.insight-pool-size", defaultValue = "50")
    int insightPoolSize = 50;

    /**
     * @throws com.underwriting.engine.override.CaseNotFoundException if the case cannot be resolved
     */
    public LearningInsights insights(String caseId) {
        List<SimilarCase> similarCases = similarCaseFinder.findSimilarCases(caseId, insightPoolSize);

        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> firstReasoning = new LinkedHashMap<>();
        for (SimilarCase similar : similarCases) {
            for (SimilarCase.AppliedOverride override : similar.overridesApplied()) {
                counts.merge(override.type(), 1, Integer::sum);
                if (override.reasoning() != null && !override.reasoning().isBlank()) {
                    firstReasoning.putIfAbsent(override.type(), override.reasoning());
                }
            }
        }

        List<LearningInsights.CommonOverride> common = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            double frequency = (double) entry.getValue() / similarCases.size();
            if (frequency >= COMMON_FREQUENCY) {
                common.add(new LearningInsights.CommonOverride(entry.getKey(), frequency,
                        firstReasoning.getOrDefault(entry.getKey(), VARIOUS_REASONS)));
            }
        }
        common.sort(Comparator.comparingDouble(LearningInsights.CommonOverride::frequency).reversed());

        List<String> suggestedActions = new ArrayList<>();
        double frequencySum = 0.0;
        for (LearningInsights.CommonOverride override : common) {
            frequencySum += override.frequency();
            if (override.frequency() >= SUGGESTION_FREQUENCY) {
                suggestedActions.add(String.format(Locale.ROOT,
                        "Consider %s adjustment - applied in %.0f%% of similar cases",
                        override.type(), override.frequency() * 100));
            }
        }

        double confidenceAdjustment = common.isEmpty() ? 0.0 : -(frequencySum / common.size()) * CONFIDENCE_WEIGHT;
        return new LearningInsights(similarCases.size(), common, suggestedActions, confidenceAdjustment);
    }
}
