package com.underwriting.engine.learning;

import com.underwriting.engine.override.CaseNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LearningInsightsServiceTest {

    @Mock
    SimilarCaseFinder similarCaseFinder;

    private LearningInsightsService service;

    @BeforeEach
    void setUp() {
        service = new LearningInsightsService();
        service.similarCaseFinder = similarCaseFinder;
    }

    private static SimilarCase similar(String id, SimilarCase.AppliedOverride... overrides) {
        return new SimilarCase(id, null, 60, "completed", null, List.of(overrides));
    }

    private static SimilarCase.AppliedOverride applied(String type, String reasoning) {
        return new SimilarCase.AppliedOverride(type, "a → b", reasoning);
    }

    @Test
    void noSimilarCasesYieldsNeutralInsights() {
        when(similarCaseFinder.findSimilarCases("case-1", 50)).thenReturn(List.of());

        LearningInsights insights = service.insights("case-1");

        assertThat(insights.similarCasesCount()).isZero();
        assertThat(insights.commonOverrides()).isEmpty();
        assertThat(insights.suggestedActions()).isEmpty();
        assertThat(insights.confidenceAdjustment()).isZero();
    }

    @Test
    void reportsCommonOverridesAndDampensConfidence() {
        List<SimilarCase> cases = new ArrayList<>();
        cases.add(similar("c1", applied("complexity_tier", "Family history of diabetes")));
        cases.add(similar("c2", applied("complexity_tier", " "), applied("test_recommendation", null)));
        cases.add(similar("c3", applied("complexity_tier", "Poor control")));
        cases.add(similar("c4", applied("test_recommendation", "")));
        cases.add(similar("c5"));
        cases.add(similar("c6"));
        cases.add(similar("c7"));
        cases.add(similar("c8"));
        cases.add(similar("c9", applied("risk_severity", "Stable for years")));
        cases.add(similar("c10"));
        when(similarCaseFinder.findSimilarCases("case-1", 50)).thenReturn(cases);

        LearningInsights insights = service.insights("case-1");

        assertThat(insights.similarCasesCount()).isEqualTo(10);
        assertThat(insights.commonOverrides()).extracting(LearningInsights.CommonOverride::type)
                .containsExactly("complexity_tier", "test_recommendation");
        LearningInsights.CommonOverride tier = insights.commonOverrides().get(0);
        assertThat(tier.frequency()).isCloseTo(0.3, within(1e-9));
        assertThat(tier.reasoning()).isEqualTo("Family history of diabetes");
        assertThat(insights.commonOverrides().get(1).reasoning()).isEqualTo(LearningInsightsService.VARIOUS_REASONS);
        assertThat(insights.suggestedActions()).isEmpty();
        assertThat(insights.confidenceAdjustment()).isCloseTo(-0.05, within(1e-9));
    }

    @Test
    void suggestsActionForMajorityOverride() {
        when(similarCaseFinder.findSimilarCases("case-1", 50)).thenReturn(List.of(
                similar("c1", applied("complexity_tier", "Family history")),
                similar("c2", applied("complexity_tier", "Family history")),
                similar("c3")));

        LearningInsights insights = service.insights("case-1");

        assertThat(insights.suggestedActions())
                .containsExactly("Consider complexity_tier adjustment - applied in 67% of similar cases");
        assertThat(insights.confidenceAdjustment()).isCloseTo(-2.0 / 3 * 0.2, within(1e-9));
    }

    @Test
    void usesConfiguredPoolSize() {
        service.insightPoolSize = 5;
        when(similarCaseFinder.findSimilarCases("case-1", 5)).thenReturn(List.of(similar("c1")));

        assertThat(service.insights("case-1").similarCasesCount()).isEqualTo(1);
    }

    @Test
    void unknownCasePropagates() {
        when(similarCaseFinder.findSimilarCases("missing", 50)).thenThrow(new CaseNotFoundException("missing"));

        assertThatThrownBy(() -> service.insights("missing")).isInstanceOf(CaseNotFoundException.class);
    }
}
