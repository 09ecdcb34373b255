package com.underwriting.engine.learning;

import com.underwriting.engine.domain.OverrideDirection;
import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.domain.OverrideType;
import com.underwriting.engine.domain.Underwriter;
import com.underwriting.engine.override.InMemoryOverrideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OverridePatternMinerTest {

    private static final Underwriter SENIOR = new Underwriter("uw-1", "Jordan Lee", "senior", 12);

    private InMemoryOverrideRepository repository;
    private OverridePatternMiner miner;

    @BeforeEach
    void setUp() {
        repository = new InMemoryOverrideRepository();
        miner = new OverridePatternMiner();
        miner.repository = repository;
    }

    private static OverrideRecord override(String caseId, OverrideType type, OverrideDirection direction, String... tags) {
        return OverrideRecord.builder()
                .caseId(caseId)
                .overrideType(type)
                .direction(direction)
                .systemRecommendation("routine")
                .underwriterChoice("complex")
                .reasoning("Reason for " + caseId)
                .reasoningTags(List.of(tags))
                .underwriter(SENIOR)
                .build();
    }

    private static List<OverrideRecord> repeat(int n, String prefix, OverrideType type, OverrideDirection direction, String tag) {
        List<OverrideRecord> result = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            result.add(override(prefix + i, type, direction, tag));
        }
        return result;
    }

    @Test
    void emptyInputYieldsNoPatterns() {
        assertThat(miner.minePatterns(List.of())).isEmpty();
    }

    @Test
    void singletonGroupsAreDropped() {
        List<OverrideRecord> overrides = List.of(
                override("c1", OverrideType.COMPLEXITY_TIER, OverrideDirection.UPGRADE, "family_history"),
                override("c2", OverrideType.COMPLEXITY_TIER, OverrideDirection.DOWNGRADE, "family_history"),
                override("c3", OverrideType.RISK_SEVERITY, OverrideDirection.UPGRADE, "family_history"));

        assertThat(miner.minePatterns(overrides)).isEmpty();
    }

    @Test
    void groupsByTypeDirectionAndPrimaryTag() {
        List<OverrideRecord> overrides = new ArrayList<>();
        overrides.add(override("c1", OverrideType.COMPLEXITY_TIER, OverrideDirection.UPGRADE, "family_history", "bmi"));
        overrides.add(override("c2", OverrideType.COMPLEXITY_TIER, OverrideDirection.UPGRADE, "family_history"));
        overrides.add(override("c3", OverrideType.COMPLEXITY_TIER, OverrideDirection.UPGRADE));
        overrides.add(override("c4", OverrideType.COMPLEXITY_TIER, OverrideDirection.UPGRADE));
        overrides.add(override("c5", OverrideType.COMPLEXITY_TIER, OverrideDirection.UPGRADE));

        List<OverridePattern> patterns = miner.minePatterns(overrides);

        assertThat(patterns).extracting(OverridePattern::reason).containsExactly("untagged", "family_history");
        OverridePattern untagged = patterns.get(0);
        assertThat(untagged.count()).isEqualTo(3);
        assertThat(untagged.percentage()).isCloseTo(60.0, within(1e-9));
        assertThat(untagged.pattern()).isEqualTo("upgrade complexity_tier due to untagged");
        assertThat(untagged.suggestedAction()).isNull();

        OverridePattern familyHistory = patterns.get(1);
        assertThat(familyHistory.examples()).extracting(OverridePattern.Example::caseId).containsExactly("c1", "c2");
        assertThat(familyHistory.examples().get(0).underwriterName()).isEqualTo("Jordan Lee");
        assertThat(familyHistory.examples().get(0).reasoning()).isEqualTo("Reason for c1");
    }

    @Test
    void blankPrimaryTagCountsAsUntagged() {
        List<OverrideRecord> overrides = List.of(
                override("c1", OverrideType.RISK_SEVERITY, OverrideDirection.DOWNGRADE, ""),
                override("c2", OverrideType.RISK_SEVERITY, OverrideDirection.DOWNGRADE, " ", "controlled"),
                override("c3", OverrideType.RISK_SEVERITY, OverrideDirection.DOWNGRADE));

        assertThat(miner.minePatterns(overrides)).singleElement().satisfies(p -> {
            assertThat(p.reason()).isEqualTo(OverrideRecord.UNTAGGED);
            assertThat(p.count()).isEqualTo(3);
            assertThat(p.pattern()).isEqualTo("downgrade risk_severity due to untagged");
        });
    }

    @Test
    void suggestsActionForFrequentPattern() {
        List<OverrideRecord> overrides = new ArrayList<>(
                repeat(5, "fh", OverrideType.TEST_RECOMMENDATION, OverrideDirection.ADD, "family_history"));
        overrides.addAll(repeat(45, "x", OverrideType.TEST_RECOMMENDATION, OverrideDirection.REMOVE, "cost"));

        List<OverridePattern> patterns = miner.minePatterns(overrides);

        assertThat(patterns).hasSize(2);
        assertThat(patterns.get(0).reason()).isEqualTo("cost");
        OverridePattern frequent = patterns.get(1);
        assertThat(frequent.percentage()).isCloseTo(10.0, within(1e-9));
        assertThat(frequent.suggestedAction())
                .isEqualTo("Consider updating test_recommendation rules to account for \"family_history\" scenarios");
        assertThat(frequent.examples()).hasSize(3);
    }

    @Test
    void noSuggestionBelowTenPercent() {
        List<OverrideRecord> overrides = new ArrayList<>(
                repeat(5, "fh", OverrideType.TEST_RECOMMENDATION, OverrideDirection.ADD, "family_history"));
        overrides.addAll(repeat(46, "x", OverrideType.TEST_RECOMMENDATION, OverrideDirection.REMOVE, "cost"));

        OverridePattern rare = miner.minePatterns(overrides).get(1);

        assertThat(rare.count()).isEqualTo(5);
        assertThat(rare.suggestedAction()).isNull();
    }

    @Test
    void noSuggestionBelowFiveOverrides() {
        List<OverridePattern> patterns = miner.minePatterns(
                repeat(4, "fh", OverrideType.DECISION_OPTION, OverrideDirection.SUBSTITUTE, "occupation"));

        assertThat(patterns).singleElement().satisfies(p -> {
            assertThat(p.percentage()).isCloseTo(100.0, within(1e-9));
            assertThat(p.suggestedAction()).isNull();
        });
    }

    @Test
    void analyzeFiltersByType() {
        repeat(2, "a", OverrideType.COMPLEXITY_TIER, OverrideDirection.UPGRADE, "bmi").forEach(repository::save);
        repeat(3, "b", OverrideType.RISK_SEVERITY, OverrideDirection.DOWNGRADE, "controlled").forEach(repository::save);

        assertThat(miner.analyze(OverrideType.COMPLEXITY_TIER))
                .singleElement()
                .satisfies(p -> {
                    assertThat(p.overrideType()).isEqualTo("complexity_tier");
                    assertThat(p.percentage()).isCloseTo(100.0, within(1e-9));
                });
        assertThat(miner.analyze(null)).extracting(OverridePattern::count).containsExactly(3, 2);
    }
}
