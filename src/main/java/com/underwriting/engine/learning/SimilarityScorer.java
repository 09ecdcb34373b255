package com.underwriting.engine.learning;

import com.underwriting.engine.domain.CaseRecord;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Heuristic resemblance between two cases, used to look up precedents.
 * <p>
 * Points are awarded for applicant age proximity, sum assured proximity,
 * overlapping disclosed conditions, and for candidates that carry a decision
 * or an override. Candidates at or below {@value #MIN_SCORE} points are not
 * considered similar; reported scores are capped at {@value #MAX_SCORE}.
 */
@ApplicationScoped
public class SimilarityScorer {

    static final int DEFAULT_AGE = 35;
    static final int MIN_SCORE = 20;
    static final int MAX_SCORE = 100;

    static final int CONDITION_MATCH_POINTS = 15;
    static final int DECISION_BONUS = 10;
    static final int OVERRIDE_BONUS = 5;

    /**
     * Uncapped score of {@code candidate} against {@code target}.
     */
    public int score(CaseRecord target, CaseRecord candidate) {
        int score = agePoints(ageOf(target), ageOf(candidate));
        score += sumAssuredPoints(target.getSumAssured(), candidate.getSumAssured());
        score += conditionPoints(conditionsOf(target), conditionsOf(candidate));
        if (!candidate.getDecisions().isEmpty()) {
            score += DECISION_BONUS;
        }
        if (!candidate.getOverrides().isEmpty()) {
            score += OVERRIDE_BONUS;
        }
        return score;
    }

    /**
     * Scores every candidate except the target itself and returns the similar
     * ones, best first. Equal scores keep pool order.
     */
    public List<ScoredCase> rank(CaseRecord target, List<CaseRecord> pool, int limit) {
        List<ScoredCase> raw = new ArrayList<>();
        for (CaseRecord candidate : pool) {
            if (Objects.equals(candidate.getId(), target.getId())) {
                continue;
            }
            int score = score(target, candidate);
            if (score > MIN_SCORE) {
                raw.add(new ScoredCase(candidate, score));
            }
        }
        raw.sort(Comparator.comparingInt(ScoredCase::similarity).reversed());

        List<ScoredCase> ranked = new ArrayList<>();
        for (ScoredCase scored : raw) {
            if (ranked.size() >= limit) {
                break;
            }
            ranked.add(new ScoredCase(scored.caseRecord(), Math.min(MAX_SCORE, scored.similarity())));
        }
        return ranked;
    }

    static int agePoints(int targetAge, int candidateAge) {
        int diff = Math.abs(targetAge - candidateAge);
        if (diff <= 5) {
            return 25;
        }
        if (diff <= 10) {
            return 15;
        }
        if (diff <= 15) {
            return 5;
        }
        return 0;
    }

    static int sumAssuredPoints(BigDecimal target, BigDecimal candidate) {
        if (target == null || candidate == null) {
            return 0;
        }
        double a = target.doubleValue();
        double b = candidate.doubleValue();
        double ratio = Math.min(a, b) / Math.max(a, b);
        if (Double.isNaN(ratio)) {
            return 0;
        }
        if (ratio >= 0.8) {
            return 25;
        }
        if (ratio >= 0.5) {
            return 15;
        }
        if (ratio >= 0.3) {
            return 5;
        }
        return 0;
    }

    /**
     * {@value #CONDITION_MATCH_POINTS} points per target condition that
     * contains, or is contained in, any candidate condition.
     */
    static int conditionPoints(List<String> targetConditions, List<String> candidateConditions) {
        int matches = 0;
        for (String condition : targetConditions) {
            for (String other : candidateConditions) {
                if (other.contains(condition) || condition.contains(other)) {
                    matches++;
                    break;
                }
            }
        }
        return matches * CONDITION_MATCH_POINTS;
    }

    private static int ageOf(CaseRecord caseRecord) {
        Integer age = caseRecord.getApplicantAge();
        return age == null || age == 0 ? DEFAULT_AGE : age;
    }

    private static List<String> conditionsOf(CaseRecord caseRecord) {
        return caseRecord.getConditionNames().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }
}
