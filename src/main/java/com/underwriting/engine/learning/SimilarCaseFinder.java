package com.underwriting.engine.learning;

import com.underwriting.engine.domain.CaseRecord;
import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.override.CaseNotFoundException;
import com.underwriting.engine.override.CaseSnapshotSource;
import com.underwriting.engine.util.AlertLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Looks up precedents for a case among completed cases.
 */
@ApplicationScoped
public class SimilarCaseFinder {

    private static final Logger LOG = Logger.getLogger(SimilarCaseFinder.class);

    @Inject
    CaseSnapshotSource caseSource;

    @Inject
    SimilarityScorer scorer;

    @ConfigProperty(name = "app.learning.candidate-pool-size", defaultValue = "500")
    int candidatePoolSize = 500;

    @ConfigProperty(name = "app.learning.similar-case-limit", defaultValue = "10")
    int defaultLimit = 10;

    public List<SimilarCase> findSimilarCases(String caseId) {
        return findSimilarCases(caseId, defaultLimit);
    }

    /**
     * @throws CaseNotFoundException if the target case cannot be resolved
     */
    public List<SimilarCase> findSimilarCases(String caseId, int limit) {
        CaseRecord target = caseSource.findCase(caseId).orElseThrow(() -> {
            AlertLogger.caseNotResolvable("SimilarCaseFinder", caseId);
            return new CaseNotFoundException(caseId);
        });

        List<CaseRecord> pool = caseSource.findCompletedCases(candidatePoolSize);
        List<ScoredCase> ranked = scorer.rank(target, pool, limit);
        LOG.debugf("Case %s: %d of %d candidate(s) similar", caseId, ranked.size(), pool.size());

        List<SimilarCase> results = new ArrayList<>(ranked.size());
        for (ScoredCase scored : ranked) {
            results.add(toSimilarCase(scored));
        }
        return results;
    }

    private static SimilarCase toSimilarCase(ScoredCase scored) {
        CaseRecord caseRecord = scored.caseRecord();
        List<SimilarCase.AppliedOverride> applied = new ArrayList<>();
        for (OverrideRecord override : caseRecord.getOverrides()) {
            applied.add(new SimilarCase.AppliedOverride(
                    override.getOverrideType().getValue(),
                    override.describeTransition(),
                    override.getReasoning()));
        }
        return new SimilarCase(
                caseRecord.getId(),
                caseRecord.getCaseReference(),
                scored.similarity(),
                caseRecord.getStatus(),
                caseRecord.getLatestDecision(),
                applied);
    }
}
