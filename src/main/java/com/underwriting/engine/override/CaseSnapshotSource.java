package com.underwriting.engine.override;

import com.underwriting.engine.domain.CaseRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to cases owned by the case-management persistence layer.
 * <p>
 * Implementations return each case with its disclosures, risk factors, test
 * results, decisions and overrides loaded, as one consistent snapshot.
 */
public interface CaseSnapshotSource {

    Optional<CaseRecord> findCase(String caseId);

    /**
     * Completed cases in storage order, at most {@code limit} of them.
     */
    List<CaseRecord> findCompletedCases(int limit);

    /**
     * Number of cases created strictly after {@code since}.
     */
    long countCasesCreatedSince(Instant since);
}
