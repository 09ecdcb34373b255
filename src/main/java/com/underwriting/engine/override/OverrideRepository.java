package com.underwriting.engine.override;

import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.domain.OverrideType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for override records.
 */
public interface OverrideRepository {

    /**
     * Inserts or updates an override.
     */
    OverrideRecord save(OverrideRecord override);

    Optional<OverrideRecord> findById(String id);

    /**
     * Overrides of one case, newest first.
     */
    List<OverrideRecord> findByCase(String caseId);

    /**
     * Overrides neither validated nor flagged, oldest first.
     */
    List<OverrideRecord> findPendingValidation(int limit);

    /**
     * Overrides of the given type in creation order; every override when
     * {@code type} is {@code null}.
     */
    List<OverrideRecord> findByType(OverrideType type);

    /**
     * Overrides created strictly after {@code since}.
     */
    List<OverrideRecord> findCreatedSince(Instant since);
}
