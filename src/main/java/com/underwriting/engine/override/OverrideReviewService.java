package com.underwriting.engine.override;

import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Senior review of recorded overrides: validation, flagging and the review
 * queue.
 */
@ApplicationScoped
public class OverrideReviewService {

    private static final Logger LOG = Logger.getLogger(OverrideReviewService.class);

    @Inject
    OverrideRepository repository;

    @Inject
    EngineMetrics engineMetrics;

    @ConfigProperty(name = "app.overrides.pending-validation-limit", defaultValue = "50")
    int pendingValidationLimit = 50;

    Clock clock = Clock.systemUTC();

    /**
     * Records a review outcome. Repeating a call that leaves the override in
     * the state it is already in changes nothing.
     *
     * @throws OverrideNotFoundException if no override has this id
     */
    public OverrideRecord validate(String overrideId, boolean validated, String validatedBy, String notes) {
        OverrideRecord override = find(overrideId);

        if (override.getValidatedAt() != null
                && override.isValidated() == validated
                && Objects.equals(override.getValidatedBy(), validatedBy)
                && (notes == null || notes.equals(override.getValidationNotes()))) {
            LOG.debugf("Override %s already reviewed by %s, nothing to do", overrideId, validatedBy);
            return override;
        }

        override.markValidated(validated, validatedBy, notes, clock.instant());
        repository.save(override);
        if (engineMetrics != null) {
            engineMetrics.incrementOverridesValidated();
        }
        LOG.infof("Override %s %s by %s", overrideId, validated ? "validated" : "rejected", validatedBy);
        return override;
    }

    /**
     * @throws OverrideNotFoundException if no override has this id
     */
    public OverrideRecord flagForReview(String overrideId, String reason) {
        OverrideRecord override = find(overrideId);

        if (override.isFlaggedForReview() && Objects.equals(override.getReviewNotes(), reason)) {
            return override;
        }

        override.flagForReview(reason);
        repository.save(override);
        if (engineMetrics != null) {
            engineMetrics.incrementOverridesFlagged();
        }
        LOG.infof("Override %s flagged for review: %s", overrideId, reason);
        return override;
    }

    public List<OverrideRecord> pendingValidation() {
        return repository.findPendingValidation(pendingValidationLimit);
    }

    public List<OverrideRecord> overridesForCase(String caseId) {
        return repository.findByCase(caseId);
    }

    private OverrideRecord find(String overrideId) {
        return repository.findById(overrideId)
                .orElseThrow(() -> new OverrideNotFoundException(overrideId));
    }
}
