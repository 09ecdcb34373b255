package com.underwriting.engine.override;

import com.underwriting.engine.audit.AuditEvent;
import com.underwriting.engine.audit.AuditPublisherFacade;
import com.underwriting.engine.domain.CaseContextSnapshot;
import com.underwriting.engine.domain.CaseRecord;
import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.util.AlertLogger;
import com.underwriting.engine.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Records an underwriter's override of a system recommendation.
 * <p>
 * The case is read once through the {@link CaseSnapshotSource}; its age, sum
 * assured, conditions, medications, risk factors and test results are frozen
 * into the override and never recomputed. One audit event describing the
 * transition is published after the override is stored.
 */
@ApplicationScoped
public class OverrideRecorder {

    private static final Logger LOG = Logger.getLogger(OverrideRecorder.class);

    @Inject
    CaseSnapshotSource caseSource;

    @Inject
    OverrideRepository repository;

    @Inject
    AuditPublisherFacade auditPublisher;

    @Inject
    EngineMetrics engineMetrics;

    @Inject
    Validator validator;

    Clock clock = Clock.systemUTC();

    /**
     * @throws IllegalArgumentException if the request is {@code null}
     * @throws ConstraintViolationException if the request violates its constraints
     * @throws CaseNotFoundException if the case cannot be resolved
     */
    public OverrideRecord record(OverrideRequest request) {
        checkRequest(request);

        CaseRecord caseRecord = caseSource.findCase(request.caseId).orElseThrow(() -> {
            AlertLogger.caseNotResolvable("OverrideRecorder", request.caseId);
            return new CaseNotFoundException(request.caseId);
        });

        OverrideRecord override = OverrideRecord.builder()
                .caseId(caseRecord.getId())
                .overrideType(request.overrideType)
                .direction(request.direction)
                .systemRecommendation(request.systemRecommendation)
                .systemRecommendationDetails(request.systemRecommendationDetails)
                .systemConfidence(request.systemConfidence)
                .underwriterChoice(request.underwriterChoice)
                .underwriterChoiceDetails(request.underwriterChoiceDetails)
                .reasoning(request.reasoning)
                .reasoningTags(request.reasoningTags)
                .caseContextSnapshot(CaseContextSnapshot.capture(caseRecord))
                .underwriter(request.underwriter)
                .createdAt(clock.instant())
                .build();

        OverrideRecord saved = repository.save(override);
        if (engineMetrics != null) {
            engineMetrics.incrementOverridesRecorded();
        }

        publishAudit(saved);

        LOG.infof("Override recorded: case=%s, type=%s, direction=%s, underwriter=%s",
                saved.getCaseId(), saved.getOverrideType().getValue(),
                saved.getDirection().getValue(), saved.getUnderwriter().getId());
        return saved;
    }

    private void publishAudit(OverrideRecord override) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("overrideType", override.getOverrideType().getValue());
        metadata.put("direction", override.getDirection().getValue());
        metadata.put("reasoning", override.getReasoning());

        AuditEvent event = new AuditEvent(
                override.getCaseId(),
                AuditEvent.ACTION_DECISION_OVERRIDDEN,
                AuditEvent.CATEGORY_DECISION_MAKING,
                "Override recorded: " + override.getOverrideType().getValue() + " - " + override.describeTransition(),
                override.getUnderwriter().getId(),
                override.getUnderwriter().getName(),
                "Override",
                override.getId(),
                metadata,
                override.getCreatedAt());

        try {
            auditPublisher.publish(event);
        } catch (RuntimeException e) {
            AlertLogger.auditPublishFailed(event.getAction(), override.getCaseId(), e.getMessage());
            if (engineMetrics != null) {
                engineMetrics.incrementAuditPublishFailure();
            }
        }
    }

    private void checkRequest(OverrideRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Override request is required");
        }
        Set<ConstraintViolation<OverrideRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException("Invalid override request for case " + request.caseId, violations);
        }
    }
}
