package com.underwriting.engine.override;

import com.underwriting.engine.audit.AuditEvent;
import com.underwriting.engine.audit.AuditException;
import com.underwriting.engine.audit.AuditPublisherFacade;
import com.underwriting.engine.domain.CaseRecord;
import com.underwriting.engine.domain.MedicalDisclosure;
import com.underwriting.engine.domain.OverrideDirection;
import com.underwriting.engine.domain.OverrideRecord;
import com.underwriting.engine.domain.OverrideType;
import com.underwriting.engine.domain.TestResult;
import com.underwriting.engine.domain.Underwriter;
import com.underwriting.engine.util.EngineMetrics;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.hibernate.validator.HibernateValidator;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OverrideRecorderTest {

    private static final Instant NOW = Instant.parse("2026-10-01T09:30:00Z");

    private static final Validator VALIDATOR = Validation.byProvider(HibernateValidator.class)
            .configure()
            .messageInterpolator(new ParameterMessageInterpolator())
            .buildValidatorFactory()
            .getValidator();

    @Mock
    AuditPublisherFacade auditPublisher;

    private OverrideRecorder recorder;
    private InMemoryOverrideRepository repository;
    private InMemoryCaseSnapshotSource caseSource;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        repository = new InMemoryOverrideRepository();
        caseSource = new InMemoryCaseSnapshotSource();
        caseSource.overrideRepository = repository;
        metrics = new EngineMetrics();

        recorder = new OverrideRecorder();
        recorder.caseSource = caseSource;
        recorder.repository = repository;
        recorder.auditPublisher = auditPublisher;
        recorder.engineMetrics = metrics;
        recorder.validator = VALIDATOR;
        recorder.clock = Clock.fixed(NOW, ZoneOffset.UTC);

        CaseRecord caseRecord = new CaseRecord("case-1");
        caseRecord.setApplicantAge(45);
        caseRecord.setSumAssured(new BigDecimal("5000000"));
        caseRecord.setMedicalDisclosures(new ArrayList<>(List.of(
                MedicalDisclosure.condition("Type 2 Diabetes"), MedicalDisclosure.medication("Metformin"))));
        caseRecord.setRiskFactors(new ArrayList<>(List.of("Diabetes")));
        caseRecord.setTestResults(new ArrayList<>(List.of(new TestResult("HbA1c", "7.2"))));
        caseSource.save(caseRecord);
    }

    private static OverrideRequest request() {
        OverrideRequest request = new OverrideRequest();
        request.setCaseId("case-1");
        request.setOverrideType(OverrideType.COMPLEXITY_TIER);
        request.setDirection(OverrideDirection.UPGRADE);
        request.setSystemRecommendation("moderate");
        request.setSystemConfidence(0.82);
        request.setUnderwriterChoice("complex");
        request.setReasoning("Poorly controlled diabetes with recent HbA1c rise");
        request.setReasoningTags(List.of("diabetes_control"));
        request.setUnderwriter(new Underwriter("uw-1", "R. Mensah", "underwriter", 6));
        return request;
    }

    @Test
    void recordsOverrideWithFrozenSnapshot() {
        OverrideRecord override = recorder.record(request());

        assertThat(override.getCaseId()).isEqualTo("case-1");
        assertThat(override.getCreatedAt()).isEqualTo(NOW);
        assertThat(override.getCaseContextSnapshot().getApplicantAge()).isEqualTo(45);
        assertThat(override.getCaseContextSnapshot().getConditions()).containsExactly("Type 2 Diabetes");
        assertThat(override.getCaseContextSnapshot().getMedications()).containsExactly("Metformin");
        assertThat(override.getCaseContextSnapshot().getTestResults()).containsExactly("HbA1c: 7.2");
        assertThat(repository.findById(override.getId())).contains(override);
        assertThat(metrics.snapshot()).containsEntry("overrides_recorded_total", 1L);
    }

    @Test
    void publishesOneAuditEventDescribingTransition() {
        OverrideRecord override = recorder.record(request());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditPublisher).publish(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.getAction()).isEqualTo(AuditEvent.ACTION_DECISION_OVERRIDDEN);
        assertThat(event.getCategory()).isEqualTo(AuditEvent.CATEGORY_DECISION_MAKING);
        assertThat(event.getDescription()).isEqualTo("Override recorded: complexity_tier - moderate → complex");
        assertThat(event.getUserId()).isEqualTo("uw-1");
        assertThat(event.getRelatedEntityType()).isEqualTo("Override");
        assertThat(event.getRelatedEntityId()).isEqualTo(override.getId());
        assertThat(event.getMetadata()).containsEntry("direction", "upgrade");
    }

    @Test
    void missingCaseFailsWithoutSideEffects() {
        OverrideRequest request = request();
        request.setCaseId("case-404");

        assertThatThrownBy(() -> recorder.record(request))
                .isInstanceOf(CaseNotFoundException.class)
                .hasMessageContaining("case-404");
        assertThat(repository.findByType(null)).isEmpty();
        verifyNoInteractions(auditPublisher);
    }

    @Test
    void rejectsIncompleteRequests() {
        OverrideRequest blankReasoning = request();
        blankReasoning.setReasoning("  ");
        OverrideRequest noUnderwriter = request();
        noUnderwriter.setUnderwriter(null);
        OverrideRequest badConfidence = request();
        badConfidence.setSystemConfidence(1.5);
        OverrideRequest anonymousUnderwriter = request();
        anonymousUnderwriter.setUnderwriter(new Underwriter(" ", "R. Mensah", "underwriter", 6));

        assertThat(violatedFields(blankReasoning)).containsExactly("reasoning");
        assertThat(violatedFields(noUnderwriter)).containsExactly("underwriter");
        assertThat(violatedFields(badConfidence)).containsExactly("systemConfidence");
        assertThat(violatedFields(anonymousUnderwriter)).containsExactly("underwriter.id");
        assertThat(repository.findByType(null)).isEmpty();
        verifyNoInteractions(auditPublisher);
    }

    @Test
    void rejectsMissingRequest() {
        assertThatThrownBy(() -> recorder.record(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private List<String> violatedFields(OverrideRequest request) {
        Throwable thrown = catchThrowable(() -> recorder.record(request));
        assertThat(thrown).isInstanceOf(ConstraintViolationException.class);
        return ((ConstraintViolationException) thrown).getConstraintViolations().stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .sorted()
                .collect(Collectors.toList());
    }

    @Test
    void auditFailureKeepsRecordedOverride() {
        doThrow(new AuditException("sink down")).when(auditPublisher).publish(any());

        OverrideRecord override = recorder.record(request());

        assertThat(repository.findById(override.getId())).isPresent();
        assertThat(metrics.snapshot()).containsEntry("audit_publish_failure_total", 1L);
    }

    @Test
    void recordedOverrideShowsUpOnCase() {
        OverrideRecord override = recorder.record(request());

        assertThat(caseSource.findCase("case-1").orElseThrow().getOverrides()).containsExactly(override);
    }
}
