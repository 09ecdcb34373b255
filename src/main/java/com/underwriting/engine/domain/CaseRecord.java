package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read view of an underwriting case as handed over by the persistence layer.
 * <p>
 * The caller loads the case together with its relations (disclosures, risk
 * factors, test results, decisions, overrides) so that the engine sees one
 * consistent snapshot. The engine never keeps a reference past a single call.
 */
public class CaseRecord {

    public static final String STATUS_COMPLETED = "completed";

    @JsonProperty("id")
    private String id;

    @JsonProperty("caseReference")
    private String caseReference;

    @JsonProperty("status")
    private String status;

    @JsonProperty("createdAt")
    private Instant createdAt;

    @JsonProperty("applicantAge")
    private Integer applicantAge;

    @JsonProperty("sumAssured")
    private BigDecimal sumAssured;

    @JsonProperty("medicalDisclosures")
    private List<MedicalDisclosure> medicalDisclosures = new ArrayList<>();

    @JsonProperty("riskFactors")
    private List<String> riskFactors = new ArrayList<>();

    @JsonProperty("testResults")
    private List<TestResult> testResults = new ArrayList<>();

    /**
     * Decision types recorded on the case, most recent first.
     */
    @JsonProperty("decisions")
    private List<String> decisions = new ArrayList<>();

    @JsonProperty("overrides")
    private List<OverrideRecord> overrides = new ArrayList<>();

    public CaseRecord() {
    }

    public CaseRecord(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCaseReference() {
        return caseReference;
    }

    public void setCaseReference(String caseReference) {
        this.caseReference = caseReference;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Integer getApplicantAge() {
        return applicantAge;
    }

    public void setApplicantAge(Integer applicantAge) {
        this.applicantAge = applicantAge;
    }

    public BigDecimal getSumAssured() {
        return sumAssured;
    }

    public void setSumAssured(BigDecimal sumAssured) {
        this.sumAssured = sumAssured;
    }

    public List<MedicalDisclosure> getMedicalDisclosures() {
        return medicalDisclosures;
    }

    public void setMedicalDisclosures(List<MedicalDisclosure> medicalDisclosures) {
        this.medicalDisclosures = medicalDisclosures != null ? medicalDisclosures : new ArrayList<>();
    }

    public List<String> getRiskFactors() {
        return riskFactors;
    }

    public void setRiskFactors(List<String> riskFactors) {
        this.riskFactors = riskFactors != null ? riskFactors : new ArrayList<>();
    }

    public List<TestResult> getTestResults() {
        return testResults;
    }

    public void setTestResults(List<TestResult> testResults) {
        this.testResults = testResults != null ? testResults : new ArrayList<>();
    }

    public List<String> getDecisions() {
        return decisions;
    }

    public void setDecisions(List<String> decisions) {
        this.decisions = decisions != null ? decisions : new ArrayList<>();
    }

    public List<OverrideRecord> getOverrides() {
        return overrides;
    }

    public void setOverrides(List<OverrideRecord> overrides) {
        this.overrides = overrides != null ? overrides : new ArrayList<>();
    }

    /**
     * Shallow copy of this case carrying the given overrides instead of its own.
     */
    public CaseRecord withOverrides(List<OverrideRecord> overrides) {
        CaseRecord copy = new CaseRecord(id);
        copy.caseReference = caseReference;
        copy.status = status;
        copy.createdAt = createdAt;
        copy.applicantAge = applicantAge;
        copy.sumAssured = sumAssured;
        copy.medicalDisclosures = medicalDisclosures;
        copy.riskFactors = riskFactors;
        copy.testResults = testResults;
        copy.decisions = decisions;
        copy.setOverrides(overrides != null ? new ArrayList<>(overrides) : null);
        return copy;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return STATUS_COMPLETED.equalsIgnoreCase(status);
    }

    /**
     * Names of disclosed conditions; medication disclosures are skipped.
     */
    @JsonIgnore
    public List<String> getConditionNames() {
        return medicalDisclosures.stream()
                .filter(MedicalDisclosure::isCondition)
                .map(MedicalDisclosure::getConditionName)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public List<String> getMedicationNames() {
        return medicalDisclosures.stream()
                .filter(MedicalDisclosure::isMedication)
                .map(MedicalDisclosure::getDrugName)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public String getLatestDecision() {
        return decisions.isEmpty() ? null : decisions.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CaseRecord that = (CaseRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CaseRecord{" +
               "id='" + id + '\'' +
               ", caseReference='" + caseReference + '\'' +
               ", status='" + status + '\'' +
               '}';
    }
}
