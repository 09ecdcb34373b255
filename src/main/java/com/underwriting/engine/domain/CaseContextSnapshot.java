package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Case facts frozen at the moment an override was recorded.
 * <p>
 * Immutable: later edits to the live case never reach this snapshot, which is
 * the ground truth used for learning.
 */
public final class CaseContextSnapshot {

    private final int applicantAge;
    private final BigDecimal sumAssured;
    private final List<String> conditions;
    private final List<String> medications;
    private final List<String> riskFactors;
    private final List<String> testResults;

    @JsonCreator
    public CaseContextSnapshot(
            @JsonProperty("applicantAge") int applicantAge,
            @JsonProperty("sumAssured") BigDecimal sumAssured,
            @JsonProperty("conditions") List<String> conditions,
            @JsonProperty("medications") List<String> medications,
            @JsonProperty("riskFactors") List<String> riskFactors,
            @JsonProperty("testResults") List<String> testResults) {
        this.applicantAge = applicantAge;
        this.sumAssured = sumAssured != null ? sumAssured : BigDecimal.ZERO;
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.medications = medications != null ? List.copyOf(medications) : List.of();
        this.riskFactors = riskFactors != null ? List.copyOf(riskFactors) : List.of();
        this.testResults = testResults != null ? List.copyOf(testResults) : List.of();
    }

    /**
     * Captures the current state of a case. Missing age reads as 0.
     */
    public static CaseContextSnapshot capture(CaseRecord caseRecord) {
        return new CaseContextSnapshot(
                caseRecord.getApplicantAge() != null ? caseRecord.getApplicantAge() : 0,
                caseRecord.getSumAssured(),
                caseRecord.getConditionNames(),
                caseRecord.getMedicationNames(),
                caseRecord.getRiskFactors().stream().filter(Objects::nonNull).toList(),
                caseRecord.getTestResults().stream().map(TestResult::toDisplayString).toList());
    }

    @JsonProperty("applicantAge")
    public int getApplicantAge() {
        return applicantAge;
    }

    @JsonProperty("sumAssured")
    public BigDecimal getSumAssured() {
        return sumAssured;
    }

    @JsonProperty("conditions")
    public List<String> getConditions() {
        return conditions;
    }

    @JsonProperty("medications")
    public List<String> getMedications() {
        return medications;
    }

    @JsonProperty("riskFactors")
    public List<String> getRiskFactors() {
        return riskFactors;
    }

    @JsonProperty("testResults")
    public List<String> getTestResults() {
        return testResults;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CaseContextSnapshot that = (CaseContextSnapshot) o;
        return applicantAge == that.applicantAge &&
               sumAssured.compareTo(that.sumAssured) == 0 &&
               conditions.equals(that.conditions) &&
               medications.equals(that.medications) &&
               riskFactors.equals(that.riskFactors) &&
               testResults.equals(that.testResults);
    }

    @Override
    public int hashCode() {
        return Objects.hash(applicantAge, sumAssured.stripTrailingZeros(), conditions, medications, riskFactors, testResults);
    }
}
