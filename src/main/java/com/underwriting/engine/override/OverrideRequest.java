package com.underwriting.engine.override;

import com.underwriting.engine.domain.OverrideDirection;
import com.underwriting.engine.domain.OverrideType;
import com.underwriting.engine.domain.Underwriter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Override recording request.
 */
public class OverrideRequest {

    @NotBlank
    public String caseId;

    @NotNull
    public OverrideType overrideType;

    @NotNull
    public OverrideDirection direction;

    public String systemRecommendation;

    public Map<String, Object> systemRecommendationDetails;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    public Double systemConfidence;

    public String underwriterChoice;

    public Map<String, Object> underwriterChoiceDetails;

    @NotBlank
    public String reasoning;

    public List<String> reasoningTags = new ArrayList<>();

    @Valid
    @NotNull
    public Underwriter underwriter;

    public String getCaseId() {
        return caseId;
    }

    public void setCaseId(String caseId) {
        this.caseId = caseId;
    }

    public OverrideType getOverrideType() {
        return overrideType;
    }

    public void setOverrideType(OverrideType overrideType) {
        this.overrideType = overrideType;
    }

    public OverrideDirection getDirection() {
        return direction;
    }

    public void setDirection(OverrideDirection direction) {
        this.direction = direction;
    }

    public String getSystemRecommendation() {
        return systemRecommendation;
    }

    public void setSystemRecommendation(String systemRecommendation) {
        this.systemRecommendation = systemRecommendation;
    }

    public Map<String, Object> getSystemRecommendationDetails() {
        return systemRecommendationDetails;
    }

    public void setSystemRecommendationDetails(Map<String, Object> systemRecommendationDetails) {
        this.systemRecommendationDetails = systemRecommendationDetails;
    }

    public Double getSystemConfidence() {
        return systemConfidence;
    }

    public void setSystemConfidence(Double systemConfidence) {
        this.systemConfidence = systemConfidence;
    }

    public String getUnderwriterChoice() {
        return underwriterChoice;
    }

    public void setUnderwriterChoice(String underwriterChoice) {
        this.underwriterChoice = underwriterChoice;
    }

    public Map<String, Object> getUnderwriterChoiceDetails() {
        return underwriterChoiceDetails;
    }

    public void setUnderwriterChoiceDetails(Map<String, Object> underwriterChoiceDetails) {
        this.underwriterChoiceDetails = underwriterChoiceDetails;
    }

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }

    public List<String> getReasoningTags() {
        return reasoningTags;
    }

    public void setReasoningTags(List<String> reasoningTags) {
        this.reasoningTags = reasoningTags;
    }

    public Underwriter getUnderwriter() {
        return underwriter;
    }

    public void setUnderwriter(Underwriter underwriter) {
        this.underwriter = underwriter;
    }
}
