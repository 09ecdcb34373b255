package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A recorded divergence between a system recommendation and the underwriter's
 * choice.
 * <p>
 * Everything describing the override itself (recommendation, confidence,
 * choice, reasoning, context snapshot, underwriter) is fixed at creation. The
 * only later transitions are validation by a senior role, which also marks the
 * record for training, and flagging for review.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OverrideRecord {

    public static final String UNTAGGED = "untagged";

    @JsonProperty("id")
    private final String id;

    @JsonProperty("caseId")
    private final String caseId;

    @JsonProperty("overrideType")
    private final OverrideType overrideType;

    @JsonProperty("direction")
    private final OverrideDirection direction;

    @JsonProperty("systemRecommendation")
    private final String systemRecommendation;

    @JsonProperty("systemRecommendationDetails")
    private final Map<String, Object> systemRecommendationDetails;

    @JsonProperty("systemConfidence")
    private final Double systemConfidence;

    @JsonProperty("underwriterChoice")
    private final String underwriterChoice;

    @JsonProperty("underwriterChoiceDetails")
    private final Map<String, Object> underwriterChoiceDetails;

    @JsonProperty("reasoning")
    private final String reasoning;

    @JsonProperty("reasoningTags")
    private final List<String> reasoningTags;

    @JsonProperty("caseContextSnapshot")
    private final CaseContextSnapshot caseContextSnapshot;

    @JsonProperty("underwriter")
    private final Underwriter underwriter;

    @JsonProperty("createdAt")
    private final Instant createdAt;

    @JsonProperty("validated")
    private boolean validated;

    @JsonProperty("validatedBy")
    private String validatedBy;

    @JsonProperty("validatedAt")
    private Instant validatedAt;

    @JsonProperty("validationNotes")
    private String validationNotes;

    @JsonProperty("includedInTraining")
    private boolean includedInTraining;

    @JsonProperty("flaggedForReview")
    private boolean flaggedForReview;

    @JsonProperty("reviewNotes")
    private String reviewNotes;

    private OverrideRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.caseId = Objects.requireNonNull(builder.caseId, "caseId");
        this.overrideType = Objects.requireNonNull(builder.overrideType, "overrideType");
        this.direction = Objects.requireNonNull(builder.direction, "direction");
        this.systemRecommendation = builder.systemRecommendation;
        this.systemRecommendationDetails = immutableCopy(builder.systemRecommendationDetails);
        this.systemConfidence = builder.systemConfidence;
        this.underwriterChoice = builder.underwriterChoice;
        this.underwriterChoiceDetails = immutableCopy(builder.underwriterChoiceDetails);
        this.reasoning = builder.reasoning;
        this.reasoningTags = Collections.unmodifiableList(new ArrayList<>(builder.reasoningTags));
        this.caseContextSnapshot = builder.caseContextSnapshot;
        this.underwriter = builder.underwriter;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Records the outcome of a senior review. A positive validation also
     * includes the override in the next training set.
     */
    public void markValidated(boolean validated, String validatedBy, String notes, Instant at) {
        this.validated = validated;
        this.validatedBy = validatedBy;
        this.validatedAt = at;
        if (notes != null) {
            this.validationNotes = notes;
        }
        if (validated) {
            this.includedInTraining = true;
        }
    }

    public void flagForReview(String reason) {
        this.flaggedForReview = true;
        this.reviewNotes = reason;
    }

    /**
     * First reasoning tag, or {@code untagged} when there is none or it is blank.
     */
    public String getPrimaryTag() {
        String first = reasoningTags.isEmpty() ? null : reasoningTags.get(0);
        return first == null || first.isBlank() ? UNTAGGED : first;
    }

    /**
     * {@code recommendation → choice}.
     */
    public String describeTransition() {
        return systemRecommendation + " → " + underwriterChoice;
    }

    public String getId() {
        return id;
    }

    public String getCaseId() {
        return caseId;
    }

    public OverrideType getOverrideType() {
        return overrideType;
    }

    public OverrideDirection getDirection() {
        return direction;
    }

    public String getSystemRecommendation() {
        return systemRecommendation;
    }

    public Map<String, Object> getSystemRecommendationDetails() {
        return systemRecommendationDetails;
    }

    public Double getSystemConfidence() {
        return systemConfidence;
    }

    public String getUnderwriterChoice() {
        return underwriterChoice;
    }

    public Map<String, Object> getUnderwriterChoiceDetails() {
        return underwriterChoiceDetails;
    }

    public String getReasoning() {
        return reasoning;
    }

    public List<String> getReasoningTags() {
        return reasoningTags;
    }

    public CaseContextSnapshot getCaseContextSnapshot() {
        return caseContextSnapshot;
    }

    public Underwriter getUnderwriter() {
        return underwriter;
    }

    public String getUnderwriterName() {
        return underwriter != null ? underwriter.getName() : null;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isValidated() {
        return validated;
    }

    public String getValidatedBy() {
        return validatedBy;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public String getValidationNotes() {
        return validationNotes;
    }

    public boolean isIncludedInTraining() {
        return includedInTraining;
    }

    public boolean isFlaggedForReview() {
        return flaggedForReview;
    }

    public String getReviewNotes() {
        return reviewNotes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((OverrideRecord) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "OverrideRecord{" +
               "id='" + id + '\'' +
               ", caseId='" + caseId + '\'' +
               ", type=" + overrideType.getValue() +
               ", direction=" + direction.getValue() +
               ", validated=" + validated +
               ", flaggedForReview=" + flaggedForReview +
               '}';
    }

    public static class Builder {
        private String id;
        private String caseId;
        private OverrideType overrideType;
        private OverrideDirection direction;
        private String systemRecommendation;
        private Map<String, Object> systemRecommendationDetails;
        private Double systemConfidence;
        private String underwriterChoice;
        private Map<String, Object> underwriterChoiceDetails;
        private String reasoning;
        private final List<String> reasoningTags = new ArrayList<>();
        private CaseContextSnapshot caseContextSnapshot;
        private Underwriter underwriter;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder caseId(String caseId) {
            this.caseId = caseId;
            return this;
        }

        public Builder overrideType(OverrideType overrideType) {
            this.overrideType = overrideType;
            return this;
        }

        public Builder direction(OverrideDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder systemRecommendation(String systemRecommendation) {
            this.systemRecommendation = systemRecommendation;
            return this;
        }

        public Builder systemRecommendationDetails(Map<String, Object> details) {
            this.systemRecommendationDetails = details;
            return this;
        }

        public Builder systemConfidence(Double systemConfidence) {
            this.systemConfidence = systemConfidence;
            return this;
        }

        public Builder underwriterChoice(String underwriterChoice) {
            this.underwriterChoice = underwriterChoice;
            return this;
        }

        public Builder underwriterChoiceDetails(Map<String, Object> details) {
            this.underwriterChoiceDetails = details;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder reasoningTags(List<String> tags) {
            this.reasoningTags.clear();
            if (tags != null) {
                this.reasoningTags.addAll(tags);
            }
            return this;
        }

        public Builder caseContextSnapshot(CaseContextSnapshot snapshot) {
            this.caseContextSnapshot = snapshot;
            return this;
        }

        public Builder underwriter(Underwriter underwriter) {
            this.underwriter = underwriter;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public OverrideRecord build() {
            return new OverrideRecord(this);
        }
    }
}
