package com.underwriting.engine.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An entry for the case audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEvent {

    public static final String ACTION_DECISION_OVERRIDDEN = "DECISION_OVERRIDDEN";
    public static final String CATEGORY_DECISION_MAKING = "DECISION_MAKING";

    private final String caseId;
    private final String action;
    private final String category;
    private final String description;
    private final String userId;
    private final String userName;
    private final String relatedEntityType;
    private final String relatedEntityId;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    @JsonCreator
    public AuditEvent(
            @JsonProperty("caseId") String caseId,
            @JsonProperty("action") String action,
            @JsonProperty("category") String category,
            @JsonProperty("description") String description,
            @JsonProperty("userId") String userId,
            @JsonProperty("userName") String userName,
            @JsonProperty("relatedEntityType") String relatedEntityType,
            @JsonProperty("relatedEntityId") String relatedEntityId,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("timestamp") Instant timestamp) {
        this.caseId = caseId;
        this.action = action;
        this.category = category;
        this.description = description;
        this.userId = userId;
        this.userName = userName;
        this.relatedEntityType = relatedEntityType;
        this.relatedEntityId = relatedEntityId;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        this.timestamp = timestamp;
    }

    @JsonProperty("caseId")
    public String getCaseId() {
        return caseId;
    }

    @JsonProperty("action")
    public String getAction() {
        return action;
    }

    @JsonProperty("category")
    public String getCategory() {
        return category;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("userId")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("userName")
    public String getUserName() {
        return userName;
    }

    @JsonProperty("relatedEntityType")
    public String getRelatedEntityType() {
        return relatedEntityType;
    }

    @JsonProperty("relatedEntityId")
    public String getRelatedEntityId() {
        return relatedEntityId;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AuditEvent{" +
               "caseId='" + caseId + '\'' +
               ", action='" + action + '\'' +
               ", description='" + description + '\'' +
               '}';
    }
}
