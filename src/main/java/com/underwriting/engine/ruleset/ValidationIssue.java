package com.underwriting.engine.ruleset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single problem found in rule configuration, addressed by its field path
 * (e.g. {@code rules[2].conditions.conditions[0].operator}).
 */
public final class ValidationIssue {

    public enum Severity {
        ERROR, WARNING
    }

    private final String field;
    private final String message;
    private final Severity severity;

    @JsonCreator
    public ValidationIssue(
            @JsonProperty("field") String field,
            @JsonProperty("message") String message,
            @JsonProperty("severity") Severity severity) {
        this.field = field;
        this.message = message;
        this.severity = severity;
    }

    public static ValidationIssue error(String field, String message) {
        return new ValidationIssue(field, message, Severity.ERROR);
    }

    public static ValidationIssue warning(String field, String message) {
        return new ValidationIssue(field, message, Severity.WARNING);
    }

    public ValidationIssue withPrefix(String prefix) {
        return new ValidationIssue(prefix + field, message, severity);
    }

    @JsonProperty("field")
    public String getField() {
        return field;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationIssue that = (ValidationIssue) o;
        return Objects.equals(field, that.field) &&
               Objects.equals(message, that.message) &&
               severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, message, severity);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
