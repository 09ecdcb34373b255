package com.underwriting.engine.ruleset;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Errors and warnings from validating rule configuration. Only errors make a
 * result invalid.
 */
public final class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    @JsonProperty("errors")
    public List<ValidationIssue> getErrors() {
        return errors;
    }

    @JsonProperty("warnings")
    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ValidationResult{" +
               "valid=" + isValid() +
               ", errors=" + errors +
               ", warnings=" + warnings.size() +
               '}';
    }
}
