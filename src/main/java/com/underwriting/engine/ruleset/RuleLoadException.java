package com.underwriting.engine.ruleset;

import com.underwriting.engine.domain.RuleType;

import java.util.List;

/**
 * Raised when a rule catalog cannot be read, parsed or validated. The registry
 * keeps serving the previously loaded configuration.
 */
public class RuleLoadException extends RuntimeException {

    private final RuleType ruleType;
    private final List<ValidationIssue> issues;

    public RuleLoadException(RuleType ruleType, String message) {
        this(ruleType, message, List.of(), null);
    }

    public RuleLoadException(RuleType ruleType, String message, Throwable cause) {
        this(ruleType, message, List.of(), cause);
    }

    public RuleLoadException(RuleType ruleType, String message, List<ValidationIssue> issues) {
        this(ruleType, message, issues, null);
    }

    private RuleLoadException(RuleType ruleType, String message, List<ValidationIssue> issues, Throwable cause) {
        super(message, cause);
        this.ruleType = ruleType;
        this.issues = List.copyOf(issues);
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    /**
     * Validation errors that caused the failure; empty for I/O and parse failures.
     */
    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
