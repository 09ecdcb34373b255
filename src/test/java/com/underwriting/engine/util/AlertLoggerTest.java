package com.underwriting.engine.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class AlertLoggerTest {

    @Test
    void catalogLoadFailedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.catalogLoadFailed("risk", "1.2.0", "boom"));
    }

    @Test
    void invalidRuleConfigurationDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.invalidRuleConfiguration("decision", 3, "rules[0].id: missing"));
    }

    @Test
    void auditPublishFailedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.auditPublishFailed("DECISION_OVERRIDDEN", "case-1", null));
    }

    @Test
    void caseNotResolvableDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.caseNotResolvable("SimilarCaseFinder", "case-404"));
    }
}
