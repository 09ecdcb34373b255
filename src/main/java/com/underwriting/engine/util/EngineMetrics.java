package com.underwriting.engine.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for engine observability.
 * <p>
 * No external dependency required. Can be replaced with Micrometer later.
 */
@ApplicationScoped
public class EngineMetrics {

    private final AtomicLong rulesEvaluatedTotal = new AtomicLong();
    private final AtomicLong ruleMatchesTotal = new AtomicLong();
    private final AtomicLong ruleEvaluationErrorsTotal = new AtomicLong();
    private final AtomicLong catalogReloadSuccessTotal = new AtomicLong();
    private final AtomicLong catalogReloadFailureTotal = new AtomicLong();
    private final AtomicLong startupCatalogFailures = new AtomicLong();
    private final AtomicLong startupCatalogLoadTimeMs = new AtomicLong();
    private final AtomicLong overridesRecordedTotal = new AtomicLong();
    private final AtomicLong overridesValidatedTotal = new AtomicLong();
    private final AtomicLong overridesFlaggedTotal = new AtomicLong();
    private final AtomicLong auditPublishFailureTotal = new AtomicLong();

    public void incrementRulesEvaluated(long count) {
        rulesEvaluatedTotal.addAndGet(count);
    }

    public void incrementRuleMatches(long count) {
        ruleMatchesTotal.addAndGet(count);
    }

    public void incrementRuleEvaluationError() {
        ruleEvaluationErrorsTotal.incrementAndGet();
    }

    public void incrementCatalogReloadSuccess() {
        catalogReloadSuccessTotal.incrementAndGet();
    }

    public void incrementCatalogReloadFailure() {
        catalogReloadFailureTotal.incrementAndGet();
    }

    public void incrementStartupCatalogFailure() {
        startupCatalogFailures.incrementAndGet();
    }

    public void recordStartupLoadTime(long ms) {
        startupCatalogLoadTimeMs.set(ms);
    }

    public void incrementOverridesRecorded() {
        overridesRecordedTotal.incrementAndGet();
    }

    public void incrementOverridesValidated() {
        overridesValidatedTotal.incrementAndGet();
    }

    public void incrementOverridesFlagged() {
        overridesFlaggedTotal.incrementAndGet();
    }

    public void incrementAuditPublishFailure() {
        auditPublishFailureTotal.incrementAndGet();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("rules_evaluated_total", rulesEvaluatedTotal.get());
        m.put("rule_matches_total", ruleMatchesTotal.get());
        m.put("rule_evaluation_errors_total", ruleEvaluationErrorsTotal.get());
        m.put("catalog_reload_success_total", catalogReloadSuccessTotal.get());
        m.put("catalog_reload_failure_total", catalogReloadFailureTotal.get());
        m.put("startup_catalog_failures", startupCatalogFailures.get());
        m.put("startup_catalog_load_time_ms", startupCatalogLoadTimeMs.get());
        m.put("overrides_recorded_total", overridesRecordedTotal.get());
        m.put("overrides_validated_total", overridesValidatedTotal.get());
        m.put("overrides_flagged_total", overridesFlaggedTotal.get());
        m.put("audit_publish_failure_total", auditPublishFailureTotal.get());
        return m;
    }
}
