package com.underwriting.engine.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured alert lines for failures operators need to act on.
 * <p>
 * Every alert carries an {@code alert_type} and {@code severity} so log
 * aggregators can pick them out of the regular log stream.
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    public static void catalogLoadFailed(String ruleType, String currentVersion, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "RULE_CATALOG_LOAD_FAILURE");
        alertData.put("severity", "WARNING");
        alertData.put("rule_type", ruleType);
        alertData.put("current_version", currentVersion);
        alertData.put("error", error);

        LOG.warnf("ALERT: Rule catalog load failed for %s. Keeping version %s. Error: %s",
                ruleType, currentVersion, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void invalidRuleConfiguration(String ruleType, int errorCount, String firstError) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "INVALID_RULE_CONFIGURATION");
        alertData.put("severity", "CRITICAL");
        alertData.put("rule_type", ruleType);
        alertData.put("error_count", errorCount);
        alertData.put("first_error", firstError);

        LOG.errorf("ALERT: Rule configuration for %s rejected with %d error(s). First: %s",
                ruleType, errorCount, firstError);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void auditPublishFailed(String action, String caseId, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "AUDIT_PUBLISH_FAILURE");
        alertData.put("severity", "WARNING");
        alertData.put("action", action);
        alertData.put("case_id", caseId);
        alertData.put("error", error);

        LOG.warnf("ALERT: Audit event %s for case %s was not published. Error: %s",
                action, caseId, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void caseNotResolvable(String component, String caseId) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "CASE_NOT_RESOLVABLE");
        alertData.put("severity", "WARNING");
        alertData.put("component", component);
        alertData.put("case_id", caseId);

        LOG.warnf("ALERT: %s could not resolve case %s", component, caseId);
        LOG.debugf("Alert details: %s", alertData);
    }
}
