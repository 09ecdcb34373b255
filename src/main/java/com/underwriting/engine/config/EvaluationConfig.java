package com.underwriting.engine.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Configuration for rule evaluation behavior.
 * <p>
 * Debug mode only affects log verbosity, never the evaluation path.
 */
@ApplicationScoped
public class EvaluationConfig {

    /**
     * Static flag checked before the injected property, so debug logging can be
     * forced on with a system property or environment variable.
     */
    private static final boolean DEBUG_ENABLED =
            Boolean.getBoolean("app.evaluation.debug.enabled") ||
            Boolean.parseBoolean(System.getenv("APP_EVALUATION_DEBUG_ENABLED"));

    @ConfigProperty(name = "app.evaluation.debug.enabled", defaultValue = "false")
    public boolean debugEnabled;

    /**
     * Whether matched items are included in debug log lines.
     * <p>
     * Matched items can carry applicant medical data; disable where logs leave
     * the secure zone.
     */
    @ConfigProperty(name = "app.evaluation.debug.include-matched-items", defaultValue = "false")
    public boolean includeMatchedItems;

    public static boolean isStaticDebugEnabled() {
        return DEBUG_ENABLED;
    }

    public boolean shouldLogDebug() {
        return DEBUG_ENABLED || debugEnabled;
    }
}
