package com.underwriting.engine.startup;

import com.underwriting.engine.domain.RuleConfiguration;
import com.underwriting.engine.domain.RuleType;
import com.underwriting.engine.ruleset.RuleCatalogRegistry;
import com.underwriting.engine.ruleset.RuleLoadException;
import com.underwriting.engine.util.EngineMetrics;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Loads the rule catalogs into the registry when the application starts.
 * <p>
 * <b>Fail-Fast Behavior:</b> with {@code app.rules.startup.fail-fast} on, an
 * invalid or unreadable catalog stops the application from starting rather
 * than letting it evaluate cases against an empty rule set.
 */
@ApplicationScoped
public class StartupRuleCatalogLoader {

    private static final Logger LOG = Logger.getLogger(StartupRuleCatalogLoader.class);

    @Inject
    RuleCatalogRegistry registry;

    @Inject
    EngineMetrics engineMetrics;

    @ConfigProperty(name = "app.rules.startup.load-enabled", defaultValue = "true")
    boolean startupLoadEnabled;

    @ConfigProperty(name = "app.rules.startup.fail-fast", defaultValue = "true")
    boolean failFast;

    void onStart(@Observes StartupEvent event) {
        loadCatalogs();
    }

    void loadCatalogs() {
        if (!startupLoadEnabled) {
            LOG.info("Startup rule catalog loading is disabled");
            return;
        }

        LOG.info("Beginning startup rule catalog loading...");
        long loadStart = System.currentTimeMillis();

        try {
            RuleConfiguration configuration = registry.reload();
            for (RuleType type : RuleType.values()) {
                LOG.infof("Loaded %s catalog v%s: %d rule(s)", type.getValue(),
                        configuration.getCatalog(type).getVersion(),
                        configuration.getCatalog(type).size());
            }
            LOG.infof("Startup rule catalog loading complete: %d rule(s) in total", configuration.totalRules());
        } catch (RuleLoadException e) {
            LOG.errorf(e, "Error loading rule catalogs at startup");
            engineMetrics.incrementStartupCatalogFailure();
            if (failFast) {
                throw new IllegalStateException("Startup rule catalog loading failed: " + e.getMessage(), e);
            }
        } finally {
            engineMetrics.recordStartupLoadTime(System.currentTimeMillis() - loadStart);
        }
    }
}
