package com.underwriting.engine;

import com.underwriting.engine.ruleset.RuleCatalogRegistry;
import com.underwriting.engine.util.EngineMetrics;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Main application class. The engine is used in-process by the surrounding
 * case-management services; this entry point only keeps the container alive.
 */
@QuarkusMain
public class UnderwritingRuleEngineApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(UnderwritingRuleEngineApplication.class);

    public static void main(String[] args) {
        Quarkus.run(UnderwritingRuleEngineApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Underwriting Rule Engine running");
        Quarkus.waitForExit();
        return 0;
    }
}

/**
 * Lifecycle observer for application startup and shutdown events.
 */
@ApplicationScoped
class ApplicationLifecycleObserver {

    private static final Logger LOG = Logger.getLogger(ApplicationLifecycleObserver.class);

    @Inject
    RuleCatalogRegistry registry;

    @Inject
    EngineMetrics engineMetrics;

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Underwriting Rule Engine started with %d rule(s) loaded",
                registry.getConfiguration().totalRules());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.infof("Shutting down. Final counters: %s", engineMetrics.snapshot());
    }
}
