package com.underwriting.engine.ruleset;

import com.underwriting.engine.domain.Rule;
import com.underwriting.engine.domain.RuleCatalog;
import com.underwriting.engine.domain.RuleConfiguration;
import com.underwriting.engine.domain.RuleType;
import com.underwriting.engine.util.AlertLogger;
import com.underwriting.engine.util.EngineMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the process-wide rule configuration.
 * <p>
 * Readers get the current {@link RuleConfiguration} snapshot without locking.
 * {@link #reload()} builds a complete new snapshot and swaps it in with a
 * single reference update; if any catalog fails to load, the previous
 * snapshot stays in place.
 */
@ApplicationScoped
public class RuleCatalogRegistry {

    private static final Logger LOG = Logger.getLogger(RuleCatalogRegistry.class);

    private final AtomicReference<RuleConfiguration> current = new AtomicReference<>(RuleConfiguration.empty());

    @Inject
    RuleCatalogLoader loader;

    @Inject
    EngineMetrics engineMetrics;

    @ConfigProperty(name = "app.rules.auto-reload.enabled", defaultValue = "false")
    boolean autoReloadEnabled;

    @ConfigProperty(name = "app.rules.auto-reload.interval-seconds", defaultValue = "60")
    int autoReloadIntervalSeconds;

    private ScheduledExecutorService reloadScheduler;

    @PostConstruct
    void init() {
        LOG.info("Initializing RuleCatalogRegistry");

        if (autoReloadEnabled) {
            startReloadScheduler();
            LOG.infof("Auto-reload enabled: reloading every %d seconds", autoReloadIntervalSeconds);
        } else {
            LOG.info("Auto-reload disabled (manual reload only)");
        }
    }

    @PreDestroy
    void destroy() {
        if (reloadScheduler != null) {
            reloadScheduler.shutdown();
            try {
                if (!reloadScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    reloadScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                reloadScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("RuleCatalogRegistry destroyed");
    }

    // ========== Lookup Operations ==========

    public RuleConfiguration getConfiguration() {
        return current.get();
    }

    public RuleCatalog getCatalog(RuleType type) {
        return current.get().getCatalog(type);
    }

    public List<Rule> getRules(RuleType type) {
        return current.get().getRules(type);
    }

    public boolean isLoaded() {
        return current.get().totalRules() > 0;
    }

    // ========== Reload Operations ==========

    /**
     * Loads every catalog and swaps the whole configuration.
     *
     * @return the configuration now in effect
     * @throws RuleLoadException if loading fails; the previous configuration is kept
     */
    public synchronized RuleConfiguration reload() {
        RuleConfiguration previous = current.get();
        RuleConfiguration next;
        try {
            next = loader.loadAll();
        } catch (RuleLoadException e) {
            String ruleType = e.getRuleType() != null ? e.getRuleType().getValue() : "unknown";
            String version = e.getRuleType() != null ? previous.getCatalog(e.getRuleType()).getVersion() : "-";
            AlertLogger.catalogLoadFailed(ruleType, version, e.getMessage());
            if (engineMetrics != null) {
                engineMetrics.incrementCatalogReloadFailure();
            }
            throw e;
        }

        swap(next);
        if (engineMetrics != null) {
            engineMetrics.incrementCatalogReloadSuccess();
        }
        return next;
    }

    /**
     * Installs an already built configuration.
     */
    public void swap(RuleConfiguration configuration) {
        RuleConfiguration previous = current.getAndSet(configuration);
        for (RuleType type : RuleType.values()) {
            LOG.infof("Rule catalog %s: v%s -> v%s (%d rules)",
                    type.getValue(),
                    previous.getCatalog(type).getVersion(),
                    configuration.getCatalog(type).getVersion(),
                    configuration.getCatalog(type).size());
        }
    }

    private void startReloadScheduler() {
        reloadScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rule-catalog-reload");
            t.setDaemon(true);
            return t;
        });
        reloadScheduler.scheduleAtFixedRate(this::reloadQuietly,
                autoReloadIntervalSeconds, autoReloadIntervalSeconds, TimeUnit.SECONDS);
    }

    void reloadQuietly() {
        try {
            reload();
        } catch (RuntimeException e) {
            LOG.debugf("Scheduled reload failed, keeping current configuration: %s", e.getMessage());
        }
    }
}
