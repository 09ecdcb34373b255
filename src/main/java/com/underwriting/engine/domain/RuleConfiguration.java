package com.underwriting.engine.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide rule configuration: one catalog per {@link RuleType}.
 * <p>
 * Immutable. A reload builds a complete new instance which the registry swaps
 * in atomically; readers holding the previous instance keep a consistent view.
 */
public final class RuleConfiguration {

    private final Map<RuleType, RuleCatalog> catalogs;
    private final Instant loadedAt;

    public RuleConfiguration(Map<RuleType, RuleCatalog> catalogs, Instant loadedAt) {
        EnumMap<RuleType, RuleCatalog> copy = new EnumMap<>(RuleType.class);
        for (RuleType type : RuleType.values()) {
            RuleCatalog catalog = catalogs.get(type);
            copy.put(type, catalog != null ? catalog : RuleCatalog.empty(type));
        }
        this.catalogs = Collections.unmodifiableMap(copy);
        this.loadedAt = loadedAt;
    }

    public static RuleConfiguration empty() {
        return new RuleConfiguration(Map.of(), Instant.EPOCH);
    }

    public RuleCatalog getCatalog(RuleType type) {
        return catalogs.get(type);
    }

    public List<Rule> getRules(RuleType type) {
        return catalogs.get(type).getRules();
    }

    public Map<RuleType, RuleCatalog> getCatalogs() {
        return catalogs;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public int totalRules() {
        return catalogs.values().stream().mapToInt(RuleCatalog::size).sum();
    }
}
