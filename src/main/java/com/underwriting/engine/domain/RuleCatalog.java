package com.underwriting.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable, versioned list of rules of one {@link RuleType}.
 *
 * Catalogs are built once by the loader and never modified afterwards; a
 * configuration change produces a new catalog.
 */
public final class RuleCatalog {

    private final RuleType type;
    private final String version;
    private final String lastModified;
    private final List<Rule> rules;

    public RuleCatalog(RuleType type, String version, String lastModified, List<Rule> rules) {
        this.type = Objects.requireNonNull(type, "type");
        this.version = version;
        this.lastModified = lastModified;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static RuleCatalog empty(RuleType type) {
        return new RuleCatalog(type, "0", null, List.of());
    }

    public RuleType getType() {
        return type;
    }

    public String getVersion() {
        return version;
    }

    public String getLastModified() {
        return lastModified;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public Optional<Rule> findRule(String id) {
        return rules.stream().filter(rule -> Objects.equals(rule.getId(), id)).findFirst();
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "RuleCatalog{" +
               "type=" + type.getValue() +
               ", version='" + version + '\'' +
               ", rules=" + rules.size() +
               '}';
    }
}
