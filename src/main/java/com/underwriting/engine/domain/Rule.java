package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named, prioritized condition tree plus an opaque action payload.
 *
 * A rule consists of:
 * - An ID that uniquely identifies the rule within its catalog
 * - A name for display purposes
 * - A root condition (leaf or AND/OR compound)
 * - Priority for ordering matches (higher = first)
 * - An actions payload that the engine hands back to the caller untouched
 * - The alwaysInclude flag, which surfaces the rule even when it does not match
 *   so callers can apply default/fallback actions
 * - Any further type-specific attributes (category, tests, decisionType, output)
 */
public class Rule {

    @NotBlank(message = "Rule ID is required")
    @JsonProperty("id")
    private String id;

    @NotBlank(message = "Rule name is required")
    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("enabled")
    private boolean enabled = true;

    @PositiveOrZero(message = "Priority must not be negative")
    @JsonProperty("priority")
    private int priority = 0;

    @NotNull(message = "Conditions are required")
    @JsonProperty("conditions")
    private Condition conditions;

    @JsonProperty("actions")
    private JsonNode actions;

    @JsonProperty("alwaysInclude")
    private boolean alwaysInclude = false;

    private final Map<String, JsonNode> attributes = new LinkedHashMap<>();

    public Rule() {
    }

    public Rule(String id, String name, int priority, Condition conditions) {
        this.id = id;
        this.name = name;
        this.priority = priority;
        this.conditions = conditions;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Condition getConditions() {
        return conditions;
    }

    public void setConditions(Condition conditions) {
        this.conditions = conditions;
    }

    public JsonNode getActions() {
        return actions;
    }

    public void setActions(JsonNode actions) {
        this.actions = actions;
    }

    public boolean isAlwaysInclude() {
        return alwaysInclude;
    }

    public void setAlwaysInclude(boolean alwaysInclude) {
        this.alwaysInclude = alwaysInclude;
    }

    /**
     * Type-specific attributes such as {@code category}, {@code tests},
     * {@code decisionType} or {@code output}.
     */
    @JsonAnyGetter
    public Map<String, JsonNode> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @JsonAnySetter
    public void setAttribute(String name, JsonNode value) {
        attributes.put(name, value);
    }

    public JsonNode getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rule rule = (Rule) o;
        return Objects.equals(id, rule.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Rule{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", priority=" + priority +
               ", enabled=" + enabled +
               ", alwaysInclude=" + alwaysInclude +
               '}';
    }
}
