package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of rule catalogs. Each catalog lives in its own configuration file.
 */
public enum RuleType {

    RISK("risk", "risk-rules", "rules"),
    TEST_PROTOCOL("test-protocols", "test-protocols", "protocols"),
    DECISION("decision", "decision-rules", "rules");

    private final String value;
    private final String fileBaseName;
    private final String listProperty;

    RuleType(String value, String fileBaseName, String listProperty) {
        this.value = value;
        this.fileBaseName = fileBaseName;
        this.listProperty = listProperty;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * File name without extension, e.g. {@code risk-rules}.
     */
    public String getFileBaseName() {
        return fileBaseName;
    }

    /**
     * Name of the JSON array holding the rules in the catalog file.
     */
    public String getListProperty() {
        return listProperty;
    }

    @JsonCreator
    public static RuleType fromValue(String value) {
        for (RuleType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown rule type: " + value);
    }
}
