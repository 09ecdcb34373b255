package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of system recommendation the underwriter overrode.
 */
public enum OverrideType {

    COMPLEXITY_TIER("complexity_tier"),
    TEST_RECOMMENDATION("test_recommendation"),
    DECISION_OPTION("decision_option"),
    RISK_SEVERITY("risk_severity");

    private final String value;

    OverrideType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OverrideType fromValue(String value) {
        for (OverrideType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown override type: " + value);
    }
}
