package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the underwriter's choice relates to the recommendation.
 */
public enum OverrideDirection {

    /** More conservative, e.g. routine to moderate. */
    UPGRADE("upgrade"),
    /** Less conservative, e.g. complex to moderate. */
    DOWNGRADE("downgrade"),
    SUBSTITUTE("substitute"),
    /** Added something that was not recommended. */
    ADD("add"),
    /** Removed something that was recommended. */
    REMOVE("remove");

    private final String value;

    OverrideDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OverrideDirection fromValue(String value) {
        for (OverrideDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown override direction: " + value);
    }
}
