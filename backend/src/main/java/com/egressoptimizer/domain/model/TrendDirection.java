package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of the fitted egress regression line.
 */
public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),

    /**
     * Too few points for a regression.
     */
    UNKNOWN("unknown");

    private final String value;

    TrendDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
