package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Magnitude band of a trend, measured on the slope normalized by the series mean
 * (percent change per data point):
 * - NONE: below 1%
 * - WEAK: 1-5%
 * - MODERATE: 5-10%
 * - STRONG: above 10%
 */
public enum TrendStrength {
    NONE("none"),
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong"),
    UNKNOWN("unknown");

    private final String value;

    TrendStrength(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TrendStrength forSlope(double normalizedSlopePercent) {
        double magnitude = Math.abs(normalizedSlopePercent);
        if (magnitude > 10.0) {
            return STRONG;
        } else if (magnitude > 5.0) {
            return MODERATE;
        }
        return WEAK;
    }
}
