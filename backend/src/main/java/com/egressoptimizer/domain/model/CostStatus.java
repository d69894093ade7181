package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spend classification against the configured warning and critical thresholds.
 */
public enum CostStatus {
    NORMAL("normal"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    CostStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isElevated() {
        return this != NORMAL;
    }

    public static CostStatus classify(double cost, double warningThreshold, double criticalThreshold) {
        if (cost > criticalThreshold) {
            return CRITICAL;
        } else if (cost > warningThreshold) {
            return WARNING;
        }
        return NORMAL;
    }
}
