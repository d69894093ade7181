package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity shared by anomalies and recommendations.
 *
 * The weight drives recommendation ordering and deduplication:
 * a higher weight always wins over confidence.
 */
public enum Severity {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3);

    private final String value;
    private final int weight;

    Severity(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getWeight() {
        return weight;
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }

    /**
     * Band a score against a detection threshold: above twice the threshold is high,
     * within 20% of it is low, anything between is medium.
     */
    public static Severity forScore(double score, double threshold) {
        double magnitude = Math.abs(score);
        if (magnitude > threshold * 2) {
            return HIGH;
        } else if (magnitude <= threshold * 1.2) {
            return LOW;
        }
        return MEDIUM;
    }
}
