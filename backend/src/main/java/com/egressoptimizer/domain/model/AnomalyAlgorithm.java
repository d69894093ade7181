package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outlier scorer that flagged an anomaly. Score units depend on the algorithm.
 */
public enum AnomalyAlgorithm {
    /**
     * Standard score against the series mean and sample standard deviation.
     */
    ZSCORE("zscore"),

    /**
     * Modified z-score against the median absolute deviation.
     */
    MAD("mad"),

    /**
     * Residual from a trailing rolling mean, scaled by the residual deviation.
     */
    MOVING_AVERAGE("moving_average");

    private final String value;

    AnomalyAlgorithm(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
