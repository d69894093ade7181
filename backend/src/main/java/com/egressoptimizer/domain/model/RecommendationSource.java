package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Component that produced a recommendation.
 */
public enum RecommendationSource {
    COST_ANALYZER("cost_analyzer", "cost"),
    ANOMALY_DETECTOR("anomaly_detector", "anomaly"),
    TREND_ANALYZER("trend_analyzer", "trend"),

    /**
     * Cross-signal recommendations built from several analyzers at once.
     */
    RECOMMENDATION_ENGINE("recommendation_engine", "combined");

    private final String value;
    private final String idPrefix;

    RecommendationSource(String value, String idPrefix) {
        this.value = value;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Prefix used when minting recommendation ids.
     */
    public String getIdPrefix() {
        return idPrefix;
    }
}
