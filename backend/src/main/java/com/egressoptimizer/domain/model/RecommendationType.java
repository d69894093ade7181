package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Recommendation category. Prioritization caps the number kept per category.
 */
public enum RecommendationType {
    COST("cost"),
    RESOURCE_SPECIFIC("resource_specific"),
    REGION("region"),
    PROJECTION("projection"),
    GENERAL("general"),
    SECURITY("security"),
    TREND("trend"),
    PATTERN("pattern"),
    STRATEGIC("strategic"),
    SECURITY_COST("security_cost"),
    ARCHITECTURE("architecture");

    private final String value;

    RecommendationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
