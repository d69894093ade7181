package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome status reported at every analyzer boundary.
 *
 * Failures are carried as status codes rather than exceptions so that
 * the recommendation engine can keep going when one analyzer fails.
 */
public enum AnalysisStatus {
    SUCCESS("success"),

    /**
     * The dataset was empty.
     */
    NO_DATA("no_data"),

    /**
     * Rows were present but none of them described outbound traffic.
     */
    NO_EGRESS_DATA("no_egress_data"),

    /**
     * Fewer points than the computation needs.
     */
    INSUFFICIENT_DATA("insufficient_data"),

    /**
     * Unexpected failure, message attached.
     */
    ERROR("error"),

    /**
     * Every analyzer ran but nothing was worth recommending.
     */
    NO_RECOMMENDATIONS("no_recommendations");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
