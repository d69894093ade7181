package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * A single flagged point of an egress series.
 *
 * {@code expectedValue} is the baseline the algorithm compared against:
 * the series mean, the series median or the rolling mean.
 */
@Builder
public record AnomalyResult(
        String resourceId,
        String resourceName,
        String metricName,
        Instant timestamp,
        double value,
        double expectedValue,
        double score,
        AnomalyAlgorithm algorithm,
        Severity severity
) {

    @JsonProperty("deviation_percent")
    public double deviationPercent() {
        if (expectedValue == 0) {
            return value > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return (value - expectedValue) / Math.abs(expectedValue) * 100;
    }

    /**
     * Identity used when merging the output of several algorithms.
     */
    public DedupKey dedupKey() {
        return new DedupKey(resourceId, timestamp, metricName);
    }

    public record DedupKey(String resourceId, Instant timestamp, String metricName) {}
}
