package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * One egress (or ingress) measurement for one resource at one instant.
 *
 * This is the tabular contract every analyzer consumes. Rows are produced by
 * flattening a collected metrics document; the analytics core never fetches them.
 *
 * VALUE SEMANTICS:
 * {@code value} is a byte count or a byte rate depending on {@code unit}; it is
 * finite and never negative.
 * Within a (resourceId, metricName) series no two samples share a timestamp.
 */
@Builder(toBuilder = true)
public record MetricSample(
        String resourceId,
        String resourceName,
        String resourceType,
        String resourceGroup,
        String location,
        String metricName,
        String displayName,
        String unit,
        Instant timestamp,
        double value
) {

    private static final String[] EGRESS_MARKERS = {"out", "sent", "egress"};

    public MetricSample {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!isAcceptableValue(value)) {
            throw new IllegalArgumentException("value must be finite and non-negative: " + value);
        }
        location = location != null ? location.toLowerCase(Locale.ROOT) : "unknown";
    }

    public static boolean isAcceptableValue(Double value) {
        return value != null && Double.isFinite(value) && value >= 0;
    }

    /**
     * Whether this sample measures outbound traffic, judged by metric name.
     */
    @JsonIgnore
    public boolean isEgress() {
        String name = metricName.toLowerCase(Locale.ROOT);
        for (String marker : EGRESS_MARKERS) {
            if (name.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
