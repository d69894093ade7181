package com.egressoptimizer.analysis;

import com.egressoptimizer.domain.model.MetricSample;

import java.util.List;

/**
 * Egress-direction filtering shared by all analyzers.
 *
 * A metric counts as outbound when its name contains "out", "sent" or "egress",
 * case-insensitively ("Network Out Total", "BytesSent", "EgressBytes").
 */
public final class EgressMetrics {

    private EgressMetrics() {
        // Utility class
    }

    public static List<MetricSample> filter(List<MetricSample> samples) {
        return samples.stream()
                .filter(MetricSample::isEgress)
                .toList();
    }
}
