package com.egressoptimizer.anomaly;

import java.util.List;
import java.util.Map;

/**
 * Counts describing one detection run. Algorithm counts are taken before
 * cross-algorithm deduplication, severity counts after.
 */
public record AnomalySummary(
        int totalAnomalies,
        int totalResourcesWithAnomalies,
        List<String> detectionMethods,
        Map<String, Integer> algorithmCounts,
        Map<String, Integer> severityCounts
) {}
