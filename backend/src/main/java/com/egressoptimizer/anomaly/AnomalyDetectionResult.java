package com.egressoptimizer.anomaly;

import com.egressoptimizer.domain.model.AnomalyResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Successful anomaly detection payload.
 *
 * @param anomalies  deduplicated anomalies, largest |score| first
 * @param byResource the same anomalies grouped by resource id, in first-seen order
 */
public record AnomalyDetectionResult(
        Instant timestamp,
        AnomalySummary summary,
        List<AnomalyResult> anomalies,
        Map<String, List<AnomalyResult>> byResource
) {}
