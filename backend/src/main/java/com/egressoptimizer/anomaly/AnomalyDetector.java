package com.egressoptimizer.anomaly;

import com.egressoptimizer.analysis.AnalysisOutcome;
import com.egressoptimizer.analysis.EgressMetrics;
import com.egressoptimizer.domain.model.AnalyzerRecommendation;
import com.egressoptimizer.domain.model.AnomalyAlgorithm;
import com.egressoptimizer.domain.model.AnomalyResult;
import com.egressoptimizer.domain.model.MetricSample;
import com.egressoptimizer.domain.model.RecommendationType;
import com.egressoptimizer.domain.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Ensemble outlier detection over egress series.
 *
 * DETECTION FLOW:
 * 1. Keep egress metrics, split into series per (resource, metric), time-ordered
 * 2. Run z-score, MAD and moving-average scorers on every series
 * 3. Merge the three outputs: one anomaly per (resource, timestamp, metric),
 *    the strongest |score| wins
 * 4. Rank by |score| and group by resource
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private final AnomalySettings settings;
    private final Clock clock;

    private static final List<String> DETECTION_METHODS = Arrays.stream(AnomalyAlgorithm.values())
            .map(AnomalyAlgorithm::getValue)
            .toList();

    private static final int COST_IMPACT_ANOMALY_COUNT = 5;

    /**
     * Detect anomalies in the egress series of the dataset.
     */
    public AnalysisOutcome<AnomalyDetectionResult> detectAnomalies(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return AnalysisOutcome.noData();
        }

        List<MetricSample> egress = EgressMetrics.filter(samples);
        if (egress.isEmpty()) {
            return AnalysisOutcome.noEgressData();
        }

        try {
            Map<SeriesKey, List<MetricSample>> series = splitSeries(egress);

            List<AnomalyResult> zscore = new ArrayList<>();
            List<AnomalyResult> mad = new ArrayList<>();
            List<AnomalyResult> movingAverage = new ArrayList<>();
            for (var entry : series.entrySet()) {
                zscore.addAll(AnomalyAlgorithms.zScore(entry.getKey(), entry.getValue(), settings));
                mad.addAll(AnomalyAlgorithms.mad(entry.getKey(), entry.getValue(), settings));
                movingAverage.addAll(AnomalyAlgorithms.movingAverage(entry.getKey(), entry.getValue(), settings));
            }

            List<AnomalyResult> all = new ArrayList<>(zscore.size() + mad.size() + movingAverage.size());
            all.addAll(zscore);
            all.addAll(mad);
            all.addAll(movingAverage);

            List<AnomalyResult> unique = deduplicate(all);
            // List.sort is stable: equal magnitudes keep merge order
            unique.sort(Comparator.comparingDouble((AnomalyResult a) -> Math.abs(a.score())).reversed());

            Map<String, List<AnomalyResult>> byResource = new LinkedHashMap<>();
            for (AnomalyResult anomaly : unique) {
                byResource.computeIfAbsent(anomaly.resourceId(), k -> new ArrayList<>()).add(anomaly);
            }

            Map<String, Integer> algorithmCounts = new LinkedHashMap<>();
            algorithmCounts.put(AnomalyAlgorithm.ZSCORE.getValue(), zscore.size());
            algorithmCounts.put(AnomalyAlgorithm.MAD.getValue(), mad.size());
            algorithmCounts.put(AnomalyAlgorithm.MOVING_AVERAGE.getValue(), movingAverage.size());

            Map<String, Integer> severityCounts = new LinkedHashMap<>();
            for (Severity severity : List.of(Severity.HIGH, Severity.MEDIUM, Severity.LOW)) {
                int count = (int) unique.stream().filter(a -> a.severity() == severity).count();
                severityCounts.put(severity.getValue(), count);
            }

            AnomalySummary summary = new AnomalySummary(
                    unique.size(),
                    byResource.size(),
                    DETECTION_METHODS,
                    algorithmCounts,
                    severityCounts
            );

            log.info("Anomaly detection: {} anomalies across {} resources ({} series scanned)",
                    unique.size(), byResource.size(), series.size());

            return AnalysisOutcome.success(new AnomalyDetectionResult(
                    Instant.now(clock),
                    summary,
                    List.copyOf(unique),
                    byResource
            ));

        } catch (Exception e) {
            log.error("Error detecting anomalies", e);
            return AnalysisOutcome.failed(e);
        }
    }

    /**
     * Turn a detection result into security and cost recommendations.
     * Returns nothing unless detection succeeded and found at least one anomaly.
     */
    public List<AnalyzerRecommendation> generateAnomalyRecommendations(
            AnalysisOutcome<AnomalyDetectionResult> outcome) {

        Optional<AnomalyDetectionResult> value = outcome != null ? outcome.value() : Optional.empty();
        if (value.isEmpty() || value.get().summary().totalAnomalies() == 0) {
            return List.of();
        }
        AnomalyDetectionResult result = value.get();
        int total = result.summary().totalAnomalies();

        List<AnalyzerRecommendation> recommendations = new ArrayList<>();

        long highCount = result.anomalies().stream()
                .filter(a -> a.severity() == Severity.HIGH)
                .count();

        if (highCount > 0) {
            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.SECURITY)
                    .severity(Severity.HIGH)
                    .title("Critical Egress Anomalies Detected")
                    .description("Detected " + highCount + " high-severity anomalies in egress traffic patterns.")
                    .actions(List.of(
                            "Investigate resources with anomalous egress patterns immediately",
                            "Check for unauthorized access or data exfiltration",
                            "Review security logs for suspicious activities",
                            "Implement egress filtering if necessary"
                    ))
                    .build());
        } else {
            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.SECURITY)
                    .severity(Severity.MEDIUM)
                    .title("Egress Anomalies Detected")
                    .description("Detected " + total + " anomalies in egress traffic patterns.")
                    .actions(List.of(
                            "Monitor resources with anomalous egress patterns",
                            "Review recent application changes that might affect network traffic",
                            "Set up alerts for significant traffic spikes"
                    ))
                    .build());
        }

        for (var entry : result.byResource().entrySet()) {
            List<AnomalyResult> anomalies = entry.getValue();
            if (anomalies.isEmpty()) {
                continue;
            }
            boolean hasHigh = anomalies.stream().anyMatch(a -> a.severity() == Severity.HIGH);
            if (!hasHigh) {
                continue;
            }
            String resourceName = anomalies.get(0).resourceName() != null
                    ? anomalies.get(0).resourceName()
                    : "Unknown resource";

            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.RESOURCE_SPECIFIC)
                    .severity(Severity.HIGH)
                    .title("Investigate " + resourceName + " Egress Anomaly")
                    .description("Resource has exhibited highly anomalous egress patterns.")
                    .actions(List.of(
                            "Verify all outbound connections from this resource",
                            "Check for unauthorized access",
                            "Review application logs for errors or unexpected behavior",
                            "Consider implementing network security groups for egress control"
                    ))
                    .resourceId(entry.getKey())
                    .build());
        }

        if (total > COST_IMPACT_ANOMALY_COUNT) {
            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.COST)
                    .severity(Severity.MEDIUM)
                    .title("Cost Impact from Anomalous Egress")
                    .description("Multiple egress anomalies may lead to unexpected costs.")
                    .actions(List.of(
                            "Review egress patterns for cost efficiency",
                            "Set up budget alerts for unexpected traffic spikes",
                            "Consider implementing egress optimization techniques"
                    ))
                    .build());
        }

        log.debug("Generated {} anomaly recommendations", recommendations.size());
        return recommendations;
    }

    /**
     * Keep one anomaly per (resource, timestamp, metric): the one with the larger |score|.
     * The first one seen wins a tie; output keeps first-seen key order.
     */
    static List<AnomalyResult> deduplicate(List<AnomalyResult> anomalies) {
        Map<AnomalyResult.DedupKey, AnomalyResult> best = new LinkedHashMap<>();
        for (AnomalyResult anomaly : anomalies) {
            best.merge(anomaly.dedupKey(), anomaly,
                    (kept, candidate) -> Math.abs(candidate.score()) > Math.abs(kept.score()) ? candidate : kept);
        }
        return new ArrayList<>(best.values());
    }

    private Map<SeriesKey, List<MetricSample>> splitSeries(List<MetricSample> egress) {
        Map<SeriesKey, List<MetricSample>> series = new TreeMap<>();
        for (MetricSample sample : egress) {
            SeriesKey key = new SeriesKey(sample.resourceId(), sample.resourceName(), sample.metricName());
            series.computeIfAbsent(key, k -> new ArrayList<>()).add(sample);
        }
        series.values().forEach(points -> points.sort(Comparator.comparing(MetricSample::timestamp)));
        return series;
    }
}
