package com.egressoptimizer.recommendation;

import com.egressoptimizer.analysis.AnalysisOutcome;
import com.egressoptimizer.anomaly.AnomalyDetectionResult;
import com.egressoptimizer.anomaly.AnomalyDetector;
import com.egressoptimizer.cost.CostAnalysis;
import com.egressoptimizer.cost.CostAnalyzer;
import com.egressoptimizer.cost.CostSettings;
import com.egressoptimizer.domain.model.*;
import com.egressoptimizer.ingestion.ResourceIds;
import com.egressoptimizer.trend.HourlyPattern;
import com.egressoptimizer.trend.TrendAnalyzer;
import com.egressoptimizer.trend.TrendResult;
import com.egressoptimizer.trend.WeeklyPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Fuses the output of the three analyzers into one ranked list of recommendations.
 *
 * DECISION FLOW:
 * 1. Run trend, cost and anomaly analysis (or accept their results)
 * 2. Normalize each analyzer's recommendations, assigning source and confidence
 * 3. Add combined recommendations for signals that reinforce each other
 * 4. Deduplicate by title, keeping the most severe, then most confident
 * 5. Rank by severity then confidence, cap per category, cap overall
 *
 * PARTIAL RESULTS:
 * An analyzer that did not succeed contributes nothing; combined rules fire
 * only when every analyzer they read succeeded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationEngine {

    private final TrendAnalyzer trendAnalyzer;
    private final CostAnalyzer costAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final RecommendationSettings settings;
    private final CostSettings costSettings;
    private final Clock clock;

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private static final double COST_CONFIDENCE = 0.9;
    private static final double STEEP_TREND_PERCENT = 20.0;
    private static final int SECURITY_COST_ANOMALY_COUNT = 3;
    private static final double ARCHITECTURE_COST_RATIO = 0.5;

    private static final Comparator<Recommendation> PRIORITY = Comparator
            .comparingInt(Recommendation::severityWeight).reversed()
            .thenComparing(Comparator.comparingDouble(Recommendation::confidence).reversed());

    /**
     * Run every analyzer over the dataset and build a recommendation report.
     */
    public RecommendationReport generateRecommendations(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return RecommendationReport.noData();
        }

        log.info("Generating recommendations from all analysis modules for {} samples", samples.size());

        return generateRecommendations(
                samples,
                trendAnalyzer.analyzeOverallTrend(samples),
                costAnalyzer.analyzeCosts(samples),
                anomalyDetector.detectAnomalies(samples)
        );
    }

    /**
     * Build a recommendation report from analyses that were already run.
     * The samples are still needed for weekly and hourly pattern detection.
     * Pass {@link AnalysisOutcome#noData()} for an analysis that was not run.
     *
     * @throws NullPointerException if any outcome is null
     */
    public RecommendationReport generateRecommendations(
            List<MetricSample> samples,
            AnalysisOutcome<TrendResult> trend,
            AnalysisOutcome<CostAnalysis> costs,
            AnalysisOutcome<AnomalyDetectionResult> anomalies
    ) {
        Objects.requireNonNull(trend, "trend outcome");
        Objects.requireNonNull(costs, "cost outcome");
        Objects.requireNonNull(anomalies, "anomaly outcome");
        if (samples == null || samples.isEmpty()) {
            return RecommendationReport.noData();
        }

        Instant now = Instant.now(clock);
        IdSequence ids = new IdSequence(ID_TIMESTAMP.format(now));

        Optional<TrendResult> trendResult = trend.value();
        Optional<CostAnalysis> costAnalysis = costs.value();
        Optional<AnomalyDetectionResult> anomalyResult = anomalies.value();

        // Computed once and shared by the pattern and architecture rules
        Optional<WeeklyPattern> weekly = trendAnalyzer.detectWeeklyPatterns(samples).value();
        Optional<HourlyPattern> hourly = trendAnalyzer.detectHourlyPatterns(samples).value();

        List<Recommendation> all = new ArrayList<>();

        for (AnalyzerRecommendation rec : costAnalyzer.generateCostRecommendations(costs)) {
            all.add(normalize(rec, RecommendationSource.COST_ANALYZER, COST_CONFIDENCE, ids));
        }

        all.addAll(trendRecommendations(trendResult, weekly, hourly, ids));

        for (AnalyzerRecommendation rec : anomalyDetector.generateAnomalyRecommendations(anomalies)) {
            double confidence = rec.severity() == Severity.HIGH ? 0.85 : 0.7;
            all.add(normalize(rec, RecommendationSource.ANOMALY_DETECTOR, confidence, ids));
        }

        all.addAll(combinedRecommendations(trendResult, costAnalysis, anomalyResult, weekly, hourly, ids));

        List<Recommendation> unique = deduplicate(all);
        List<Recommendation> prioritized = prioritize(unique);

        Map<String, Integer> categories = new LinkedHashMap<>();
        for (Recommendation rec : prioritized) {
            categories.merge(rec.type().getValue(), 1, Integer::sum);
        }

        log.info("Recommendation report: {} of {} candidates kept (trends={}, costs={}, anomalies={})",
                prioritized.size(), all.size(), trend.isSuccess(), costs.isSuccess(), anomalies.isSuccess());

        return new RecommendationReport(
                prioritized.isEmpty() ? AnalysisStatus.NO_RECOMMENDATIONS : AnalysisStatus.SUCCESS,
                now,
                prioritized.size(),
                new RecommendationReport.Sources(trend.isSuccess(), costs.isSuccess(), anomalies.isSuccess()),
                categories,
                prioritized
        );
    }

    private List<Recommendation> trendRecommendations(
            Optional<TrendResult> trend,
            Optional<WeeklyPattern> weekly,
            Optional<HourlyPattern> hourly,
            IdSequence ids
    ) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (trend.isPresent()) {
            TrendResult result = trend.get();
            boolean significant = result.strength() == TrendStrength.MODERATE
                    || result.strength() == TrendStrength.STRONG;

            if (result.direction() == TrendDirection.INCREASING && significant) {
                boolean steep = Math.abs(result.normalizedSlopePercent()) > STEEP_TREND_PERCENT;

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("normalized_slope", result.normalizedSlopePercent());
                metadata.put("day_over_day", result.dayOverDayPercent());
                metadata.put("week_over_week", result.weekOverWeekPercent());

                recommendations.add(Recommendation.builder()
                        .id(ids.next(RecommendationSource.TREND_ANALYZER))
                        .type(RecommendationType.TREND)
                        .title("Rising Egress Traffic Trend Detected")
                        .description(String.format(Locale.ROOT,
                                "Egress traffic is showing a %s increasing trend (%.1f%% per data point). "
                                        + "This may lead to increased costs.",
                                result.strength().getValue(), result.normalizedSlopePercent()))
                        .severity(steep ? Severity.HIGH : Severity.MEDIUM)
                        .actions(List.of(
                                "Review recent application or infrastructure changes",
                                "Set up budget alerts for unexpected traffic increases",
                                "Analyze top traffic generating resources",
                                "Consider implementing caching or CDN for frequently accessed content"
                        ))
                        .confidence(steep ? 0.85 : 0.7)
                        .source(RecommendationSource.TREND_ANALYZER)
                        .metadata(metadata)
                        .build());
            }
        }

        if (weekly.isPresent() && weekly.get().hasPattern() && !weekly.get().peakDays().isEmpty()) {
            WeeklyPattern pattern = weekly.get();

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("peak_days", pattern.peakDays());
            metadata.put("low_days", pattern.lowDays());
            metadata.put("weekend_weekday_percent_diff", pattern.weekendWeekdayPercentDiff());

            recommendations.add(Recommendation.builder()
                    .id(ids.next(RecommendationSource.TREND_ANALYZER))
                    .type(RecommendationType.PATTERN)
                    .title("Weekly Egress Pattern Detected")
                    .description("Egress traffic peaks on " + String.join(", ", pattern.peakDays())
                            + ". Consider scheduling large data transfers during off-peak days.")
                    .severity(Severity.MEDIUM)
                    .actions(List.of(
                            "Schedule batch processing during low traffic days",
                            "Implement auto-scaling based on weekly patterns",
                            "Consider reserved capacity planning based on these patterns"
                    ))
                    .confidence(0.75)
                    .source(RecommendationSource.TREND_ANALYZER)
                    .metadata(metadata)
                    .build());
        }

        if (hourly.isPresent() && hourly.get().hasPattern() && !hourly.get().peakHours().isEmpty()) {
            HourlyPattern pattern = hourly.get();
            String peaks = pattern.peakHours().stream()
                    .map(hour -> hour + ":00")
                    .collect(Collectors.joining(", "));

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("peak_hours", pattern.peakHours());
            metadata.put("business_hours_percent_diff", pattern.businessHoursPercentDiff());

            recommendations.add(Recommendation.builder()
                    .id(ids.next(RecommendationSource.TREND_ANALYZER))
                    .type(RecommendationType.PATTERN)
                    .title("Daily Egress Pattern Detected")
                    .description("Egress traffic peaks at " + peaks
                            + ". Optimize scheduling of data transfers to reduce congestion.")
                    .severity(Severity.LOW)
                    .actions(List.of(
                            "Schedule non-critical transfers during off-peak hours",
                            "Consider traffic shaping for better load distribution",
                            "Review applications causing peak hour traffic"
                    ))
                    .confidence(0.7)
                    .source(RecommendationSource.TREND_ANALYZER)
                    .metadata(metadata)
                    .build());
        }

        return recommendations;
    }

    private List<Recommendation> combinedRecommendations(
            Optional<TrendResult> trend,
            Optional<CostAnalysis> costs,
            Optional<AnomalyDetectionResult> anomalies,
            Optional<WeeklyPattern> weekly,
            Optional<HourlyPattern> hourly,
            IdSequence ids
    ) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (costs.isEmpty()) {
            return recommendations;
        }
        CostAnalysis cost = costs.get();
        boolean elevated = cost.costStatus().isElevated();

        if (trend.isPresent() && trend.get().direction() == TrendDirection.INCREASING && elevated) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("trend_direction", trend.get().direction().getValue());
            metadata.put("cost_status", cost.costStatus().getValue());

            recommendations.add(Recommendation.builder()
                    .id(ids.next(RecommendationSource.RECOMMENDATION_ENGINE))
                    .type(RecommendationType.STRATEGIC)
                    .title("Strategic Review of Rising Egress Costs")
                    .description("Both egress traffic and costs are increasing significantly. "
                            + "A strategic review of your network architecture is recommended.")
                    .severity(Severity.HIGH)
                    .actions(List.of(
                            "Conduct comprehensive network architecture review",
                            "Implement cross-region traffic optimization",
                            "Consider dedicated ExpressRoute for consistent high-volume traffic",
                            "Evaluate global content delivery networks",
                            "Implement strict egress monitoring and budget controls"
                    ))
                    .confidence(0.9)
                    .source(RecommendationSource.RECOMMENDATION_ENGINE)
                    .metadata(metadata)
                    .build());
        }

        if (anomalies.isPresent()
                && anomalies.get().summary().totalAnomalies() > SECURITY_COST_ANOMALY_COUNT
                && elevated) {
            int anomalyCount = anomalies.get().summary().totalAnomalies();
            int highCount = anomalies.get().summary().severityCounts()
                    .getOrDefault(Severity.HIGH.getValue(), 0);
            boolean anyHigh = highCount > 0;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("anomaly_count", anomalyCount);
            metadata.put("high_severity_anomalies", highCount);
            metadata.put("cost_status", cost.costStatus().getValue());

            recommendations.add(Recommendation.builder()
                    .id(ids.next(RecommendationSource.RECOMMENDATION_ENGINE))
                    .type(RecommendationType.SECURITY_COST)
                    .title("Security and Cost Alert: Unusual Egress Patterns")
                    .description("Detected " + anomalyCount + " anomalies (" + highCount + " high severity) "
                            + "along with elevated costs. This might indicate security issues with cost implications.")
                    .severity(anyHigh ? Severity.HIGH : Severity.MEDIUM)
                    .actions(List.of(
                            "Implement egress security monitoring and filtering",
                            "Review resource access controls",
                            "Conduct security audit of high-egress resources",
                            "Set up alerts for sudden egress spikes",
                            "Consider network security groups with egress rules"
                    ))
                    .confidence(anyHigh ? 0.85 : 0.7)
                    .source(RecommendationSource.RECOMMENDATION_ENGINE)
                    .metadata(metadata)
                    .build());
        }

        boolean hasPattern = weekly.map(WeeklyPattern::hasPattern).orElse(false)
                || hourly.map(HourlyPattern::hasPattern).orElse(false);
        if (hasPattern && cost.totalCost() > costSettings.warningThreshold() * ARCHITECTURE_COST_RATIO) {
            recommendations.add(Recommendation.builder()
                    .id(ids.next(RecommendationSource.RECOMMENDATION_ENGINE))
                    .type(RecommendationType.ARCHITECTURE)
                    .title("Implement CDN and Caching for Pattern Optimization")
                    .description("Your egress shows distinct usage patterns and significant costs. "
                            + "Implementing CDN and caching can optimize these patterns and reduce costs.")
                    .severity(Severity.MEDIUM)
                    .actions(List.of(
                            "Implement Azure CDN for static content delivery",
                            "Configure caching with appropriate time-to-live based on patterns",
                            "Set up Front Door for global load balancing",
                            "Apply compression for all compressible responses",
                            "Consider read-replicas for database access optimization"
                    ))
                    .confidence(0.8)
                    .potentialSavings(cost.totalCost() * 0.3)
                    .source(RecommendationSource.RECOMMENDATION_ENGINE)
                    .build());
        }

        return recommendations;
    }

    private Recommendation normalize(AnalyzerRecommendation rec, RecommendationSource source,
                                     double confidence, IdSequence ids) {
        return Recommendation.builder()
                .id(ids.next(source))
                .type(rec.type())
                .title(rec.title())
                .description(rec.description() != null ? rec.description() : "")
                .severity(rec.severity() != null ? rec.severity() : Severity.MEDIUM)
                .actions(rec.actions())
                .resourceId(rec.resourceId())
                .resourceName(rec.resourceId() != null ? ResourceIds.name(rec.resourceId()) : null)
                .potentialSavings(rec.potentialSavings())
                .confidence(confidence)
                .source(source)
                .build();
    }

    /**
     * One recommendation per title. A higher severity wins, then a higher confidence;
     * on a full tie the first one seen is kept, in its original position.
     */
    static List<Recommendation> deduplicate(List<Recommendation> recommendations) {
        Map<String, Recommendation> byTitle = new LinkedHashMap<>();
        for (Recommendation candidate : recommendations) {
            byTitle.merge(candidate.title(), candidate, (kept, next) -> {
                if (next.severityWeight() > kept.severityWeight()) {
                    return next;
                }
                if (next.severityWeight() == kept.severityWeight() && next.confidence() > kept.confidence()) {
                    return next;
                }
                return kept;
            });
        }
        return new ArrayList<>(byTitle.values());
    }

    /**
     * Rank by severity then confidence, keep at most {@code maxPerCategory} of each type,
     * re-rank and truncate to {@code maxRecommendations}.
     */
    List<Recommendation> prioritize(List<Recommendation> recommendations) {
        if (recommendations.isEmpty()) {
            return List.of();
        }

        List<Recommendation> sorted = new ArrayList<>(recommendations);
        sorted.sort(PRIORITY);

        Map<RecommendationType, List<Recommendation>> byCategory = new LinkedHashMap<>();
        for (Recommendation rec : sorted) {
            byCategory.computeIfAbsent(rec.type(), t -> new ArrayList<>()).add(rec);
        }

        List<Recommendation> selected = new ArrayList<>();
        for (List<Recommendation> category : byCategory.values()) {
            selected.addAll(category.subList(0, Math.min(settings.maxPerCategory(), category.size())));
        }
        selected.sort(PRIORITY);

        return List.copyOf(selected.subList(0, Math.min(settings.maxRecommendations(), selected.size())));
    }

    /**
     * Mints {@code {prefix}_{index}_{timestamp}} ids with one running index per report.
     */
    private static final class IdSequence {
        private final String timestamp;
        private int index;

        IdSequence(String timestamp) {
            this.timestamp = timestamp;
        }

        String next(RecommendationSource source) {
            return source.getIdPrefix() + "_" + index++ + "_" + timestamp;
        }
    }
}
