package com.egressoptimizer.api;

import com.egressoptimizer.analysis.AnalysisOutcome;
import com.egressoptimizer.anomaly.AnomalyDetectionResult;
import com.egressoptimizer.anomaly.AnomalyDetector;
import com.egressoptimizer.cost.CostAnalysis;
import com.egressoptimizer.cost.CostAnalyzer;
import com.egressoptimizer.cost.CostProjection;
import com.egressoptimizer.cost.CostSettings;
import com.egressoptimizer.domain.model.MetricSample;
import com.egressoptimizer.ingestion.MetricCollection;
import com.egressoptimizer.recommendation.RecommendationEngine;
import com.egressoptimizer.recommendation.RecommendationReport;
import com.egressoptimizer.trend.GroupingField;
import com.egressoptimizer.trend.HourlyPattern;
import com.egressoptimizer.trend.TrendAnalyzer;
import com.egressoptimizer.trend.TrendResult;
import com.egressoptimizer.trend.WeeklyPattern;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST surface over the egress analyzers.
 *
 * REQUEST FORMAT:
 * Every POST endpoint accepts either tabular {@code rows} (one per measurement)
 * or a {@code collection} document as produced by the metrics collector.
 * Analyzer outcomes are returned as-is, including no_data / insufficient_data
 * statuses; only malformed input yields HTTP 400.
 */
@RestController
@RequestMapping("/api/egress")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Egress Analysis API", description = "Trend, anomaly, cost and recommendation analysis of egress metrics")
public class EgressAnalysisController {

    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final CostAnalyzer costAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final CostSettings costSettings;
    private final AnalysisRequestMapper requestMapper;

    @PostMapping("/trends")
    @Operation(summary = "Analyze overall egress trend",
               description = "Fits a linear trend to egress volume aggregated per timestamp")
    public ResponseEntity<AnalysisOutcome<TrendResult>> analyzeTrend(
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        List<MetricSample> samples = requestMapper.toSamples(request);
        log.info("Trend analysis request: {} samples", samples.size());
        return ResponseEntity.ok(trendAnalyzer.analyzeOverallTrend(samples));
    }

    @PostMapping("/trends/weekly")
    @Operation(summary = "Detect day-of-week patterns")
    public ResponseEntity<AnalysisOutcome<WeeklyPattern>> detectWeeklyPatterns(
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        return ResponseEntity.ok(trendAnalyzer.detectWeeklyPatterns(requestMapper.toSamples(request)));
    }

    @PostMapping("/trends/hourly")
    @Operation(summary = "Detect hour-of-day patterns")
    public ResponseEntity<AnalysisOutcome<HourlyPattern>> detectHourlyPatterns(
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        return ResponseEntity.ok(trendAnalyzer.detectHourlyPatterns(requestMapper.toSamples(request)));
    }

    @PostMapping("/trends/by-group")
    @Operation(summary = "Analyze egress trends per group",
               description = "Runs the trend regression per value of resource_id, resource_name, "
                       + "resource_type, location or metric_name")
    public ResponseEntity<Map<String, TrendResult>> analyzeTrendsByGroup(
            @RequestParam String field,
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        GroupingField groupingField = GroupingField.fromValue(field);
        return ResponseEntity.ok(trendAnalyzer.analyzeTrendsByGroup(requestMapper.toSamples(request), groupingField));
    }

    @PostMapping("/anomalies")
    @Operation(summary = "Detect egress anomalies",
               description = "Z-score, MAD and moving-average detection, deduplicated and ranked")
    public ResponseEntity<AnalysisOutcome<AnomalyDetectionResult>> detectAnomalies(
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        List<MetricSample> samples = requestMapper.toSamples(request);
        log.info("Anomaly detection request: {} samples", samples.size());
        return ResponseEntity.ok(anomalyDetector.detectAnomalies(samples));
    }

    @PostMapping("/costs")
    @Operation(summary = "Analyze egress costs",
               description = "Tiered cost per resource and region with a 30-day projection")
    public ResponseEntity<AnalysisOutcome<CostAnalysis>> analyzeCosts(
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        List<MetricSample> samples = requestMapper.toSamples(request);
        log.info("Cost analysis request: {} samples", samples.size());
        return ResponseEntity.ok(costAnalyzer.analyzeCosts(samples));
    }

    @PostMapping("/costs/projection")
    @Operation(summary = "Project egress costs",
               description = "Monthly cost forecast compounded by a monthly trend percentage")
    public ResponseEntity<AnalysisOutcome<CostProjection>> projectCosts(
            @RequestParam(defaultValue = "12") int months,
            @RequestParam(defaultValue = "0") double trendFactor,
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        AnalysisOutcome<CostAnalysis> analysis = costAnalyzer.analyzeCosts(requestMapper.toSamples(request));
        return ResponseEntity.ok(costAnalyzer.projectCosts(analysis, months, trendFactor));
    }

    @GetMapping("/costs/estimate")
    @Operation(summary = "Estimate the cost of an egress volume",
               description = "Prices a volume in GB through the tiered price list of the region's zone")
    public ResponseEntity<CostEstimateResponse> estimateCost(
            @RequestParam double gb,
            @RequestParam(required = false) String region
    ) {
        return ResponseEntity.ok(new CostEstimateResponse(
                gb,
                region,
                costSettings.pricing().zoneFor(region),
                costAnalyzer.calculateEgressCost(gb, region),
                costSettings.currency()
        ));
    }

    @PostMapping("/recommendations")
    @Operation(summary = "Generate egress recommendations",
               description = "Runs all analyzers and returns a ranked, deduplicated recommendation report")
    public ResponseEntity<RecommendationReport> generateRecommendations(
            @Valid @RequestBody EgressAnalysisRequest request
    ) {
        List<MetricSample> samples = requestMapper.toSamples(request);
        log.info("Recommendation request: {} samples", samples.size());
        return ResponseEntity.ok(recommendationEngine.generateRecommendations(samples));
    }

    // DTOs

    /**
     * Either {@code rows} or {@code collection}; a collection takes precedence.
     */
    public record EgressAnalysisRequest(
            List<@NotNull @Valid MetricRow> rows,
            MetricCollection collection
    ) {}

    /**
     * One measurement in tabular form. The timestamp is parsed best-effort.
     */
    public record MetricRow(
            String resourceId,
            String resourceName,
            String resourceType,
            String resourceGroup,
            String location,
            String metricName,
            String displayName,
            String unit,
            String timestamp,
            Double value
    ) {}

    public record CostEstimateResponse(
            double egressGb,
            String region,
            String pricingZone,
            double cost,
            String currency
    ) {}
}
