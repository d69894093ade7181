package com.egressoptimizer.recommendation;

import com.egressoptimizer.analysis.AnalysisOutcome;
import com.egressoptimizer.anomaly.AnomalyDetectionResult;
import com.egressoptimizer.anomaly.AnomalyDetector;
import com.egressoptimizer.anomaly.AnomalySummary;
import com.egressoptimizer.cost.CostAnalysis;
import com.egressoptimizer.cost.CostAnalyzer;
import com.egressoptimizer.cost.CostSettings;
import com.egressoptimizer.domain.model.*;
import com.egressoptimizer.testing.Samples;
import com.egressoptimizer.trend.HourlyPattern;
import com.egressoptimizer.trend.TrendAnalyzer;
import com.egressoptimizer.trend.TrendResult;
import com.egressoptimizer.trend.WeeklyPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RecommendationEngine.
 *
 * Test strategy:
 * 1. Normalization of analyzer recommendations (ids, confidence, resource names)
 * 2. Combined rules over trend, cost, anomaly and pattern signals
 * 3. Deduplication, per-category and overall caps, ordering
 * 4. Edge cases (no data, nothing to recommend, failed analyzers)
 */
@ExtendWith(MockitoExtension.class)
class RecommendationEngineTest {

    @Mock
    private TrendAnalyzer trendAnalyzer;

    @Mock
    private CostAnalyzer costAnalyzer;

    @Mock
    private AnomalyDetector anomalyDetector;

    private RecommendationEngine recommendationEngine;

    private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");
    private static final List<MetricSample> SAMPLES = Samples.daily(10, 20, 30);

    @BeforeEach
    void setUp() {
        recommendationEngine = new RecommendationEngine(
                trendAnalyzer,
                costAnalyzer,
                anomalyDetector,
                RecommendationSettings.defaults(),
                CostSettings.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Nested
    @DisplayName("Normalization Tests")
    class NormalizationTests {

        @Test
        @DisplayName("Should mint ids from source prefix, running index and UTC timestamp")
        void shouldMintIds() {
            // Given
            stubNoPatterns();
            var costs = costAnalysis(CostStatus.NORMAL, 10);
            when(costAnalyzer.generateCostRecommendations(costs)).thenReturn(List.of(
                    analyzerRecommendation(RecommendationType.RESOURCE_SPECIFIC, Severity.MEDIUM, "High VM Egress: vm1")
                            .resourceId(Samples.VM_ID)
                            .potentialSavings(4.0)
                            .build()
            ));

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.failed("no trend"), costs, AnalysisOutcome.noData());

            // Then
            assertThat(report.status()).isEqualTo(AnalysisStatus.SUCCESS);
            assertThat(report.timestamp()).isEqualTo(NOW);
            assertThat(report.recommendations()).hasSize(1);

            Recommendation rec = report.recommendations().get(0);
            assertThat(rec.id()).isEqualTo("cost_0_20240115103000");
            assertThat(rec.source()).isEqualTo(RecommendationSource.COST_ANALYZER);
            assertThat(rec.confidence()).isEqualTo(0.9);
            assertThat(rec.resourceName()).isEqualTo("vm1");
            assertThat(rec.potentialSavings()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Should assign anomaly confidence by severity")
        void shouldAssignAnomalyConfidence() {
            // Given
            stubNoPatterns();
            AnalysisOutcome<AnomalyDetectionResult> anomalies = anomalyResult(1, 1);
            when(anomalyDetector.generateAnomalyRecommendations(anomalies)).thenReturn(List.of(
                    analyzerRecommendation(RecommendationType.SECURITY, Severity.HIGH, "Critical").build(),
                    analyzerRecommendation(RecommendationType.SECURITY, Severity.MEDIUM, "Mild").build()
            ));

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), AnalysisOutcome.noData(), anomalies);

            // Then
            assertThat(report.recommendations()).extracting("confidence").containsExactly(0.85, 0.7);
            assertThat(report.recommendations()).extracting("source")
                    .containsOnly(RecommendationSource.ANOMALY_DETECTOR);
            assertThat(report.sources()).isEqualTo(new RecommendationReport.Sources(false, false, true));
        }
    }

    @Nested
    @DisplayName("Combined Rule Tests")
    class CombinedRuleTests {

        @Test
        @DisplayName("Should add a strategic review for rising traffic with elevated costs")
        void shouldAddStrategicReview() {
            // Given
            stubNoPatterns();
            var trend = AnalysisOutcome.success(trend(TrendDirection.INCREASING, TrendStrength.STRONG, 25));

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, trend, costAnalysis(CostStatus.WARNING, 150), AnalysisOutcome.noData());

            // Then
            assertThat(report.recommendations()).extracting("title").containsExactly(
                    "Strategic Review of Rising Egress Costs",
                    "Rising Egress Traffic Trend Detected"
            );
            Recommendation strategic = report.recommendations().get(0);
            assertThat(strategic.type()).isEqualTo(RecommendationType.STRATEGIC);
            assertThat(strategic.severity()).isEqualTo(Severity.HIGH);
            assertThat(strategic.confidence()).isEqualTo(0.9);
            assertThat(strategic.id()).startsWith("combined_");

            Recommendation rising = report.recommendations().get(1);
            assertThat(rising.severity()).isEqualTo(Severity.HIGH);
            assertThat(rising.confidence()).isEqualTo(0.85);
            assertThat(rising.metadata()).containsEntry("normalized_slope", 25.0);
        }

        @Test
        @DisplayName("Should rate a mild rising trend as medium")
        void shouldRateMildTrendAsMedium() {
            stubNoPatterns();
            var trend = AnalysisOutcome.success(trend(TrendDirection.INCREASING, TrendStrength.MODERATE, 8));

            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, trend, AnalysisOutcome.noData(), AnalysisOutcome.noData());

            assertThat(report.recommendations()).hasSize(1);
            assertThat(report.recommendations().get(0).severity()).isEqualTo(Severity.MEDIUM);
            assertThat(report.recommendations().get(0).confidence()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("Should raise a security and cost alert for many anomalies with elevated costs")
        void shouldRaiseSecurityCostAlert() {
            // Given
            stubNoPatterns();

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), costAnalysis(CostStatus.CRITICAL, 600), anomalyResult(4, 1));

            // Then
            var alert = report.recommendations().stream()
                    .filter(r -> r.type() == RecommendationType.SECURITY_COST)
                    .findFirst().orElseThrow();
            assertThat(alert.title()).isEqualTo("Security and Cost Alert: Unusual Egress Patterns");
            assertThat(alert.severity()).isEqualTo(Severity.HIGH);
            assertThat(alert.confidence()).isEqualTo(0.85);
            assertThat(alert.metadata()).containsEntry("anomaly_count", 4);
        }

        @Test
        @DisplayName("Should not raise a security and cost alert for three anomalies")
        void shouldNotRaiseAlertAtThreshold() {
            stubNoPatterns();

            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), costAnalysis(CostStatus.CRITICAL, 600), anomalyResult(3, 0));

            assertThat(report.recommendations()).extracting("type")
                    .doesNotContain(RecommendationType.SECURITY_COST);
        }

        @Test
        @DisplayName("Should recommend CDN and caching for patterned traffic with significant cost even without a trend")
        void shouldRecommendArchitectureWithoutTrend() {
            // Given: weekly pattern, cost 60 above half the warning threshold, trend failed
            when(trendAnalyzer.detectWeeklyPatterns(SAMPLES)).thenReturn(AnalysisOutcome.success(
                    new WeeklyPattern(true, List.of("Saturday", "Sunday"), List.of("Monday"),
                            300.0, 100.0, 200.0, Map.of())));
            when(trendAnalyzer.detectHourlyPatterns(SAMPLES)).thenReturn(AnalysisOutcome.insufficientData(
                    "Insufficient hourly data", 3, 1));

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.failed("boom"), costAnalysis(CostStatus.NORMAL, 60), AnalysisOutcome.noData());

            // Then
            assertThat(report.recommendations()).extracting("title").containsExactly(
                    "Implement CDN and Caching for Pattern Optimization",
                    "Weekly Egress Pattern Detected"
            );
            Recommendation architecture = report.recommendations().get(0);
            assertThat(architecture.potentialSavings()).isCloseTo(18.0, within(1e-9));
            assertThat(architecture.confidence()).isEqualTo(0.8);
            assertThat(report.recommendations().get(1).description()).contains("Saturday, Sunday");
            assertThat(report.categories()).containsEntry("architecture", 1).containsEntry("pattern", 1);
        }

        @Test
        @DisplayName("Should format peak hours in the daily pattern recommendation")
        void shouldDescribeHourlyPattern() {
            when(trendAnalyzer.detectWeeklyPatterns(SAMPLES)).thenReturn(AnalysisOutcome.insufficientData(
                    "Insufficient daily data", 3, 1));
            when(trendAnalyzer.detectHourlyPatterns(SAMPLES)).thenReturn(AnalysisOutcome.success(
                    new HourlyPattern(true, List.of(9, 14), List.of(3), 200.0, 50.0, 300.0, Map.of())));

            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), AnalysisOutcome.noData(), AnalysisOutcome.noData());

            assertThat(report.recommendations()).hasSize(1);
            assertThat(report.recommendations().get(0).title()).isEqualTo("Daily Egress Pattern Detected");
            assertThat(report.recommendations().get(0).description()).contains("9:00, 14:00");
            assertThat(report.recommendations().get(0).severity()).isEqualTo(Severity.LOW);
        }
    }

    @Nested
    @DisplayName("Ranking Tests")
    class RankingTests {

        @Test
        @DisplayName("Should keep at most five recommendations per category")
        void shouldCapPerCategory() {
            // Given
            stubNoPatterns();
            var costs = costAnalysis(CostStatus.NORMAL, 10);
            List<AnalyzerRecommendation> many = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                many.add(analyzerRecommendation(RecommendationType.COST, Severity.MEDIUM, "Cost " + i).build());
            }
            when(costAnalyzer.generateCostRecommendations(costs)).thenReturn(many);

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), costs, AnalysisOutcome.noData());

            // Then
            assertThat(report.count()).isEqualTo(5);
            assertThat(report.categories()).containsExactly(Map.entry("cost", 5));
            assertThat(report.recommendations()).extracting("title")
                    .containsExactly("Cost 0", "Cost 1", "Cost 2", "Cost 3", "Cost 4");
        }

        @Test
        @DisplayName("Should cap the overall list at fifteen")
        void shouldCapOverall() {
            // Given
            stubNoPatterns();
            var costs = costAnalysis(CostStatus.NORMAL, 10);
            List<AnalyzerRecommendation> many = new ArrayList<>();
            for (RecommendationType type : List.of(RecommendationType.COST, RecommendationType.REGION,
                    RecommendationType.RESOURCE_SPECIFIC, RecommendationType.GENERAL)) {
                for (int i = 0; i < 5; i++) {
                    many.add(analyzerRecommendation(type, Severity.LOW, type.getValue() + " " + i).build());
                }
            }
            when(costAnalyzer.generateCostRecommendations(costs)).thenReturn(many);

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), costs, AnalysisOutcome.noData());

            // Then
            assertThat(report.count()).isEqualTo(15);
            assertThat(report.recommendations()).hasSize(15);
        }

        @Test
        @DisplayName("Should rank by severity, then confidence")
        void shouldRankBySeverityThenConfidence() {
            // Given
            stubNoPatterns();
            var costs = costAnalysis(CostStatus.NORMAL, 10);
            var anomalies = anomalyResult(1, 0);
            when(costAnalyzer.generateCostRecommendations(costs)).thenReturn(List.of(
                    analyzerRecommendation(RecommendationType.GENERAL, Severity.LOW, "Low cost").build(),
                    analyzerRecommendation(RecommendationType.COST, Severity.HIGH, "High cost").build(),
                    analyzerRecommendation(RecommendationType.REGION, Severity.MEDIUM, "Medium cost").build()
            ));
            when(anomalyDetector.generateAnomalyRecommendations(anomalies)).thenReturn(List.of(
                    analyzerRecommendation(RecommendationType.SECURITY, Severity.MEDIUM, "Medium anomaly").build()
            ));

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), costs, anomalies);

            // Then
            assertThat(report.recommendations()).extracting("title")
                    .containsExactly("High cost", "Medium cost", "Medium anomaly", "Low cost");
        }

        @Test
        @DisplayName("Should keep the most severe recommendation per title")
        void shouldDeduplicateAcrossAnalyzers() {
            // Given
            stubNoPatterns();
            var costs = costAnalysis(CostStatus.NORMAL, 10);
            var anomalies = anomalyResult(1, 1);
            when(costAnalyzer.generateCostRecommendations(costs)).thenReturn(List.of(
                    analyzerRecommendation(RecommendationType.COST, Severity.MEDIUM, "Same").build()));
            when(anomalyDetector.generateAnomalyRecommendations(anomalies)).thenReturn(List.of(
                    analyzerRecommendation(RecommendationType.SECURITY, Severity.HIGH, "Same").build()));

            // When
            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), costs, anomalies);

            // Then
            assertThat(report.recommendations()).hasSize(1);
            assertThat(report.recommendations().get(0).source()).isEqualTo(RecommendationSource.ANOMALY_DETECTOR);
        }

        @Test
        @DisplayName("Should prefer higher confidence on equal severity and the first on a full tie")
        void shouldBreakDeduplicationTies() {
            var first = recommendation("a", Severity.MEDIUM, 0.7);
            var confident = recommendation("b", Severity.MEDIUM, 0.9);
            var tie = recommendation("c", Severity.MEDIUM, 0.9);

            var unique = RecommendationEngine.deduplicate(List.of(first, confident, tie));

            assertThat(unique).containsExactly(confident);
        }
    }

    @Nested
    @DisplayName("Edge Case Tests")
    class EdgeCaseTests {

        @Test
        @DisplayName("Should return no_data without running any analyzer")
        void shouldReturnNoDataForEmptyInput() {
            var report = recommendationEngine.generateRecommendations(List.of());

            assertThat(report.status()).isEqualTo(AnalysisStatus.NO_DATA);
            assertThat(report.recommendations()).isEmpty();
            verifyNoInteractions(trendAnalyzer, costAnalyzer, anomalyDetector);
        }

        @Test
        @DisplayName("Should reject a missing analysis outcome with a named message")
        void shouldRejectNullOutcome() {
            assertThatThrownBy(() -> recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.noData(), null, AnalysisOutcome.noData()))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("cost outcome");
            verifyNoInteractions(trendAnalyzer, costAnalyzer, anomalyDetector);
        }

        @Test
        @DisplayName("Should report no_recommendations when no analyzer contributes")
        void shouldReportNoRecommendations() {
            stubNoPatterns();

            var report = recommendationEngine.generateRecommendations(
                    SAMPLES, AnalysisOutcome.failed("a"), AnalysisOutcome.failed("b"), AnalysisOutcome.failed("c"));

            assertThat(report.status()).isEqualTo(AnalysisStatus.NO_RECOMMENDATIONS);
            assertThat(report.count()).isZero();
            assertThat(report.categories()).isEmpty();
            assertThat(report.sources()).isEqualTo(new RecommendationReport.Sources(false, false, false));
        }

        @Test
        @DisplayName("Should run each analyzer once over the full dataset")
        void shouldRunEveryAnalyzerOnce() {
            // Given
            stubNoPatterns();
            var trend = AnalysisOutcome.success(trend(TrendDirection.STABLE, TrendStrength.WEAK, 0.5));
            var costs = costAnalysis(CostStatus.NORMAL, 10);
            var anomalies = anomalyResult(0, 0);
            when(trendAnalyzer.analyzeOverallTrend(SAMPLES)).thenReturn(trend);
            when(costAnalyzer.analyzeCosts(SAMPLES)).thenReturn(costs);
            when(anomalyDetector.detectAnomalies(SAMPLES)).thenReturn(anomalies);
            when(costAnalyzer.generateCostRecommendations(costs)).thenReturn(List.of(
                    analyzerRecommendation(RecommendationType.GENERAL, Severity.LOW, "General Cost Optimization")
                            .build()));

            // When
            var report = recommendationEngine.generateRecommendations(SAMPLES);

            // Then
            assertThat(report.status()).isEqualTo(AnalysisStatus.SUCCESS);
            assertThat(report.sources()).isEqualTo(new RecommendationReport.Sources(true, true, true));
            verify(trendAnalyzer, times(1)).analyzeOverallTrend(SAMPLES);
            verify(trendAnalyzer, times(1)).detectWeeklyPatterns(SAMPLES);
            verify(trendAnalyzer, times(1)).detectHourlyPatterns(SAMPLES);
            verify(costAnalyzer, times(1)).analyzeCosts(SAMPLES);
            verify(anomalyDetector, times(1)).detectAnomalies(SAMPLES);
        }
    }

    // Helper methods

    private void stubNoPatterns() {
        when(trendAnalyzer.detectWeeklyPatterns(SAMPLES))
                .thenReturn(AnalysisOutcome.insufficientData("Insufficient daily data", 3, 1));
        when(trendAnalyzer.detectHourlyPatterns(SAMPLES))
                .thenReturn(AnalysisOutcome.insufficientData("Insufficient hourly data", 3, 1));
    }

    private static AnalyzerRecommendation.AnalyzerRecommendationBuilder analyzerRecommendation(
            RecommendationType type, Severity severity, String title) {
        return AnalyzerRecommendation.builder()
                .type(type)
                .severity(severity)
                .title(title)
                .description(title)
                .actions(List.of("Review " + title));
    }

    private static Recommendation recommendation(String id, Severity severity, double confidence) {
        return Recommendation.builder()
                .id(id)
                .type(RecommendationType.COST)
                .title("Duplicate")
                .description("")
                .severity(severity)
                .confidence(confidence)
                .source(RecommendationSource.COST_ANALYZER)
                .build();
    }

    private static AnalysisOutcome<CostAnalysis> costAnalysis(CostStatus status, double totalCost) {
        return AnalysisOutcome.success(new CostAnalysis(
                status, totalCost / 0.087, totalCost, "USD", 1.0, List.of(), Map.of(), null, null));
    }

    private static AnalysisOutcome<AnomalyDetectionResult> anomalyResult(int total, int high) {
        var summary = new AnomalySummary(total, total > 0 ? 1 : 0, List.of("zscore", "mad", "moving_average"),
                Map.of("zscore", total, "mad", 0, "moving_average", 0),
                Map.of("high", high, "medium", total - high, "low", 0));
        return AnalysisOutcome.success(new AnomalyDetectionResult(NOW, summary, List.of(), Map.of()));
    }

    private static TrendResult trend(TrendDirection direction, TrendStrength strength, double normalizedSlope) {
        return new TrendResult(direction, strength, 0.9, 5.0, 5.0, 10.0, normalizedSlope, 0.9,
                10, 30, 30, 50.0, null, 3);
    }
}
