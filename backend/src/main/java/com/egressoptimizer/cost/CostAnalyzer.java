package com.egressoptimizer.cost;

import com.egressoptimizer.analysis.AnalysisOutcome;
import com.egressoptimizer.analysis.EgressMetrics;
import com.egressoptimizer.domain.model.AnalyzerRecommendation;
import com.egressoptimizer.domain.model.CostStatus;
import com.egressoptimizer.domain.model.MetricSample;
import com.egressoptimizer.domain.model.RecommendationType;
import com.egressoptimizer.domain.model.Severity;
import com.egressoptimizer.ingestion.ResourceIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Tiered egress cost estimation.
 *
 * COST FLOW:
 * 1. Keep egress metrics and convert byte totals to GB (1 GB = 1024^3 bytes)
 * 2. Price each resource and each region through the zone's progressive brackets
 * 3. Classify total spend against the warning and critical thresholds
 * 4. Scale the observed span to a 30-day month when the data spans time
 *
 * Resource costs are priced individually, so the total is the sum of resource
 * costs and not the cost of the combined volume.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostAnalyzer {

    private final CostSettings settings;

    private static final double BYTES_PER_GB = 1024.0 * 1024 * 1024;
    private static final double DAYS_PER_MONTH = 30.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private static final int TOP_RESOURCE_COUNT = 3;
    private static final double SIGNIFICANT_RESOURCE_PERCENT = 15.0;
    private static final double CROSS_REGION_SHARE = 0.2;
    private static final double CONSOLIDATION_PERCENT = 70.0;
    private static final double RISING_PROJECTION_RATIO = 1.3;

    private static final Comparator<ResourceKey> RESOURCE_ORDER = Comparator
            .comparing(ResourceKey::resourceId)
            .thenComparing(ResourceKey::resourceName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ResourceKey::resourceType, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ResourceKey::location);

    /**
     * Cost of transferring {@code gb} out of {@code region}.
     * Unmapped or null regions use the default zone; non-positive volumes cost nothing.
     */
    public double calculateEgressCost(double gb, String region) {
        return settings.pricing().cost(gb, region);
    }

    /**
     * Price the egress volume of the dataset per resource and per region.
     */
    public AnalysisOutcome<CostAnalysis> analyzeCosts(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return AnalysisOutcome.noData();
        }

        List<MetricSample> egress = EgressMetrics.filter(samples);
        if (egress.isEmpty()) {
            return AnalysisOutcome.noEgressData();
        }

        try {
            double totalBytes = 0;
            Map<ResourceKey, Double> bytesByResource = new TreeMap<>(RESOURCE_ORDER);
            Map<String, Double> bytesByRegion = new TreeMap<>();
            for (MetricSample sample : egress) {
                totalBytes += sample.value();
                ResourceKey key = new ResourceKey(sample.resourceId(), sample.resourceName(),
                        sample.resourceType(), sample.location());
                bytesByResource.merge(key, sample.value(), Double::sum);
                bytesByRegion.merge(sample.location(), sample.value(), Double::sum);
            }
            double totalGb = totalBytes / BYTES_PER_GB;

            Map<ResourceKey, double[]> resourceGbAndCost = new LinkedHashMap<>();
            double totalCost = 0;
            for (var entry : bytesByResource.entrySet()) {
                double gb = entry.getValue() / BYTES_PER_GB;
                double cost = calculateEgressCost(gb, entry.getKey().location());
                resourceGbAndCost.put(entry.getKey(), new double[]{gb, cost});
                totalCost += cost;
            }

            List<ResourceCost> resources = new ArrayList<>();
            for (var entry : resourceGbAndCost.entrySet()) {
                ResourceKey key = entry.getKey();
                double cost = entry.getValue()[1];
                resources.add(new ResourceCost(
                        key.resourceId(),
                        key.resourceName(),
                        key.resourceType(),
                        key.location(),
                        entry.getValue()[0],
                        cost,
                        shareOf(cost, totalCost)
                ));
            }

            Map<String, RegionCost> byRegion = new LinkedHashMap<>();
            for (var entry : bytesByRegion.entrySet()) {
                double gb = entry.getValue() / BYTES_PER_GB;
                double cost = calculateEgressCost(gb, entry.getKey());
                byRegion.put(entry.getKey(), new RegionCost(gb, cost, shareOf(cost, totalCost)));
            }

            double periodDays = timePeriodDays(egress);

            CostStatus status = CostStatus.classify(totalCost,
                    settings.warningThreshold(), settings.criticalThreshold());

            MonthlyProjection projection = null;
            CostStatus projectionWarning = null;
            if (periodDays > 0) {
                double monthlyFactor = DAYS_PER_MONTH / periodDays;
                projection = new MonthlyProjection(totalGb * monthlyFactor, totalCost * monthlyFactor);

                if (projection.cost() > settings.criticalThreshold() && status != CostStatus.CRITICAL) {
                    projectionWarning = CostStatus.CRITICAL;
                } else if (projection.cost() > settings.warningThreshold() && status == CostStatus.NORMAL) {
                    projectionWarning = CostStatus.WARNING;
                }
            }

            log.info("Cost analysis: {} GB egress, {} {} ({}) across {} resources in {} regions",
                    String.format("%.3f", totalGb), String.format("%.2f", totalCost), settings.currency(),
                    status.getValue(), resources.size(), byRegion.size());

            return AnalysisOutcome.success(new CostAnalysis(
                    status,
                    totalGb,
                    totalCost,
                    settings.currency(),
                    periodDays,
                    resources,
                    byRegion,
                    projection,
                    projectionWarning
            ));

        } catch (Exception e) {
            log.error("Error analyzing costs", e);
            return AnalysisOutcome.failed(e);
        }
    }

    /**
     * Derive cost saving recommendations from a cost analysis.
     * Returns nothing unless the analysis succeeded.
     */
    public List<AnalyzerRecommendation> generateCostRecommendations(AnalysisOutcome<CostAnalysis> outcome) {
        if (outcome == null || outcome.value().isEmpty()) {
            return List.of();
        }
        CostAnalysis analysis = outcome.value().get();
        double totalCost = analysis.totalCost();

        List<AnalyzerRecommendation> recommendations = new ArrayList<>();

        if (analysis.costStatus() == CostStatus.CRITICAL) {
            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.COST)
                    .severity(Severity.HIGH)
                    .title("Critical Egress Cost Alert")
                    .description("Your egress costs have exceeded the critical threshold. "
                            + "Review and optimize top consumers immediately.")
                    .potentialSavings(totalCost * 0.3)
                    .actions(List.of(
                            "Implement content delivery network (CDN) for static content",
                            "Review and adjust application egress patterns",
                            "Consider VNet peering for internal communication"
                    ))
                    .build());
        } else if (analysis.costStatus() == CostStatus.WARNING) {
            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.COST)
                    .severity(Severity.MEDIUM)
                    .title("High Egress Cost Warning")
                    .description("Your egress costs are approaching critical levels. Consider optimization measures.")
                    .potentialSavings(totalCost * 0.2)
                    .actions(List.of(
                            "Analyze top consumers and identify optimization opportunities",
                            "Implement caching where appropriate",
                            "Optimize data transfer patterns"
                    ))
                    .build());
        }

        List<ResourceCost> byCost = new ArrayList<>(analysis.resources());
        byCost.sort(Comparator.comparingDouble(ResourceCost::cost).reversed());
        for (ResourceCost resource : byCost.subList(0, Math.min(TOP_RESOURCE_COUNT, byCost.size()))) {
            if (resource.percentageOfTotal() < SIGNIFICANT_RESOURCE_PERCENT) {
                continue;
            }
            resourceRecommendation(resource).ifPresent(recommendations::add);
        }

        Map<String, RegionCost> regions = analysis.byRegion();
        if (regions.size() > 1) {
            List<Map.Entry<String, RegionCost>> ranked = new ArrayList<>(regions.entrySet());
            ranked.sort(Comparator.comparingDouble((Map.Entry<String, RegionCost> e) -> e.getValue().cost()).reversed());
            String topRegion = ranked.get(0).getKey();

            double secondShare = totalCost > 0 ? ranked.get(1).getValue().cost() / totalCost : 0;
            if (secondShare > CROSS_REGION_SHARE) {
                recommendations.add(AnalyzerRecommendation.builder()
                        .type(RecommendationType.REGION)
                        .severity(Severity.MEDIUM)
                        .title("Significant Cross-Region Traffic")
                        .description("You have substantial egress traffic spanning multiple regions "
                                + "which incurs higher costs.")
                        .potentialSavings(totalCost * 0.15)
                        .actions(List.of(
                                "Consolidate workloads to fewer regions where possible",
                                "Implement region-paired storage accounts",
                                "Use Azure CDN for cross-region content delivery",
                                "Consider Global VNet peering or ExpressRoute for consistent high-volume traffic"
                        ))
                        .build());
            }

            double topPercent = ranked.get(0).getValue().percentageOfTotal();
            if (!RegionPricing.UNKNOWN_REGION.equals(topRegion) && topPercent > CONSOLIDATION_PERCENT) {
                recommendations.add(AnalyzerRecommendation.builder()
                        .type(RecommendationType.REGION)
                        .severity(Severity.LOW)
                        .title("Consider Consolidation to " + topRegion)
                        .description(String.format(Locale.ROOT,
                                "%s accounts for %.1f%% of egress. Consider consolidating more workloads here.",
                                topRegion, topPercent))
                        .potentialSavings(totalCost * 0.08)
                        .actions(List.of(
                                "Move compatible workloads to " + topRegion,
                                "Implement regional data replication",
                                "Review application architecture for region-awareness"
                        ))
                        .build());
            }
        }

        MonthlyProjection projection = analysis.monthlyProjection();
        if (projection != null && projection.cost() > totalCost * RISING_PROJECTION_RATIO) {
            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.PROJECTION)
                    .severity(Severity.MEDIUM)
                    .title("Increasing Cost Trend Detected")
                    .description(String.format(Locale.ROOT,
                            "Monthly projected cost of %.2f %s is significantly higher than current spend.",
                            projection.cost(), analysis.currency()))
                    .potentialSavings(projection.cost() * 0.25)
                    .actions(List.of(
                            "Set up Azure Budgets for proactive alerts",
                            "Implement auto-scaling for predictable traffic patterns",
                            "Analyze recent traffic growth patterns",
                            "Consider reserved bandwidth options for ExpressRoute"
                    ))
                    .build());
        }

        if (recommendations.isEmpty()) {
            recommendations.add(AnalyzerRecommendation.builder()
                    .type(RecommendationType.GENERAL)
                    .severity(Severity.LOW)
                    .title("General Cost Optimization")
                    .description("Consider these general egress cost optimization strategies.")
                    .potentialSavings(totalCost * 0.1)
                    .actions(List.of(
                            "Use Azure CDN for static content delivery",
                            "Implement data compression for all transfers",
                            "Consider proximity placement groups for related resources",
                            "Review Azure Virtual Network design for traffic optimization"
                    ))
                    .build());
        }

        log.debug("Generated {} cost recommendations", recommendations.size());
        return recommendations;
    }

    /**
     * Forecast monthly costs, compounding {@code trendFactorPercent} every month.
     *
     * @throws IllegalArgumentException if {@code months} is negative
     */
    public AnalysisOutcome<CostProjection> projectCosts(AnalysisOutcome<CostAnalysis> outcome,
                                                        int months, double trendFactorPercent) {
        if (months < 0) {
            throw new IllegalArgumentException("Projection months must not be negative: " + months);
        }
        if (outcome == null || outcome.value().isEmpty()) {
            return AnalysisOutcome.failed("Invalid cost analysis data");
        }
        CostAnalysis analysis = outcome.value().get();

        double monthlyGb;
        double monthlyCost;
        if (analysis.monthlyProjection() != null) {
            monthlyGb = analysis.monthlyProjection().egressGb();
            monthlyCost = analysis.monthlyProjection().cost();
        } else {
            double period = analysis.timePeriodDays() > 0 ? analysis.timePeriodDays() : DAYS_PER_MONTH;
            double monthlyFactor = DAYS_PER_MONTH / period;
            monthlyGb = analysis.egressGb() * monthlyFactor;
            monthlyCost = analysis.totalCost() * monthlyFactor;
        }

        List<MonthProjection> projections = new ArrayList<>(months);
        double cumulative = 0;
        for (int month = 1; month <= months; month++) {
            double multiplier = Math.pow(1 + trendFactorPercent / 100, month - 1);
            double cost = monthlyCost * multiplier;
            cumulative += cost;
            projections.add(new MonthProjection(month, monthlyGb * multiplier, cost, cumulative));
        }

        return AnalysisOutcome.success(new CostProjection(
                monthlyCost,
                monthlyGb,
                trendFactorPercent,
                analysis.currency(),
                cumulative,
                projections
        ));
    }

    private Optional<AnalyzerRecommendation> resourceRecommendation(ResourceCost resource) {
        String type = resource.resourceType() != null ? resource.resourceType().toLowerCase(Locale.ROOT) : "";
        String share = String.format(Locale.ROOT, "%.1f%%", resource.percentageOfTotal());
        String name = resource.resourceName() != null && !resource.resourceName().isBlank()
                ? resource.resourceName()
                : ResourceIds.name(resource.resourceId());

        if (type.contains("virtualmachine")) {
            return Optional.of(AnalyzerRecommendation.builder()
                    .type(RecommendationType.RESOURCE_SPECIFIC)
                    .severity(Severity.MEDIUM)
                    .title("High VM Egress: " + name)
                    .description("This virtual machine accounts for " + share + " of your total egress costs.")
                    .potentialSavings(resource.cost() * 0.4)
                    .actions(List.of(
                            "Check for unnecessary file transfers or backups",
                            "Review application architecture for bandwidth efficiency",
                            "Consider compressed data formats",
                            "Implement regional replication to reduce cross-region traffic"
                    ))
                    .resourceId(resource.resourceId())
                    .build());
        } else if (type.contains("site")) {
            return Optional.of(AnalyzerRecommendation.builder()
                    .type(RecommendationType.RESOURCE_SPECIFIC)
                    .severity(Severity.MEDIUM)
                    .title("High App Service Egress: " + name)
                    .description("This App Service accounts for " + share + " of your total egress costs.")
                    .potentialSavings(resource.cost() * 0.5)
                    .actions(List.of(
                            "Implement Azure Front Door or CDN for static content",
                            "Enable compression for HTTP responses",
                            "Review API responses for unnecessary data",
                            "Consider using Azure Cache for frequently accessed data"
                    ))
                    .resourceId(resource.resourceId())
                    .build());
        }
        return Optional.empty();
    }

    private static double timePeriodDays(List<MetricSample> egress) {
        if (egress.size() <= 1) {
            return 0;
        }
        Instant min = egress.get(0).timestamp();
        Instant max = min;
        for (MetricSample sample : egress) {
            if (sample.timestamp().isBefore(min)) {
                min = sample.timestamp();
            }
            if (sample.timestamp().isAfter(max)) {
                max = sample.timestamp();
            }
        }
        return Duration.between(min, max).toMillis() / MILLIS_PER_DAY;
    }

    private static double shareOf(double cost, double total) {
        return total > 0 ? cost / total * 100 : 0;
    }

    private record ResourceKey(String resourceId, String resourceName, String resourceType, String location) {}
}
