package com.egressoptimizer.config;

import com.egressoptimizer.anomaly.AnomalySettings;
import com.egressoptimizer.cost.CostSettings;
import com.egressoptimizer.cost.PricingTier;
import com.egressoptimizer.cost.PricingZone;
import com.egressoptimizer.cost.RegionPricing;
import com.egressoptimizer.recommendation.RecommendationSettings;
import com.egressoptimizer.trend.TrendSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires analyzer settings from configuration.
 */
@Configuration
@EnableConfigurationProperties(EgressAnalysisProperties.class)
@Slf4j
public class AnalysisConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TrendSettings trendSettings(EgressAnalysisProperties properties) {
        return new TrendSettings(properties.getTrend().getMinDataPoints());
    }

    @Bean
    public AnomalySettings anomalySettings(EgressAnalysisProperties properties) {
        EgressAnalysisProperties.Anomaly anomaly = properties.getAnomaly();
        return new AnomalySettings(
                anomaly.getZscoreThreshold(),
                anomaly.getMinDataPoints(),
                anomaly.getMadThreshold(),
                anomaly.getMovingAvgWindow(),
                anomaly.getPeakDetectionThreshold()
        );
    }

    @Bean
    public CostSettings costSettings(EgressAnalysisProperties properties) {
        EgressAnalysisProperties.Cost cost = properties.getCost();
        return new CostSettings(
                cost.getThresholdWarning(),
                cost.getThresholdCritical(),
                cost.getCurrency(),
                regionPricing(cost)
        );
    }

    @Bean
    public RecommendationSettings recommendationSettings(EgressAnalysisProperties properties) {
        return new RecommendationSettings(
                properties.getRecommendations().getMaxRecommendations(),
                properties.getRecommendations().getMaxPerCategory()
        );
    }

    /**
     * Custom zones replace the built-in price list; a custom region map without
     * custom zones is applied over the built-in zones.
     *
     * @throws com.egressoptimizer.cost.PricingConfigurationException if the result is inconsistent
     */
    static RegionPricing regionPricing(EgressAnalysisProperties.Cost cost) {
        if (cost.getZones().isEmpty() && cost.getRegionMap().isEmpty()) {
            return RegionPricing.defaults();
        }

        Map<String, PricingZone> zones;
        if (cost.getZones().isEmpty()) {
            zones = RegionPricing.defaults().getZones();
        } else {
            zones = new LinkedHashMap<>();
            cost.getZones().forEach((id, zone) -> {
                List<PricingTier> tiers = zone.getTiers().stream()
                        .map(tier -> tier.getLimitGb() != null
                                ? new PricingTier(tier.getLimitGb(), tier.getPrice())
                                : PricingTier.unbounded(tier.getPrice()))
                        .toList();
                zones.put(id, new PricingZone(zone.getName() != null ? zone.getName() : id, tiers));
            });
        }

        Map<String, String> regionMap;
        if (!cost.getRegionMap().isEmpty()) {
            regionMap = cost.getRegionMap();
        } else if (cost.getZones().isEmpty()) {
            regionMap = RegionPricing.defaultRegionMap();
        } else {
            // Custom zones without a region map: everything prices at the default zone
            regionMap = Map.of();
        }

        log.info("Using custom egress pricing: {} zones, {} mapped regions", zones.size(), regionMap.size());
        return new RegionPricing(zones, regionMap);
    }
}
