package com.egressoptimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed binding for the egress.analysis configuration tree.
 * Converted once into the immutable settings records in {@link AnalysisConfig}.
 */
@ConfigurationProperties(prefix = "egress.analysis")
@Data
public class EgressAnalysisProperties {

    private Trend trend = new Trend();
    private Anomaly anomaly = new Anomaly();
    private Cost cost = new Cost();
    private Recommendations recommendations = new Recommendations();

    @Data
    public static class Trend {
        private int minDataPoints = 3;
    }

    @Data
    public static class Anomaly {
        private double zscoreThreshold = 3.0;
        private int minDataPoints = 5;
        private double madThreshold = 3.5;
        private int movingAvgWindow = 5;
        private double peakDetectionThreshold = 3.0;
    }

    @Data
    public static class Cost {
        private double thresholdWarning = 100.0;
        private double thresholdCritical = 500.0;
        private String currency = "USD";

        /** Zone id -> zone; empty means the built-in Azure price list */
        private Map<String, Zone> zones = new LinkedHashMap<>();

        /** Region code -> zone id; empty means the built-in region map */
        private Map<String, String> regionMap = new LinkedHashMap<>();
    }

    @Data
    public static class Zone {
        private String name;
        private List<Tier> tiers = new ArrayList<>();
    }

    @Data
    public static class Tier {
        /** Cumulative upper bound in GB; omit for the final, unbounded tier */
        private Double limitGb;
        private double price;
    }

    @Data
    public static class Recommendations {
        private int maxRecommendations = 15;
        private int maxPerCategory = 5;
    }
}
