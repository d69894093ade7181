package com.egressoptimizer.cost;

/**
 * Immutable cost analysis settings.
 *
 * @param warningThreshold  spend above which the status is warning
 * @param criticalThreshold spend above which the status is critical
 * @param currency          currency label attached to every amount
 * @param pricing           region pricing table
 */
public record CostSettings(
        double warningThreshold,
        double criticalThreshold,
        String currency,
        RegionPricing pricing
) {

    public CostSettings {
        if (warningThreshold < 0 || criticalThreshold < warningThreshold) {
            throw new IllegalArgumentException(
                    "Cost thresholds must satisfy 0 <= warning <= critical: " + warningThreshold + ", " + criticalThreshold);
        }
        currency = currency != null ? currency : "USD";
        pricing = pricing != null ? pricing : RegionPricing.defaults();
    }

    public static CostSettings defaults() {
        return new CostSettings(100.0, 500.0, "USD", RegionPricing.defaults());
    }
}
