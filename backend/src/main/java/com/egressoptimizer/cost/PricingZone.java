package com.egressoptimizer.cost;

import java.util.List;

/**
 * Named group of regions sharing one tiered price list.
 */
public record PricingZone(String name, List<PricingTier> tiers) {

    public PricingZone {
        tiers = tiers != null ? List.copyOf(tiers) : List.of();
    }

    /**
     * Walk the brackets in order, charging each one for the volume that falls inside it.
     */
    public double cost(double gb) {
        if (gb <= 0) {
            return 0;
        }
        double remaining = gb;
        double previousLimit = 0;
        double total = 0;
        for (PricingTier tier : tiers) {
            double tierGb = Math.min(remaining, tier.limitGb() - previousLimit);
            total += tierGb * tier.pricePerGb();
            remaining -= tierGb;
            previousLimit = tier.limitGb();
            if (remaining <= 0) {
                break;
            }
        }
        return total;
    }
}
