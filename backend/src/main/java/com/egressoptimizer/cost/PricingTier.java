package com.egressoptimizer.cost;

/**
 * One bracket of a tiered price list.
 *
 * @param limitGb    cumulative upper bound of the bracket in GB; infinite for the last bracket
 * @param pricePerGb price charged for every GB inside the bracket
 */
public record PricingTier(double limitGb, double pricePerGb) {

    public static PricingTier unbounded(double pricePerGb) {
        return new PricingTier(Double.POSITIVE_INFINITY, pricePerGb);
    }

    public boolean isUnbounded() {
        return Double.isInfinite(limitGb);
    }
}
