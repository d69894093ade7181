package com.egressoptimizer.cost;

/**
 * Egress volume and cost of one resource.
 */
public record ResourceCost(
        String resourceId,
        String resourceName,
        String resourceType,
        String region,
        double egressGb,
        double cost,
        double percentageOfTotal
) {}
