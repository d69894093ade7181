package com.egressoptimizer.cost;

/**
 * Egress volume and cost of one region, priced on the region's combined volume.
 */
public record RegionCost(double egressGb, double cost, double percentageOfTotal) {}
