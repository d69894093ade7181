package com.egressoptimizer.cost;

/**
 * Observed totals linearly scaled to a 30-day month.
 */
public record MonthlyProjection(double egressGb, double cost) {}
