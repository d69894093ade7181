package com.egressoptimizer.trend;

/**
 * Average egress of one day-of-week or hour-of-day bucket.
 */
public record PeriodStats(double averageValue, double percentOfOverallAvg) {}
