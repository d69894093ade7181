package com.egressoptimizer.trend;

import java.util.List;
import java.util.Map;

/**
 * Hour-of-day seasonality (UTC). Business hours are 09:00-17:00.
 */
public record HourlyPattern(
        boolean hasPattern,
        List<Integer> peakHours,
        List<Integer> lowHours,
        Double businessHoursAvg,
        Double afterHoursAvg,
        double businessHoursPercentDiff,
        Map<String, PeriodStats> hourlyStats
) {}
