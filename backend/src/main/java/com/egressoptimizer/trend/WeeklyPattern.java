package com.egressoptimizer.trend;

import java.util.List;
import java.util.Map;

/**
 * Day-of-week seasonality. Weekend and weekday averages are null when the
 * dataset has no rows on those days.
 */
public record WeeklyPattern(
        boolean hasPattern,
        List<String> peakDays,
        List<String> lowDays,
        Double weekendAvg,
        Double weekdayAvg,
        double weekendWeekdayPercentDiff,
        Map<String, PeriodStats> dailyStats
) {}
