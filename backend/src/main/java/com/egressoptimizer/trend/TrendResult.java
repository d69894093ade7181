package com.egressoptimizer.trend;

import com.egressoptimizer.domain.model.TrendDirection;
import com.egressoptimizer.domain.model.TrendStrength;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Linear trend of aggregated egress over time.
 *
 * Percent-change fields are null when the series is too short to compute them
 * (day-over-day needs 2 points, week-over-week needs 7).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendResult(
        TrendDirection direction,
        TrendStrength strength,
        double confidence,
        Double avgChangePercent,
        Double latestChangePercent,
        double slope,
        double normalizedSlopePercent,
        double rSquared,
        double minValue,
        double maxValue,
        double currentValue,
        Double dayOverDayPercent,
        Double weekOverWeekPercent,
        int timepoints
) {}
