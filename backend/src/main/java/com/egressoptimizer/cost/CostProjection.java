package com.egressoptimizer.cost;

import java.util.List;

/**
 * Month-by-month cost forecast compounded by a monthly trend factor.
 */
public record CostProjection(
        double baseMonthlyCost,
        double baseMonthlyGb,
        double trendFactorPercent,
        String currency,
        double totalProjectedCost,
        List<MonthProjection> monthlyProjections
) {}
