package com.egressoptimizer.cost;

import com.egressoptimizer.domain.model.CostStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Successful cost analysis payload.
 *
 * {@code monthlyProjection} is absent when the dataset spans no time;
 * {@code projectionWarning} is present only when the projection crosses a
 * threshold the observed spend has not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CostAnalysis(
        CostStatus costStatus,
        double egressGb,
        double totalCost,
        String currency,
        double timePeriodDays,
        List<ResourceCost> resources,
        Map<String, RegionCost> byRegion,
        MonthlyProjection monthlyProjection,
        CostStatus projectionWarning
) {}
