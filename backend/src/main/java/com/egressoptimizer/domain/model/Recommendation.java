package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Standardized recommendation emitted by the recommendation engine.
 *
 * Analyzers produce their own, smaller shape ({@code AnalyzerRecommendation});
 * the engine normalizes those into this one and assigns id, confidence and source.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Recommendation(
        String id,
        RecommendationType type,
        String title,
        String description,
        Severity severity,
        List<String> actions,
        String resourceId,
        String resourceName,
        Double potentialSavings,
        double confidence,
        RecommendationSource source,
        Map<String, Object> metadata
) {

    public Recommendation {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public int severityWeight() {
        return severity != null ? severity.getWeight() : 0;
    }
}
