package com.egressoptimizer.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Recommendation as emitted by a single analyzer, before the engine assigns
 * an id, a confidence and a source.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyzerRecommendation(
        RecommendationType type,
        Severity severity,
        String title,
        String description,
        List<String> actions,
        String resourceId,
        Double potentialSavings
) {

    public AnalyzerRecommendation {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }
}
