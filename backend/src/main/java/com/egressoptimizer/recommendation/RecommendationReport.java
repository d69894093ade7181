package com.egressoptimizer.recommendation;

import com.egressoptimizer.domain.model.AnalysisStatus;
import com.egressoptimizer.domain.model.Recommendation;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ranked recommendations of one engine run, with the analyzers that contributed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecommendationReport(
        AnalysisStatus status,
        Instant timestamp,
        int count,
        Sources sources,
        Map<String, Integer> categories,
        List<Recommendation> recommendations
) {

    public static RecommendationReport noData() {
        return new RecommendationReport(AnalysisStatus.NO_DATA, null, 0, null, null, List.of());
    }

    /**
     * Which analyzers completed successfully.
     */
    public record Sources(boolean trends, boolean costs, boolean anomalies) {}
}
