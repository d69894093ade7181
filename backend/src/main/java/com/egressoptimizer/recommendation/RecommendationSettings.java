package com.egressoptimizer.recommendation;

/**
 * Immutable recommendation ranking settings.
 *
 * @param maxRecommendations overall cap on the final list
 * @param maxPerCategory     cap per recommendation type, applied before the overall cap
 */
public record RecommendationSettings(int maxRecommendations, int maxPerCategory) {

    public RecommendationSettings {
        if (maxRecommendations < 0 || maxPerCategory < 0) {
            throw new IllegalArgumentException("Recommendation limits must not be negative");
        }
    }

    public static RecommendationSettings defaults() {
        return new RecommendationSettings(15, 5);
    }
}
