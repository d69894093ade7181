package com.egressoptimizer.anomaly;

/**
 * Immutable anomaly detection settings.
 *
 * @param zscoreThreshold        |z| above which a point is flagged by the z-score algorithm
 * @param minDataPoints          minimum series length for z-score and MAD
 * @param madThreshold           |modified z| above which a point is flagged by MAD
 * @param movingAvgWindow        rolling window size; the series needs window + 2 points
 * @param peakDetectionThreshold |residual score| above which the moving-average algorithm flags
 */
public record AnomalySettings(
        double zscoreThreshold,
        int minDataPoints,
        double madThreshold,
        int movingAvgWindow,
        double peakDetectionThreshold
) {

    public AnomalySettings {
        if (zscoreThreshold <= 0 || madThreshold <= 0 || peakDetectionThreshold <= 0) {
            throw new IllegalArgumentException("Anomaly thresholds must be positive");
        }
        if (minDataPoints < 2) {
            throw new IllegalArgumentException("minDataPoints must be at least 2: " + minDataPoints);
        }
        if (movingAvgWindow < 1) {
            throw new IllegalArgumentException("movingAvgWindow must be positive: " + movingAvgWindow);
        }
    }

    public static AnomalySettings defaults() {
        return new AnomalySettings(3.0, 5, 3.5, 5, 3.0);
    }
}
