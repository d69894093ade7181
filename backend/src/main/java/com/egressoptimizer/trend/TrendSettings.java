package com.egressoptimizer.trend;

/**
 * Immutable trend analysis settings.
 *
 * @param minDataPoints minimum number of aggregated timestamps for a trend
 */
public record TrendSettings(int minDataPoints) {

    public static final int DEFAULT_MIN_DATA_POINTS = 3;

    public TrendSettings {
        if (minDataPoints < 1) {
            throw new IllegalArgumentException("minDataPoints must be positive: " + minDataPoints);
        }
    }

    public static TrendSettings defaults() {
        return new TrendSettings(DEFAULT_MIN_DATA_POINTS);
    }
}
