package com.egressoptimizer.anomaly;

import com.egressoptimizer.analysis.Statistics;
import com.egressoptimizer.domain.model.AnomalyAlgorithm;
import com.egressoptimizer.domain.model.AnomalyResult;
import com.egressoptimizer.domain.model.MetricSample;
import com.egressoptimizer.domain.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * The three outlier scorers. Each works on one time-ordered series and returns
 * the flagged points; series below the algorithm's minimum length, or with no
 * spread, produce nothing.
 */
final class AnomalyAlgorithms {

    /** Consistency constant making MAD comparable to a standard deviation. */
    static final double MAD_SCALE = 0.6745;

    private AnomalyAlgorithms() {
        // Utility class
    }

    static List<AnomalyResult> zScore(SeriesKey key, List<MetricSample> series, AnomalySettings settings) {
        if (series.size() < settings.minDataPoints()) {
            return List.of();
        }
        double[] values = values(series);
        double mean = Statistics.mean(values);
        double std = Statistics.sampleStdDev(values);
        if (Statistics.isZeroSpread(std, values)) {
            return List.of();
        }

        List<AnomalyResult> anomalies = new ArrayList<>();
        double threshold = settings.zscoreThreshold();
        for (int i = 0; i < values.length; i++) {
            double score = (values[i] - mean) / std;
            if (Math.abs(score) > threshold) {
                anomalies.add(result(key, series.get(i), mean, score, AnomalyAlgorithm.ZSCORE, threshold));
            }
        }
        return anomalies;
    }

    static List<AnomalyResult> mad(SeriesKey key, List<MetricSample> series, AnomalySettings settings) {
        if (series.size() < settings.minDataPoints()) {
            return List.of();
        }
        double[] values = values(series);
        double median = Statistics.median(values);

        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = Statistics.median(deviations);
        if (mad == 0) {
            return List.of();
        }

        List<AnomalyResult> anomalies = new ArrayList<>();
        double threshold = settings.madThreshold();
        for (int i = 0; i < values.length; i++) {
            double score = MAD_SCALE * (values[i] - median) / mad;
            if (Math.abs(score) > threshold) {
                anomalies.add(result(key, series.get(i), median, score, AnomalyAlgorithm.MAD, threshold));
            }
        }
        return anomalies;
    }

    static List<AnomalyResult> movingAverage(SeriesKey key, List<MetricSample> series, AnomalySettings settings) {
        int window = settings.movingAvgWindow();
        if (series.size() < window + 2) {
            return List.of();
        }
        double[] values = values(series);
        int n = values.length;

        // Points before the first full window have no rolling mean
        double[] rollingMean = new double[n];
        double[] residuals = new double[n - window + 1];
        double windowSum = 0;
        for (int i = 0; i < n; i++) {
            windowSum += values[i];
            if (i >= window) {
                windowSum -= values[i - window];
            }
            if (i >= window - 1) {
                rollingMean[i] = windowSum / window;
                residuals[i - window + 1] = values[i] - rollingMean[i];
            }
        }

        double std = Statistics.sampleStdDev(residuals);
        if (Statistics.isZeroSpread(std, values)) {
            return List.of();
        }

        List<AnomalyResult> anomalies = new ArrayList<>();
        double threshold = settings.peakDetectionThreshold();
        for (int i = window - 1; i < n; i++) {
            double score = (values[i] - rollingMean[i]) / std;
            if (Math.abs(score) > threshold) {
                anomalies.add(result(key, series.get(i), rollingMean[i], score,
                        AnomalyAlgorithm.MOVING_AVERAGE, threshold));
            }
        }
        return anomalies;
    }

    private static double[] values(List<MetricSample> series) {
        return series.stream().mapToDouble(MetricSample::value).toArray();
    }

    private static AnomalyResult result(SeriesKey key, MetricSample sample, double expected, double score,
                                        AnomalyAlgorithm algorithm, double threshold) {
        return AnomalyResult.builder()
                .resourceId(key.resourceId())
                .resourceName(key.resourceName())
                .metricName(key.metricName())
                .timestamp(sample.timestamp())
                .value(sample.value())
                .expectedValue(expected)
                .score(score)
                .algorithm(algorithm)
                .severity(Severity.forScore(score, threshold))
                .build();
    }
}
