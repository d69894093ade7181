package com.egressoptimizer.analysis;

import java.util.Arrays;
import java.util.Collection;

/**
 * Descriptive statistics over plain double arrays.
 */
public final class Statistics {

    private static final double RELATIVE_EPSILON = 1e-12;

    private Statistics() {
        // Utility class
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double mean(Collection<Double> values) {
        return mean(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /**
     * Sample standard deviation (n - 1 denominator). NaN for fewer than two values.
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sumSquares = 0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / (values.length - 1));
    }

    /**
     * Median; the mean of the two middle values for even-sized input.
     */
    public static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }

    /**
     * Zero check for a spread measured over {@code values}. A constant series can leave
     * a rounding residue in the spread, so anything within {@code 1e-12} of the largest
     * magnitude in the series counts as zero; the tolerance scales with the data.
     */
    public static boolean isZeroSpread(double spread, double[] values) {
        if (Double.isNaN(spread)) {
            return true;
        }
        double scale = 0;
        for (double v : values) {
            scale = Math.max(scale, Math.abs(v));
        }
        return spread <= RELATIVE_EPSILON * scale;
    }
}
