package com.egressoptimizer.trend;

import com.egressoptimizer.analysis.AnalysisOutcome;
import com.egressoptimizer.analysis.EgressMetrics;
import com.egressoptimizer.analysis.Statistics;
import com.egressoptimizer.domain.model.MetricSample;
import com.egressoptimizer.domain.model.TrendDirection;
import com.egressoptimizer.domain.model.TrendStrength;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.*;

/**
 * Trend and seasonality analysis of outbound traffic.
 *
 * OVERALL TREND:
 * Egress values are summed across resources per timestamp, then an ordinary
 * least-squares line is fitted against the point index. The slope is normalized
 * by the series mean so that strength bands work for any traffic volume.
 *
 * SEASONALITY:
 * Weekly and hourly patterns average raw samples per day-of-week / hour-of-day
 * (UTC) and flag buckets 20% above or below the mean of the bucket averages.
 *
 * Stateless: every call works on the caller's dataset only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrendAnalyzer {

    private final TrendSettings settings;

    private static final int REGRESSION_MIN_POINTS = 3;
    private static final double STABLE_SLOPE_PERCENT = 1.0;
    private static final int WEEK_LOOKBACK_POINTS = 7;

    private static final double PEAK_RATIO = 1.2;
    private static final double LOW_RATIO = 0.8;

    private static final int MIN_DAYS_FOR_WEEKLY = 3;
    private static final double WEEKEND_DIFF_THRESHOLD = 15.0;

    private static final int MIN_HOURS_FOR_HOURLY = 6;
    private static final int BUSINESS_HOURS_START = 9;
    private static final int BUSINESS_HOURS_END = 17;
    private static final double BUSINESS_DIFF_THRESHOLD = 20.0;

    /**
     * Analyze the overall trend of egress traffic across all resources.
     */
    public AnalysisOutcome<TrendResult> analyzeOverallTrend(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return AnalysisOutcome.noData();
        }

        List<MetricSample> egress = EgressMetrics.filter(samples);
        if (egress.isEmpty()) {
            return AnalysisOutcome.noEgressData();
        }

        try {
            double[] series = aggregateByTimestamp(egress);
            int required = settings.minDataPoints();
            if (series.length < required) {
                log.info("Insufficient data for trend analysis: {} points, need {}", series.length, required);
                return AnalysisOutcome.insufficientData(
                        "Need at least " + required + " data points for trend analysis",
                        required, series.length
                );
            }

            TrendResult result = fitTrend(series, true);
            log.info("Overall egress trend: {} ({}), normalized slope {}% over {} points",
                    result.direction().getValue(), result.strength().getValue(),
                    String.format("%.2f", result.normalizedSlopePercent()), series.length);
            return AnalysisOutcome.success(result);

        } catch (Exception e) {
            log.error("Error analyzing overall trend", e);
            return AnalysisOutcome.failed(e);
        }
    }

    /**
     * Analyze egress trends separately for each value of a grouping field.
     * Only groups with a successful analysis are returned; blank group values are skipped.
     */
    public Map<String, TrendResult> analyzeTrendsByGroup(List<MetricSample> samples, GroupingField field) {
        if (samples == null || samples.isEmpty()) {
            return Map.of();
        }

        Map<String, List<MetricSample>> groups = new TreeMap<>();
        for (MetricSample sample : EgressMetrics.filter(samples)) {
            String key = field.valueOf(sample);
            if (key == null || key.isBlank()) {
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(sample);
        }

        Map<String, TrendResult> results = new LinkedHashMap<>();
        for (var entry : groups.entrySet()) {
            try {
                double[] series = aggregateByTimestamp(entry.getValue());
                if (series.length < settings.minDataPoints()) {
                    log.debug("Skipping group {}: {} points", entry.getKey(), series.length);
                    continue;
                }
                results.put(entry.getKey(), fitTrend(series, false));
            } catch (Exception e) {
                log.error("Error analyzing trend for group {}", entry.getKey(), e);
            }
        }

        log.debug("Analyzed {} of {} groups by {}", results.size(), groups.size(), field);
        return results;
    }

    /**
     * Detect day-of-week seasonality in egress traffic.
     */
    public AnalysisOutcome<WeeklyPattern> detectWeeklyPatterns(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return AnalysisOutcome.noData();
        }

        List<MetricSample> egress = EgressMetrics.filter(samples);
        if (egress.isEmpty()) {
            return AnalysisOutcome.noEgressData();
        }

        try {
            Map<DayOfWeek, List<Double>> byDay = new EnumMap<>(DayOfWeek.class);
            List<Double> weekdayValues = new ArrayList<>();
            List<Double> weekendValues = new ArrayList<>();

            for (MetricSample sample : egress) {
                DayOfWeek day = sample.timestamp().atZone(ZoneOffset.UTC).getDayOfWeek();
                byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(sample.value());
                if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
                    weekendValues.add(sample.value());
                } else {
                    weekdayValues.add(sample.value());
                }
            }

            if (byDay.size() < MIN_DAYS_FOR_WEEKLY) {
                return AnalysisOutcome.insufficientData(
                        "Need data from at least " + MIN_DAYS_FOR_WEEKLY + " different days of the week",
                        MIN_DAYS_FOR_WEEKLY, byDay.size()
                );
            }

            Map<DayOfWeek, Double> dayAverages = new EnumMap<>(DayOfWeek.class);
            byDay.forEach((day, values) -> dayAverages.put(day, Statistics.mean(values)));
            double overallAvg = Statistics.mean(dayAverages.values());

            List<String> peakDays = new ArrayList<>();
            List<String> lowDays = new ArrayList<>();
            Map<String, PeriodStats> dailyStats = new LinkedHashMap<>();

            for (var entry : dayAverages.entrySet()) {
                String dayName = entry.getKey().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
                double average = entry.getValue();
                if (average >= overallAvg * PEAK_RATIO) {
                    peakDays.add(dayName);
                }
                if (average <= overallAvg * LOW_RATIO) {
                    lowDays.add(dayName);
                }
                dailyStats.put(dayName, new PeriodStats(average, percentOf(average, overallAvg)));
            }

            Double weekdayAvg = weekdayValues.isEmpty() ? null : Statistics.mean(weekdayValues);
            Double weekendAvg = weekendValues.isEmpty() ? null : Statistics.mean(weekendValues);

            double weekendWeekdayDiff = 0;
            if (weekdayAvg != null && weekendAvg != null && weekdayAvg > 0) {
                weekendWeekdayDiff = (weekendAvg - weekdayAvg) / weekdayAvg * 100;
            }

            boolean hasPattern = !peakDays.isEmpty() || !lowDays.isEmpty()
                    || Math.abs(weekendWeekdayDiff) > WEEKEND_DIFF_THRESHOLD;

            log.debug("Weekly pattern: peaks={}, lows={}, weekend diff={}%",
                    peakDays, lowDays, String.format("%.1f", weekendWeekdayDiff));

            return AnalysisOutcome.success(new WeeklyPattern(
                    hasPattern,
                    peakDays,
                    lowDays,
                    weekendAvg,
                    weekdayAvg,
                    weekendWeekdayDiff,
                    dailyStats
            ));

        } catch (Exception e) {
            log.error("Error detecting weekly patterns", e);
            return AnalysisOutcome.failed(e);
        }
    }

    /**
     * Detect hour-of-day seasonality in egress traffic.
     */
    public AnalysisOutcome<HourlyPattern> detectHourlyPatterns(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            return AnalysisOutcome.noData();
        }

        List<MetricSample> egress = EgressMetrics.filter(samples);
        if (egress.isEmpty()) {
            return AnalysisOutcome.noEgressData();
        }

        try {
            Map<Integer, List<Double>> byHour = new TreeMap<>();
            List<Double> businessValues = new ArrayList<>();
            List<Double> afterHoursValues = new ArrayList<>();

            for (MetricSample sample : egress) {
                int hour = sample.timestamp().atZone(ZoneOffset.UTC).getHour();
                byHour.computeIfAbsent(hour, h -> new ArrayList<>()).add(sample.value());
                if (hour >= BUSINESS_HOURS_START && hour < BUSINESS_HOURS_END) {
                    businessValues.add(sample.value());
                } else {
                    afterHoursValues.add(sample.value());
                }
            }

            if (byHour.size() < MIN_HOURS_FOR_HOURLY) {
                return AnalysisOutcome.insufficientData(
                        "Need data from at least " + MIN_HOURS_FOR_HOURLY + " different hours of the day",
                        MIN_HOURS_FOR_HOURLY, byHour.size()
                );
            }

            Map<Integer, Double> hourAverages = new TreeMap<>();
            byHour.forEach((hour, values) -> hourAverages.put(hour, Statistics.mean(values)));
            double overallAvg = Statistics.mean(hourAverages.values());

            List<Integer> peakHours = new ArrayList<>();
            List<Integer> lowHours = new ArrayList<>();
            Map<String, PeriodStats> hourlyStats = new LinkedHashMap<>();

            for (var entry : hourAverages.entrySet()) {
                double average = entry.getValue();
                if (average >= overallAvg * PEAK_RATIO) {
                    peakHours.add(entry.getKey());
                }
                if (average <= overallAvg * LOW_RATIO) {
                    lowHours.add(entry.getKey());
                }
                hourlyStats.put(String.valueOf(entry.getKey()),
                        new PeriodStats(average, percentOf(average, overallAvg)));
            }

            Double businessAvg = businessValues.isEmpty() ? null : Statistics.mean(businessValues);
            Double afterHoursAvg = afterHoursValues.isEmpty() ? null : Statistics.mean(afterHoursValues);

            double businessHoursDiff = 0;
            if (businessAvg != null && afterHoursAvg != null && afterHoursAvg > 0) {
                businessHoursDiff = (businessAvg - afterHoursAvg) / afterHoursAvg * 100;
            }

            boolean hasPattern = !peakHours.isEmpty() || !lowHours.isEmpty()
                    || Math.abs(businessHoursDiff) > BUSINESS_DIFF_THRESHOLD;

            log.debug("Hourly pattern: peaks={}, lows={}, business diff={}%",
                    peakHours, lowHours, String.format("%.1f", businessHoursDiff));

            return AnalysisOutcome.success(new HourlyPattern(
                    hasPattern,
                    peakHours,
                    lowHours,
                    businessAvg,
                    afterHoursAvg,
                    businessHoursDiff,
                    hourlyStats
            ));

        } catch (Exception e) {
            log.error("Error detecting hourly patterns", e);
            return AnalysisOutcome.failed(e);
        }
    }

    /**
     * Sum values per timestamp across resources and metrics, in time order.
     */
    private double[] aggregateByTimestamp(List<MetricSample> samples) {
        Map<Instant, Double> totals = new TreeMap<>();
        for (MetricSample sample : samples) {
            totals.merge(sample.timestamp(), sample.value(), Double::sum);
        }
        return totals.values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    private TrendResult fitTrend(double[] values, boolean includePeriodDeltas) {
        int n = values.length;

        // Point-to-point percent changes; changes from a zero value are undefined and dropped
        List<Double> percentChanges = new ArrayList<>();
        for (int i = 1; i < n; i++) {
            double previous = values[i - 1];
            if (previous != 0) {
                percentChanges.add((values[i] - previous) / previous * 100);
            }
        }
        Double avgChange = percentChanges.isEmpty() ? null : Statistics.mean(percentChanges);
        Double latestChange = percentChanges.isEmpty() ? null : percentChanges.get(percentChanges.size() - 1);

        double slope = 0;
        double rSquared = 0;
        double confidence = 0;
        double normalizedSlope = 0;
        TrendDirection direction = TrendDirection.UNKNOWN;
        TrendStrength strength = TrendStrength.UNKNOWN;

        if (n >= REGRESSION_MIN_POINTS) {
            Regression fit = Regression.fit(values);
            slope = fit.slope();
            rSquared = fit.rSquared();
            confidence = Math.min(Math.abs(rSquared * 100), 100);

            double mean = Statistics.mean(values);
            normalizedSlope = mean != 0 ? slope / mean * 100 : 0;

            if (Math.abs(normalizedSlope) < STABLE_SLOPE_PERCENT) {
                direction = TrendDirection.STABLE;
                strength = TrendStrength.NONE;
            } else {
                direction = normalizedSlope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
                strength = TrendStrength.forSlope(normalizedSlope);
            }
        }

        double min = Arrays.stream(values).min().orElse(0);
        double max = Arrays.stream(values).max().orElse(0);
        double current = values[n - 1];

        Double dayOverDay = null;
        Double weekOverWeek = null;
        if (includePeriodDeltas) {
            if (n >= 2) {
                dayOverDay = percentChange(values[n - 2], current);
            }
            // Positional lookback over aggregated points, not a calendar week
            if (n >= WEEK_LOOKBACK_POINTS) {
                weekOverWeek = percentChange(values[n - WEEK_LOOKBACK_POINTS], current);
            }
        }

        return new TrendResult(
                direction,
                strength,
                confidence,
                avgChange,
                includePeriodDeltas ? latestChange : null,
                slope,
                normalizedSlope,
                rSquared,
                min,
                max,
                current,
                dayOverDay,
                weekOverWeek,
                n
        );
    }

    private static double percentChange(double base, double current) {
        return base != 0 ? (current - base) / base * 100 : 0;
    }

    private static double percentOf(double value, double reference) {
        return reference != 0 ? value / reference * 100 : 0;
    }

    /**
     * Ordinary least squares of value against point index 0..n-1.
     */
    record Regression(double slope, double intercept, double rSquared) {

        static Regression fit(double[] y) {
            int n = y.length;
            double xMean = (n - 1) / 2.0;
            double yMean = Statistics.mean(y);

            double sxy = 0;
            double sxx = 0;
            for (int i = 0; i < n; i++) {
                sxy += (i - xMean) * (y[i] - yMean);
                sxx += (i - xMean) * (i - xMean);
            }
            double slope = sxx != 0 ? sxy / sxx : 0;
            double intercept = yMean - slope * xMean;

            double ssTotal = 0;
            double ssResidual = 0;
            for (int i = 0; i < n; i++) {
                double predicted = slope * i + intercept;
                ssTotal += (y[i] - yMean) * (y[i] - yMean);
                ssResidual += (y[i] - predicted) * (y[i] - predicted);
            }
            double rSquared = ssTotal != 0 ? 1 - ssResidual / ssTotal : 0;

            return new Regression(slope, intercept, rSquared);
        }
    }
}
