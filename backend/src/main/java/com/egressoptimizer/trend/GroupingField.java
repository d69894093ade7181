package com.egressoptimizer.trend;

import com.egressoptimizer.domain.model.MetricSample;

import java.util.function.Function;

/**
 * Sample attribute used to split the dataset for per-group trend analysis.
 */
public enum GroupingField {
    RESOURCE_ID(MetricSample::resourceId),
    RESOURCE_NAME(MetricSample::resourceName),
    RESOURCE_TYPE(MetricSample::resourceType),
    LOCATION(MetricSample::location),
    METRIC_NAME(MetricSample::metricName);

    private final Function<MetricSample, String> extractor;

    GroupingField(Function<MetricSample, String> extractor) {
        this.extractor = extractor;
    }

    public String valueOf(MetricSample sample) {
        return extractor.apply(sample);
    }

    /**
     * Resolve a field from its column name, e.g. {@code resource_type}.
     */
    public static GroupingField fromValue(String value) {
        if (value != null) {
            for (GroupingField field : values()) {
                if (field.name().equalsIgnoreCase(value.trim().replace('-', '_'))) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Unknown grouping field: " + value
                + " (expected one of resource_id, resource_name, resource_type, location, metric_name)");
    }
}
