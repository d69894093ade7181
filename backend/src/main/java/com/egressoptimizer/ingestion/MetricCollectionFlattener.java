package com.egressoptimizer.ingestion;

import com.egressoptimizer.domain.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens a collection document into one {@link MetricSample} per data point.
 *
 * DEFAULTS:
 * - metric name and display name fall back to the series key
 * - unit falls back to "Count"
 * - resource name falls back to "Unknown", location to "unknown"
 *
 * Series whose {@code times} and {@code values} are empty or of different
 * lengths are skipped whole; individual points with an unparseable timestamp
 * or a missing, negative or non-finite value are skipped with a warning.
 */
@Component
@Slf4j
public class MetricCollectionFlattener {

    static final String DEFAULT_UNIT = "Count";
    static final String DEFAULT_RESOURCE_NAME = "Unknown";

    public List<MetricSample> flatten(MetricCollection collection) {
        if (collection == null) {
            return List.of();
        }

        List<MetricSample> samples = new ArrayList<>();
        int skippedSeries = 0;
        int skippedPoints = 0;

        for (var typeEntry : collection.resources().entrySet()) {
            String resourceType = typeEntry.getKey();
            if (typeEntry.getValue() == null) {
                continue;
            }
            for (var resourceEntry : typeEntry.getValue().entrySet()) {
                String resourceId = resourceEntry.getKey();
                MetricCollection.CollectedResource resource = resourceEntry.getValue();
                if (resource == null) {
                    continue;
                }

                for (Map.Entry<String, MetricCollection.MetricSeries> metricEntry : resource.metrics().entrySet()) {
                    String key = metricEntry.getKey();
                    MetricCollection.MetricSeries series = metricEntry.getValue();

                    if (series == null || series.times() == null || series.values() == null
                            || series.times().isEmpty() || series.times().size() != series.values().size()) {
                        log.warn("Skipping metric {} of {}: times and values missing or misaligned", key, resourceId);
                        skippedSeries++;
                        continue;
                    }

                    MetricSample template = MetricSample.builder()
                            .resourceId(resourceId)
                            .resourceName(orDefault(resource.name(), DEFAULT_RESOURCE_NAME))
                            .resourceType(resourceType)
                            .resourceGroup(orDefault(resource.resourceGroup(), ResourceIds.resourceGroup(resourceId)))
                            .location(resource.location())
                            .metricName(orDefault(series.name(), key))
                            .displayName(orDefault(series.displayName(), key))
                            .unit(orDefault(series.unit(), DEFAULT_UNIT))
                            .timestamp(Instant.EPOCH)
                            .build();

                    for (int i = 0; i < series.times().size(); i++) {
                        Optional<Instant> timestamp = TimestampParser.parse(series.times().get(i));
                        Double value = series.values().get(i);
                        if (timestamp.isEmpty() || !MetricSample.isAcceptableValue(value)) {
                            log.warn("Skipping point {} of metric {} on {}: timestamp '{}', value {}",
                                    i, key, resourceId, series.times().get(i), value);
                            skippedPoints++;
                            continue;
                        }
                        samples.add(template.toBuilder()
                                .timestamp(timestamp.get())
                                .value(value)
                                .build());
                    }
                }
            }
        }

        log.info("Flattened collection {} into {} samples ({} series, {} points skipped)",
                collection.collectionId(), samples.size(), skippedSeries, skippedPoints);
        return samples;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
