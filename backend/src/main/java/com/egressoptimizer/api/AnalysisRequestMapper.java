package com.egressoptimizer.api;

import com.egressoptimizer.domain.model.MetricSample;
import com.egressoptimizer.ingestion.MetricCollectionFlattener;
import com.egressoptimizer.ingestion.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts an analysis request body into the sample list the analyzers consume.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisRequestMapper {

    private final MetricCollectionFlattener flattener;

    public List<MetricSample> toSamples(EgressAnalysisController.EgressAnalysisRequest request) {
        if (request == null || (request.rows() == null && request.collection() == null)) {
            throw new IllegalArgumentException("Request must contain either rows or a collection");
        }
        if (request.collection() != null) {
            return flattener.flatten(request.collection());
        }

        List<MetricSample> samples = new ArrayList<>(request.rows().size());
        int skipped = 0;
        for (int i = 0; i < request.rows().size(); i++) {
            EgressAnalysisController.MetricRow row = request.rows().get(i);
            if (row.resourceId() == null || row.metricName() == null) {
                throw new IllegalArgumentException("Row " + i + " is missing resource_id or metric_name");
            }
            Optional<Instant> timestamp = TimestampParser.parse(row.timestamp());
            if (timestamp.isEmpty() || !MetricSample.isAcceptableValue(row.value())) {
                log.warn("Skipping row {}: timestamp '{}', value {}", i, row.timestamp(), row.value());
                skipped++;
                continue;
            }
            samples.add(MetricSample.builder()
                    .resourceId(row.resourceId())
                    .resourceName(row.resourceName())
                    .resourceType(row.resourceType())
                    .resourceGroup(row.resourceGroup())
                    .location(row.location())
                    .metricName(row.metricName())
                    .displayName(row.displayName() != null ? row.displayName() : row.metricName())
                    .unit(row.unit())
                    .timestamp(timestamp.get())
                    .value(row.value())
                    .build());
        }

        if (skipped > 0) {
            log.info("Accepted {} rows, skipped {}", samples.size(), skipped);
        }
        return samples;
    }
}
