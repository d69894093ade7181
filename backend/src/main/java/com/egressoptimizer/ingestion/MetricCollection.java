package com.egressoptimizer.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Persisted output of one metrics collection run.
 *
 * Resources are nested by resource type, then by resource id; each resource
 * carries its metric series as parallel {@code times} / {@code values} arrays.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricCollection(
        @JsonProperty("collection_id") String collectionId,
        @JsonProperty("subscription_id") String subscriptionId,
        Period period,
        Map<String, Map<String, CollectedResource>> resources,
        List<CollectionError> errors
) {

    public MetricCollection {
        resources = resources != null ? resources : Map.of();
        errors = errors != null ? errors : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Period(String start, String end, String granularity) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CollectedResource(
            String name,
            @JsonProperty("resource_group") String resourceGroup,
            String location,
            Map<String, MetricSeries> metrics
    ) {
        public CollectedResource {
            metrics = metrics != null ? metrics : Map.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetricSeries(
            String name,
            @JsonProperty("display_name") String displayName,
            String unit,
            List<String> times,
            List<Double> values
    ) {}

    /**
     * A metric or resource the collector failed on.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CollectionError(
            @JsonProperty("resource_id") String resourceId,
            String metric,
            String error
    ) {}
}
