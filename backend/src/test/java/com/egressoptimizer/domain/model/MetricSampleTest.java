package com.egressoptimizer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricSampleTest {

    private static MetricSample.MetricSampleBuilder sample() {
        return MetricSample.builder()
                .resourceId("vm1")
                .metricName("Network Out Total")
                .timestamp(Instant.parse("2024-01-15T00:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-1.0, -0.001, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Should reject negative and non-finite values")
    void shouldRejectUnusableValues(double value) {
        assertThatThrownBy(() -> sample().value(value).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    @DisplayName("Should accept zero and lowercase the location")
    void shouldAcceptZero() {
        MetricSample sample = sample().value(0).location("EastUS").build();

        assertThat(sample.value()).isZero();
        assertThat(sample.location()).isEqualTo("eastus");
        assertThat(MetricSample.isAcceptableValue(null)).isFalse();
    }
}
