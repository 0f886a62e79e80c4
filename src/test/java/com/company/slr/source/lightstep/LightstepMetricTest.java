package com.company.slr.source.lightstep;

import com.company.slr.Fixtures;
import com.company.slr.domain.IndicatorValue;
import com.company.slr.exception.SourceException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LightstepMetricTest {

    private final JsonNode response = Fixtures.json("lightstep-timeseries.json");

    private static List<Double> values(List<IndicatorValue> points) {
        return points.stream().map(IndicatorValue::getValue).toList();
    }

    @Test
    @DisplayName("Metric names accept dashes and any case")
    void fromString() {
        assertThat(LightstepMetric.fromString("latency-p99")).contains(LightstepMetric.LATENCY_P99);
        assertThat(LightstepMetric.fromString("Operation_Rate")).contains(LightstepMetric.OPERATION_RATE);
        assertThat(LightstepMetric.fromString("p99")).isEmpty();
        assertThat(LightstepMetric.fromString(null)).isEmpty();
        assertThat(LightstepMetric.names()).hasSize(9).contains("latency_p95");
    }

    @Test
    @DisplayName("Points are stamped with the youngest time of their window")
    void timestamps() {
        List<IndicatorValue> points = LightstepMetric.OPERATION_COUNT.fromResponse(response, 600);

        assertThat(points).extracting(IndicatorValue::getTimestamp).containsExactly(
                Instant.parse("2024-01-10T11:40:00Z"),
                Instant.parse("2024-01-10T11:50:00Z"),
                Instant.parse("2024-01-10T12:00:00Z"));
        assertThat(values(points)).containsExactly(600.0, 1200.0, 0.0);
    }

    @Test
    @DisplayName("Rates divide counts by the resolution in seconds")
    void operationRate() {
        assertThat(values(LightstepMetric.OPERATION_RATE.fromResponse(response, 600)))
                .containsExactly(1.0, 2.0, 0.0);
    }

    @Test
    @DisplayName("Error percentage is a ratio and 0 without operations")
    void errorPercentage() {
        assertThat(values(LightstepMetric.ERROR_PERCENTAGE.fromResponse(response, 600)))
                .containsExactly(0.01, 0.02, 0.0);
        assertThat(values(LightstepMetric.ERROR_COUNT.fromResponse(response, 600)))
                .containsExactly(6.0, 24.0, 0.0);
    }

    @Test
    @DisplayName("Latency picks the matching percentile entry")
    void latency() {
        assertThat(values(LightstepMetric.LATENCY_P99.fromResponse(response, 600)))
                .containsExactly(250.0, 310.0, 180.0);
        assertThat(LightstepMetric.LATENCY_P50.requestParams()).containsEntry("percentile", "50");
    }

    @Test
    @DisplayName("A missing percentile is a source error")
    void missingPercentile() {
        assertThatThrownBy(() -> LightstepMetric.LATENCY_P95.fromResponse(response, 600))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("95");
    }

    @Test
    @DisplayName("Request flags match the metric")
    void requestParams() {
        assertThat(LightstepMetric.ERROR_PERCENTAGE.requestParams())
                .containsEntry("include-ops-counts", "1")
                .containsEntry("include-error-counts", "1");
        assertThat(LightstepMetric.OPERATION_COUNT.requestParams()).containsOnlyKeys("include-ops-counts");
    }
}
