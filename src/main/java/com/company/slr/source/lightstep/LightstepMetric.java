package com.company.slr.source.lightstep;

import com.company.slr.domain.IndicatorValue;
import com.company.slr.exception.BackendTransportException;
import com.company.slr.exception.SourceException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Metrics a Lightstep stream can be read as. Each knows its request flags and how to
 * extract one value per time window from the timeseries response.
 */
public enum LightstepMetric {
    OPERATION_COUNT(Kind.OPERATION_COUNT, null),
    OPERATION_RATE(Kind.OPERATION_RATE, null),
    ERROR_COUNT(Kind.ERROR_COUNT, null),
    ERROR_PERCENTAGE(Kind.ERROR_PERCENTAGE, null),
    LATENCY_P50(Kind.LATENCY, "50"),
    LATENCY_P75(Kind.LATENCY, "75"),
    LATENCY_P90(Kind.LATENCY, "90"),
    LATENCY_P95(Kind.LATENCY, "95"),
    LATENCY_P99(Kind.LATENCY, "99");

    private enum Kind {
        OPERATION_COUNT, OPERATION_RATE, ERROR_COUNT, ERROR_PERCENTAGE, LATENCY
    }

    private final Kind kind;
    private final String percentile;

    LightstepMetric(Kind kind, String percentile) {
        this.kind = kind;
        this.percentile = percentile;
    }

    /**
     * Accepts {@code latency_p99}, {@code latency-p99}, {@code LATENCY_P99}, ...
     */
    public static Optional<LightstepMetric> fromString(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.toUpperCase(Locale.ROOT).replace('-', '_')));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(m -> m.name().toLowerCase(Locale.ROOT)).toList();
    }

    public Map<String, String> requestParams() {
        return switch (kind) {
            case OPERATION_COUNT, OPERATION_RATE -> Map.of("include-ops-counts", "1");
            case ERROR_COUNT -> Map.of("include-error-counts", "1");
            case ERROR_PERCENTAGE -> Map.of("include-ops-counts", "1", "include-error-counts", "1");
            case LATENCY -> Map.of("percentile", percentile);
        };
    }

    /**
     * Points of a timeseries response, each stamped with its window's {@code youngest-time}.
     */
    public List<IndicatorValue> fromResponse(JsonNode response, int resolutionSeconds) {
        JsonNode attributes = response.path("data").path("attributes");
        JsonNode windows = attributes.path("time-windows");
        if (!windows.isArray()) {
            throw new BackendTransportException("Lightstep response has no time-windows");
        }

        List<Double> values = extract(attributes, resolutionSeconds);
        int count = Math.min(windows.size(), values.size());

        List<IndicatorValue> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(IndicatorValue.of(parseTime(windows.get(i).path("youngest-time").asText()), values.get(i)));
        }
        return points;
    }

    List<Double> extract(JsonNode attributes, int resolutionSeconds) {
        switch (kind) {
            case OPERATION_COUNT:
                return numbers(attributes, "ops-counts");
            case OPERATION_RATE:
                return numbers(attributes, "ops-counts").stream()
                        .map(ops -> ops / resolutionSeconds)
                        .toList();
            case ERROR_COUNT:
                return numbers(attributes, "error-counts");
            case ERROR_PERCENTAGE: {
                List<Double> ops = numbers(attributes, "ops-counts");
                List<Double> errors = numbers(attributes, "error-counts");
                List<Double> ratios = new ArrayList<>();
                for (int i = 0; i < Math.min(ops.size(), errors.size()); i++) {
                    ratios.add(ops.get(i) == 0 ? 0.0 : errors.get(i) / ops.get(i));
                }
                return ratios;
            }
            case LATENCY:
                return latencies(attributes);
            default:
                throw new IllegalStateException("Unknown metric kind " + kind);
        }
    }

    private List<Double> latencies(JsonNode attributes) {
        double wanted = Double.parseDouble(percentile);
        for (JsonNode latency : attributes.path("latencies")) {
            JsonNode entryPercentile = latency.path("percentile");
            if (!entryPercentile.isMissingNode() && parsePercentile(entryPercentile.asText()) == wanted) {
                return numbers(latency, "latency-ms");
            }
        }
        throw new SourceException("Lightstep response has no latencies for percentile " + percentile);
    }

    private static double parsePercentile(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static List<Double> numbers(JsonNode parent, String field) {
        JsonNode array = parent.path(field);
        if (!array.isArray()) {
            throw new BackendTransportException("Lightstep response has no " + field);
        }
        List<Double> numbers = new ArrayList<>(array.size());
        array.forEach(n -> numbers.add(n.asDouble()));
        return numbers;
    }

    private static Instant parseTime(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new BackendTransportException("Lightstep returned an invalid time window: " + value, e);
        }
    }
}
