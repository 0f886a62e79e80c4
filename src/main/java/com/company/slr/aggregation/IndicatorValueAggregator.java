package com.company.slr.aggregation;

import com.company.slr.domain.IndicatorValue;
import com.company.slr.domain.IndicatorValueAggregate;
import com.company.slr.domain.enums.AggregationType;
import com.company.slr.domain.enums.Resolution;

import java.time.Instant;
import java.util.*;

/**
 * Re-aggregates materialized indicator values into resolution buckets.
 */
public final class IndicatorValueAggregator {

    private IndicatorValueAggregator() {
    }

    /**
     * Groups {@code values} by the bucket their timestamp truncates to and summarizes each
     * bucket. {@link Resolution#TOTAL} yields at most one bucket, stamped with the earliest
     * timestamp. Buckets are returned in ascending order.
     */
    public static List<IndicatorValueAggregate> aggregate(
            Collection<IndicatorValue> values, Resolution resolution, AggregationType aggregationType) {

        if (values.isEmpty()) {
            return Collections.emptyList();
        }

        if (resolution == Resolution.TOTAL) {
            Instant first = values.stream()
                    .map(IndicatorValue::getTimestamp)
                    .min(Comparator.naturalOrder())
                    .orElseThrow();
            return List.of(summarize(first, values, aggregationType));
        }

        SortedMap<Instant, List<IndicatorValue>> buckets = new TreeMap<>();
        for (IndicatorValue value : values) {
            buckets.computeIfAbsent(resolution.truncate(value.getTimestamp()), k -> new ArrayList<>())
                    .add(value);
        }

        List<IndicatorValueAggregate> result = new ArrayList<>(buckets.size());
        buckets.forEach((timestamp, bucket) -> result.add(summarize(timestamp, bucket, aggregationType)));
        return result;
    }

    /**
     * One-value bucket, used where the backend already bucketed the series.
     */
    public static IndicatorValueAggregate fromValue(IndicatorValue value) {
        double v = value.getValue();
        return IndicatorValueAggregate.builder()
                .timestamp(value.getTimestamp())
                .aggregate(v)
                .sum(v)
                .count(1)
                .average(v)
                .min(v)
                .max(v)
                .values(List.of(v))
                .build();
    }

    static IndicatorValueAggregate summarize(
            Instant timestamp, Collection<IndicatorValue> bucket, AggregationType aggregationType) {

        DoubleSummaryStatistics stats = bucket.stream()
                .mapToDouble(IndicatorValue::getValue)
                .summaryStatistics();

        List<Double> raw = bucket.stream().map(IndicatorValue::getValue).toList();

        return IndicatorValueAggregate.builder()
                .timestamp(timestamp)
                .aggregate(select(stats, aggregationType))
                .sum(stats.getSum())
                .count(stats.getCount())
                .average(stats.getAverage())
                .min(stats.getMin())
                .max(stats.getMax())
                .values(raw)
                .build();
    }

    // Weights are gone once values are materialized, so weighted falls back to the mean
    private static double select(DoubleSummaryStatistics stats, AggregationType aggregationType) {
        return switch (aggregationType) {
            case SUM -> stats.getSum();
            case MIN -> stats.getMin();
            case MAX -> stats.getMax();
            case AVERAGE, WEIGHTED -> stats.getAverage();
        };
    }
}
