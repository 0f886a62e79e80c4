package com.company.slr.aggregation;

import com.company.slr.domain.IndicatorValue;
import com.company.slr.domain.IndicatorValueAggregate;
import com.company.slr.domain.Target;
import com.company.slr.domain.enums.AggregationType;
import com.company.slr.domain.enums.Resolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndicatorValueAggregatorTest {

    private static IndicatorValue value(String timestamp, double value) {
        return IndicatorValue.of(Instant.parse(timestamp), value);
    }

    @Test
    @DisplayName("Daily buckets summarize the raw values of each day")
    void dailySumBuckets() {
        List<IndicatorValue> values = List.of(
                value("2024-01-01T00:10:00Z", 10),
                value("2024-01-01T08:00:00Z", 20),
                value("2024-01-01T23:59:00Z", 30),
                value("2024-01-02T06:00:00Z", 5));

        List<IndicatorValueAggregate> buckets =
                IndicatorValueAggregator.aggregate(values, Resolution.DAY, AggregationType.SUM);

        assertThat(buckets).hasSize(2);

        IndicatorValueAggregate first = buckets.get(0);
        assertThat(first.getTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(first.getSum()).isEqualTo(60);
        assertThat(first.getCount()).isEqualTo(3);
        assertThat(first.getAverage()).isEqualTo(20);
        assertThat(first.getMin()).isEqualTo(10);
        assertThat(first.getMax()).isEqualTo(30);
        assertThat(first.getAggregate()).isEqualTo(60);

        IndicatorValueAggregate second = buckets.get(1);
        assertThat(second.getTimestamp()).isEqualTo(Instant.parse("2024-01-02T00:00:00Z"));
        assertThat(second.getSum()).isEqualTo(5);
        assertThat(second.getCount()).isEqualTo(1);
        assertThat(second.getAverage()).isEqualTo(5);
        assertThat(second.getMin()).isEqualTo(5);
        assertThat(second.getMax()).isEqualTo(5);
    }

    @Test
    @DisplayName("Weekly buckets start on Monday")
    void weeklyBucketsStartOnMonday() {
        List<IndicatorValue> values = List.of(
                value("2024-01-03T12:00:00Z", 1),
                value("2024-01-07T23:00:00Z", 3),
                value("2024-01-08T00:00:00Z", 7));

        List<IndicatorValueAggregate> buckets =
                IndicatorValueAggregator.aggregate(values, Resolution.WEEK, AggregationType.MAX);

        assertThat(buckets).extracting(IndicatorValueAggregate::getTimestamp).containsExactly(
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-08T00:00:00Z"));
        assertThat(buckets.get(0).getAggregate()).isEqualTo(3);
    }

    @Test
    @DisplayName("Total is a single bucket stamped with the earliest value")
    void totalBucket() {
        List<IndicatorValue> values = List.of(
                value("2024-01-02T00:00:00Z", 4),
                value("2024-01-01T00:00:00Z", 2));

        List<IndicatorValueAggregate> buckets =
                IndicatorValueAggregator.aggregate(values, Resolution.TOTAL, AggregationType.MIN);

        assertThat(buckets).singleElement().satisfies(total -> {
            assertThat(total.getTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
            assertThat(total.getAggregate()).isEqualTo(2);
            assertThat(total.getCount()).isEqualTo(2);
        });
        assertThat(IndicatorValueAggregator.aggregate(List.of(), Resolution.TOTAL, AggregationType.SUM)).isEmpty();
    }

    @Test
    @DisplayName("Weighted buckets report the mean of the stored values")
    void weightedUsesAverage() {
        List<IndicatorValueAggregate> buckets = IndicatorValueAggregator.aggregate(
                List.of(value("2024-01-01T00:00:00Z", 1), value("2024-01-01T00:01:00Z", 3)),
                Resolution.DAY, AggregationType.WEIGHTED);

        assertThat(buckets.get(0).getAggregate()).isEqualTo(2);
    }

    @Test
    @DisplayName("Breaches are counted on raw values, not on the bucket average")
    void breachCount() {
        Target target = Target.builder().targetFrom(0.0).targetTo(100.0).build();

        IndicatorValueAggregate bucket = IndicatorValueAggregator.aggregate(List.of(
                        value("2024-01-01T00:00:00Z", 50),
                        value("2024-01-01T00:01:00Z", 150),
                        value("2024-01-01T00:02:00Z", -10),
                        value("2024-01-01T00:03:00Z", 99)),
                Resolution.DAY, AggregationType.AVERAGE).get(0);

        assertThat(bucket.getAverage()).isBetween(0.0, 100.0);
        assertThat(bucket.countBreaches(target)).isEqualTo(2);
    }

    @Test
    @DisplayName("Missing target bounds are unbounded")
    void unboundedTarget() {
        Target upperOnly = Target.builder().targetTo(10.0).build();

        assertThat(upperOnly.isBreachedBy(-1e9)).isFalse();
        assertThat(upperOnly.isBreachedBy(10)).isFalse();
        assertThat(upperOnly.isBreachedBy(10.5)).isTrue();
    }
}
