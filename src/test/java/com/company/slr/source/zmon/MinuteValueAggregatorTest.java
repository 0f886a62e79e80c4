package com.company.slr.source.zmon;

import com.company.slr.Fixtures;
import com.company.slr.exception.BackendTransportException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MinuteValueAggregatorTest {

    private static final Instant MINUTE_0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant MINUTE_1 = Instant.parse("2024-01-01T00:01:00Z");

    private static JsonNode results() {
        return Fixtures.json("kairosdb-weighted-response.json").path("queries").path(0).path("results");
    }

    private static ZmonSourceConfig config(String type) {
        return ZmonSourceConfig.from(Map.of(
                "check_id", 1234,
                "keys", List.of("requests.latency"),
                "aggregation", Map.of("type", type, "weight_keys", List.of("*.count")),
                "exclude_keys", List.of("*.debug")));
    }

    @Test
    @DisplayName("Weighted minutes divide the weighted sum by the total weight")
    void weighted() {
        SortedMap<Instant, Double> minutes = MinuteValueAggregator.aggregate(results(), config("weighted"));

        // (10 * 1 + 20 * 3) / 4
        assertThat(minutes.get(MINUTE_0)).isEqualTo(17.5);
    }

    @Test
    @DisplayName("Weighted minutes with a total weight of 0 are exactly 0")
    void weightedZeroTotalWeight() {
        SortedMap<Instant, Double> minutes = MinuteValueAggregator.aggregate(results(), config("weighted"));

        assertThat(minutes.get(MINUTE_1)).isEqualTo(0.0);
        assertThat(minutes.get(MINUTE_1)).isNotNaN();
    }

    @Test
    @DisplayName("Groups without a weight count with weight 1")
    void missingWeightDefaultsToOne() {
        MinuteValueAggregator.GroupEntry weighted = new MinuteValueAggregator.GroupEntry(10.0, 3.0);
        MinuteValueAggregator.GroupEntry unweighted = new MinuteValueAggregator.GroupEntry(2.0, null);
        MinuteValueAggregator.GroupEntry weightOnly = new MinuteValueAggregator.GroupEntry(null, 5.0);

        // (30 + 2) / 4, the weight-only group is ignored
        assertThat(MinuteValueAggregator.weighted(List.of(weighted, unweighted, weightOnly))).isEqualTo(8.0);
    }

    @Test
    @DisplayName("Non-weighted types treat every key as a value and drop excluded keys")
    void statistical() {
        // With average every non-excluded key is its own value: app-1 and app-2 keep their last reading
        SortedMap<Instant, Double> sums = MinuteValueAggregator.aggregate(results(), config("sum"));
        SortedMap<Instant, Double> maxima = MinuteValueAggregator.aggregate(results(), config("maximum"));
        SortedMap<Instant, Double> minima = MinuteValueAggregator.aggregate(results(), config("min"));
        SortedMap<Instant, Double> averages = MinuteValueAggregator.aggregate(results(), config("average"));

        // Minute 0: app-1 -> 1.0 (count overwrites latency), app-2 -> 3.0, app-3 excluded
        assertThat(sums.get(MINUTE_0)).isEqualTo(4.0);
        assertThat(maxima.get(MINUTE_0)).isEqualTo(3.0);
        assertThat(minima.get(MINUTE_0)).isEqualTo(1.0);
        assertThat(averages.get(MINUTE_0)).isEqualTo(2.0);
        assertThat(sums.keySet()).containsExactly(MINUTE_0, MINUTE_1);
    }

    @Test
    @DisplayName("Nonzero values keep their sign and are at least epsilon in magnitude")
    void clamp() {
        assertThat(MinuteValueAggregator.clamp(1e-15)).isEqualTo(MinuteValueAggregator.EPSILON);
        assertThat(MinuteValueAggregator.clamp(-1e-15)).isEqualTo(-MinuteValueAggregator.EPSILON);
        assertThat(MinuteValueAggregator.clamp(0.0)).isEqualTo(0.0);
        assertThat(MinuteValueAggregator.clamp(42.0)).isEqualTo(42.0);
        assertThat(MinuteValueAggregator.clamp(-42.0)).isEqualTo(-42.0);
        assertThat(MinuteValueAggregator.EPSILON).isEqualTo(Math.expm1(1e-10));
    }

    @Test
    @DisplayName("Null or non-numeric point values fail the fetch instead of being stored as 0")
    void nonNumericValue() {
        String withNull = """
                [{"values": [[1704067200000, null]],
                  "group_by": [{"name": "tag", "group": {"entity": "app-1", "key": "requests.latency"}}]}]
                """;
        String withText = """
                [{"values": [[1704067200000, 12.5], [1704067260000, "n/a"]],
                  "group_by": [{"name": "tag", "group": {"entity": "app-1", "key": "requests.latency"}}]}]
                """;

        assertThatThrownBy(() -> MinuteValueAggregator.aggregate(parse(withNull), config("average")))
                .isInstanceOf(BackendTransportException.class)
                .hasMessageContaining("requests.latency");
        assertThatThrownBy(() -> MinuteValueAggregator.aggregate(parse(withText), config("average")))
                .isInstanceOf(BackendTransportException.class)
                .hasMessageContaining("n/a");
    }

    private static JsonNode parse(String json) throws Exception {
        return Fixtures.MAPPER.readTree(json);
    }
}
