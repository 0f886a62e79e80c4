package com.company.slr.source.zmon;

import com.company.slr.domain.enums.AggregationType;
import com.company.slr.exception.BackendTransportException;
import com.company.slr.util.TimeUtils;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;
import java.util.*;

/**
 * Folds grouped KairosDB series into one value per minute.
 *
 * <p>Within a minute, points are grouped by {@code (entity, key without its last segment)}.
 * For weighted aggregation a key matching a weight pattern sets the group weight, any other
 * key sets the group value. The groups of a minute are then combined by the aggregation type.
 */
public final class MinuteValueAggregator {

    /**
     * Smallest magnitude a nonzero value is stored with.
     */
    public static final double EPSILON = Math.expm1(1e-10);

    private MinuteValueAggregator() {
    }

    public static SortedMap<Instant, Double> aggregate(JsonNode results, ZmonSourceConfig config) {
        AggregationType aggregationType = config.getAggregationType();
        KeyPatterns excludeKeys = KeyPatterns.of(config.getExcludeKeys());
        KeyPatterns weightKeys = KeyPatterns.of(config.getWeightKeys());

        SortedMap<Instant, Map<GroupKey, GroupEntry>> minutes = new TreeMap<>();

        for (JsonNode result : results) {
            JsonNode values = result.path("values");
            if (!values.isArray() || values.isEmpty()) {
                continue;
            }

            JsonNode group = groupOf(result);
            String key = group.path("key").asText("");
            if (excludeKeys.matchesAny(key)) {
                continue;
            }

            GroupKey groupKey = new GroupKey(group.path("entity").asText(""), withoutLastSegment(key));
            boolean isWeight = aggregationType == AggregationType.WEIGHTED && weightKeys.matchesAny(key);

            for (JsonNode point : values) {
                Instant minute = TimeUtils.truncateToMinute(point.path(0).asLong());
                double value = numericValue(point, key);

                GroupEntry entry = minutes
                        .computeIfAbsent(minute, k -> new LinkedHashMap<>())
                        .computeIfAbsent(groupKey, k -> new GroupEntry());
                if (isWeight) {
                    entry.weight = value;
                } else {
                    entry.value = value;
                }
            }
        }

        SortedMap<Instant, Double> aggregated = new TreeMap<>();
        minutes.forEach((minute, groups) -> {
            OptionalDouble value = combine(groups.values(), aggregationType);
            value.ifPresent(v -> aggregated.put(minute, v));
        });
        return aggregated;
    }

    private static double numericValue(JsonNode point, String key) {
        JsonNode value = point.path(1);
        if (!value.isNumber()) {
            throw new BackendTransportException(
                    "KairosDB returned a non-numeric value for key '" + key + "': " + point);
        }
        return value.asDouble();
    }

    /**
     * Keeps the sign, lifts nonzero magnitudes to at least {@link #EPSILON}.
     */
    public static double clamp(double value) {
        if (value > 0) {
            return Math.max(value, EPSILON);
        }
        if (value < 0) {
            return Math.min(value, -EPSILON);
        }
        return value;
    }

    static OptionalDouble combine(Collection<GroupEntry> groups, AggregationType aggregationType) {
        if (aggregationType == AggregationType.WEIGHTED) {
            return OptionalDouble.of(weighted(groups));
        }

        double[] values = groups.stream()
                .filter(g -> g.value != null)
                .mapToDouble(g -> g.value)
                .toArray();
        if (values.length == 0) {
            return OptionalDouble.empty();
        }

        DoubleSummaryStatistics stats = Arrays.stream(values).summaryStatistics();
        return switch (aggregationType) {
            case AVERAGE -> OptionalDouble.of(stats.getAverage());
            case SUM -> OptionalDouble.of(stats.getSum());
            case MIN -> OptionalDouble.of(stats.getMin());
            case MAX -> OptionalDouble.of(stats.getMax());
            case WEIGHTED -> throw new IllegalStateException("handled above");
        };
    }

    // A total weight of 0 yields 0, not NaN
    static double weighted(Collection<GroupEntry> groups) {
        double totalWeight = 0;
        double totalValue = 0;
        for (GroupEntry group : groups) {
            if (group.value == null) {
                continue;
            }
            double weight = group.weight == null ? 1 : group.weight;
            totalWeight += weight;
            totalValue += group.value * weight;
        }
        return totalWeight != 0 ? totalValue / totalWeight : 0;
    }

    private static JsonNode groupOf(JsonNode result) {
        for (JsonNode groupBy : result.path("group_by")) {
            if (groupBy.has("group")) {
                return groupBy.get("group");
            }
        }
        return result.path("group_by").path(0).path("group");
    }

    private static String withoutLastSegment(String key) {
        int lastDot = key.lastIndexOf('.');
        return lastDot < 0 ? "" : key.substring(0, lastDot);
    }

    @Value
    static class GroupKey {
        String entity;
        String keyPrefix;
    }

    static class GroupEntry {
        Double value;
        Double weight;

        GroupEntry() {
        }

        GroupEntry(Double value, Double weight) {
            this.value = value;
            this.weight = weight;
        }
    }
}
