package com.company.slr.domain.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum AggregationType {
    AVERAGE("average"),
    WEIGHTED("weighted"),
    SUM("sum"),
    MIN("min", "minimum"),
    MAX("max", "maximum");

    private final List<String> names;

    AggregationType(String... names) {
        this.names = List.of(names);
    }

    public String getName() {
        return names.get(0);
    }

    public static Optional<AggregationType> fromString(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.names.contains(type))
                .findFirst();
    }

    /**
     * Cached aggregation of an indicator; unknown or missing values fall back to AVERAGE.
     */
    public static AggregationType fromIndicatorAggregation(String type) {
        return fromString(type).orElse(AVERAGE);
    }

    /**
     * Every accepted spelling, in declaration order.
     */
    public static List<String> validNames() {
        return Arrays.stream(values())
                .flatMap(t -> t.names.stream())
                .toList();
    }
}
