package com.company.slr.domain;

import com.company.slr.domain.enums.AggregationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * SLI configuration, owned by the CRUD layer and read-only here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Indicator implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private Long productId;
    private String productName;

    private String name;
    private String slug;
    private String unit;

    // Backend type plus backend-specific parameters, stored as JSON
    private Map<String, Object> source;

    // Cached aggregation type of the source config
    private String aggregation;

    // Tombstone; hard deletion happens in retention
    private boolean deleted;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Configured aggregation: the cached column first, then {@code source.aggregation.type}.
     */
    public AggregationType getAggregationType() {
        if (aggregation != null && !aggregation.isEmpty()) {
            return AggregationType.fromIndicatorAggregation(aggregation);
        }
        if (source != null && source.get("aggregation") instanceof Map<?, ?> agg) {
            Object type = agg.get("type");
            return AggregationType.fromIndicatorAggregation(type == null ? null : type.toString());
        }
        return AggregationType.AVERAGE;
    }
}
