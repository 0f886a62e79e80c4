package com.company.slr.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Summary of one resolution bucket. Derived, never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorValueAggregate implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant timestamp;

    // Headline value selected by the indicator's aggregation type
    private double aggregate;

    private double sum;
    private long count;
    private double average;
    private double min;
    private double max;

    private List<Double> values;

    /**
     * Breaches are counted on the raw values of the bucket, never on its aggregate.
     */
    public long countBreaches(Target target) {
        if (values == null) return 0;
        return values.stream().filter(target::isBreachedBy).count();
    }
}
