package com.company.slr.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Healthy range of one indicator within one objective. A null bound is unbounded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Target implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private Long indicatorId;
    private Long objectiveId;

    private Double targetFrom;
    private Double targetTo;

    public double lowerBound() {
        return targetFrom == null ? Double.NEGATIVE_INFINITY : targetFrom;
    }

    public double upperBound() {
        return targetTo == null ? Double.POSITIVE_INFINITY : targetTo;
    }

    public boolean isBreachedBy(double value) {
        return value < lowerBound() || value > upperBound();
    }
}
