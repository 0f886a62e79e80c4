package com.company.slr.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * One sample of an indicator. Stored rows are unique per (timestamp, indicatorId);
 * values computed on read (Lightstep) carry no indicator id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorValue implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant timestamp;
    private double value;
    private Long indicatorId;

    public static IndicatorValue of(Instant timestamp, double value) {
        return new IndicatorValue(timestamp, value, null);
    }
}
