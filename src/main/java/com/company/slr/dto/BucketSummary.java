package com.company.slr.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketSummary implements Serializable {
    private double min;
    private double avg;
    private double max;
    private long count;
    private double sum;
    private long breaches;
    private String aggregation;
}
