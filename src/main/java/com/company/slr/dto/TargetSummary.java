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
public class TargetSummary implements Serializable {
    private Double from;
    private Double to;
    private String sliName;
    private String unit;
    private String aggregation;
}
