package com.company.slr.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SloReport implements Serializable {
    private Long productId;
    private String productName;
    private String productSlug;
    private String productGroupName;
    private String productGroupSlug;
    private String reportType;
    private List<ObjectiveReport> slo;
}
