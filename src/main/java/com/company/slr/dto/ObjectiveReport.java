package com.company.slr.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveReport implements Serializable {
    private Long id;
    private String title;
    private String description;
    private List<TargetSummary> targets;

    // Bucket start (ISO-8601) -> SLI name -> summary, ascending by bucket
    private Map<String, Map<String, BucketSummary>> days;
}
