package com.company.slr.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Objective implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private Long productId;
    private String title;
    private String description;
}
