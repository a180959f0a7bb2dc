package com.rev.saas.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionListParams {
    private String status;
    private String segment;
    private String primaryKpi;
    private Double minConfidence;
    private Instant from;
    private Instant to;
    private String search; // company name, website or verdict headline

    private Integer page;     // 1-based
    private Integer pageSize;
}
