package com.rev.saas.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportingDetails {
    private String expectedRevenueImpact; // e.g. "+8-15%"
    private String churnOutlook;
    private String marketPositioning;
}
