package com.rev.saas.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Projected metrics of one scenario, as free text ranges ("+15-25%", "3-6 months", "low").
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioMetrics {
    private String revenueImpactRange;
    private String churnImpactRange;
    private String riskLabel;
    private String timeToImpact;
    private String executionEffort;
}
