package com.rev.saas.engine.model;

import com.rev.saas.engine.enums.LevelDelta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate minus baseline, per metric.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeltaValues {
    private DeltaRange revenueImpactPct;
    private DeltaRange churnImpactPp;
    private DeltaRange timeToImpactDays;
    private LevelDelta riskDelta;
    private LevelDelta effortDelta;
}
