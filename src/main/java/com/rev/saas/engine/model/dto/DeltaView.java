package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.model.DeltaValues;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeltaView {
    private String baselineScenarioId;
    private String baselineName;
    private String candidateScenarioId;
    private DeltaValues deltas;
}
