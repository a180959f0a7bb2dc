package com.rev.saas.engine.model;

import com.rev.saas.engine.enums.KpiConfidence;
import com.rev.saas.engine.enums.KpiKey;
import com.rev.saas.engine.enums.KpiUnit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeKpi {
    private KpiKey key;
    private KpiUnit unit;
    private Double baseline;
    private Double target;
    private Double actual;
    private Double delta;    // actual - baseline
    private Double deltaPct; // unset when baseline is zero
    private KpiConfidence confidence;
    private String notes;
}
