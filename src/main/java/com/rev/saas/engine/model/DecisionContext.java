package com.rev.saas.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Business situation a verdict was produced for. Versioned on every edit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DecisionContext {
    private ContextField companyStage;
    private ContextField businessModel;
    private ContextField primaryKpi;
    private MarketContext market;

    public String primaryKpiValue() {
        return primaryKpi == null ? null : primaryKpi.getValue();
    }

    public String segmentValue() {
        return market == null ? null : market.getSegment();
    }
}
