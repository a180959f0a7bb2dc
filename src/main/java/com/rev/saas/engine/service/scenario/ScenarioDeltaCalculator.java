package com.rev.saas.engine.service.scenario;

import com.rev.saas.engine.enums.LevelDelta;
import com.rev.saas.engine.model.DeltaRange;
import com.rev.saas.engine.model.DeltaValues;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.ScenarioMetrics;
import org.springframework.stereotype.Component;

/**
 * Candidate-minus-baseline differences between two scenarios' projected metrics.
 */
@Component
public class ScenarioDeltaCalculator {

    public DeltaValues compute(ScenarioItem baseline, ScenarioItem candidate) {
        ScenarioMetrics base = metricsOf(baseline);
        ScenarioMetrics cand = metricsOf(candidate);

        return DeltaValues.builder()
                .revenueImpactPct(diff(MetricRanges.percentRange(base.getRevenueImpactRange()),
                        MetricRanges.percentRange(cand.getRevenueImpactRange())))
                .churnImpactPp(diff(MetricRanges.percentRange(base.getChurnImpactRange()),
                        MetricRanges.percentRange(cand.getChurnImpactRange())))
                .timeToImpactDays(diff(MetricRanges.dayRange(base.getTimeToImpact()),
                        MetricRanges.dayRange(cand.getTimeToImpact())))
                .riskDelta(LevelDelta.compare(base.getRiskLabel(), cand.getRiskLabel()))
                .effortDelta(LevelDelta.compare(base.getExecutionEffort(), cand.getExecutionEffort()))
                .build();
    }

    private static DeltaRange diff(DeltaRange base, DeltaRange cand) {
        return new DeltaRange(cand.getMin() - base.getMin(), cand.getMax() - base.getMax());
    }

    private static ScenarioMetrics metricsOf(ScenarioItem item) {
        return item.getMetrics() == null ? new ScenarioMetrics() : item.getMetrics();
    }
}
