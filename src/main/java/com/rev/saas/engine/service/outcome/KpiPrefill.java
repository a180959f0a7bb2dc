package com.rev.saas.engine.service.outcome;

import com.rev.saas.engine.enums.KpiConfidence;
import com.rev.saas.engine.enums.KpiKey;
import com.rev.saas.engine.enums.KpiUnit;
import com.rev.saas.engine.model.OutcomeKpi;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.ScenarioMetrics;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.service.scenario.MetricRanges;

import java.util.ArrayList;
import java.util.List;

/**
 * KPIs a freshly applied scenario starts with: revenue and churn targets at the midpoint of the scenario's
 * projected ranges, plus the decision's primary KPI for the user to fill in. Baselines start at zero.
 */
public final class KpiPrefill {

    private KpiPrefill() {
    }

    public static List<OutcomeKpi> fromScenario(Decision decision, ScenarioItem scenario) {
        ScenarioMetrics m = scenario.getMetrics() == null ? new ScenarioMetrics() : scenario.getMetrics();
        List<OutcomeKpi> kpis = new ArrayList<>();

        kpis.add(OutcomeKpi.builder()
                .key(KpiKey.REVENUE)
                .unit(KpiUnit.PERCENT)
                .baseline(0d)
                .target(MetricRanges.midpoint(MetricRanges.percentRange(m.getRevenueImpactRange())))
                .confidence(KpiConfidence.MEDIUM)
                .notes("Expected impact: " + nullToEmpty(m.getRevenueImpactRange()))
                .build());

        kpis.add(OutcomeKpi.builder()
                .key(KpiKey.CHURN)
                .unit(KpiUnit.PERCENTAGE_POINTS)
                .baseline(0d)
                .target(MetricRanges.midpoint(MetricRanges.percentRange(m.getChurnImpactRange())))
                .confidence(KpiConfidence.MEDIUM)
                .notes("Expected impact: " + nullToEmpty(m.getChurnImpactRange()))
                .build());

        String primary = decision.getContext() == null ? null : decision.getContext().primaryKpiValue();
        KpiKey primaryKey = KpiKey.fromPrimaryKpi(primary);
        if (primaryKey != KpiKey.REVENUE && primaryKey != KpiKey.CHURN) {
            kpis.add(OutcomeKpi.builder()
                    .key(primaryKey)
                    .unit(primaryKey.getDefaultUnit())
                    .baseline(0d)
                    .target(0d)
                    .confidence(KpiConfidence.LOW)
                    .notes("Set your baseline and target")
                    .build());
        }
        return kpis;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
