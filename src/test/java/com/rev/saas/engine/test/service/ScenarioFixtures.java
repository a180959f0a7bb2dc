package com.rev.saas.engine.test.service;

import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.ScenarioMetrics;
import com.rev.saas.engine.model.documents.ScenarioSet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class ScenarioFixtures {

    private ScenarioFixtures() {
    }

    static ScenarioItem item(ScenarioKey key, String title, String revenue, String churn, String risk, String time,
                             String effort) {
        return ScenarioItem.builder()
                .scenarioId(key)
                .title(title)
                .metrics(ScenarioMetrics.builder()
                        .revenueImpactRange(revenue)
                        .churnImpactRange(churn)
                        .riskLabel(risk)
                        .timeToImpact(time)
                        .executionEffort(effort)
                        .build())
                .tradeoffs(new ArrayList<>(List.of("t1", "t2", "t3")))
                .baseline(key == ScenarioKey.BALANCED)
                .build();
    }

    static List<ScenarioItem> fourScenarios() {
        return new ArrayList<>(List.of(
                item(ScenarioKey.AGGRESSIVE, "Bold repricing", "+15-25%", "+1-2%", "high", "14-30 days", "high"),
                item(ScenarioKey.BALANCED, "Measured increase", "+8-15%", "+0.5-1%", "medium", "30-60 days", "medium"),
                item(ScenarioKey.CONSERVATIVE, "Grandfathered rollout", "+3-6%", "+0-0.5%", "low", "60-90 days", "low"),
                item(ScenarioKey.DO_NOTHING, "Hold prices", "Stagnates", "N/A", "low", "N/A", "low")));
    }

    static ScenarioSet set(String id, String decisionId, int version) {
        return ScenarioSet.builder()
                .id(id)
                .decisionId(decisionId)
                .userId("u1")
                .version(version)
                .scenarios(fourScenarios())
                .createdAt(Instant.now())
                .build();
    }
}
