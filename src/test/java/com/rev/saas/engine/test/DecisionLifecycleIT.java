package com.rev.saas.engine.test;

import com.rev.saas.engine.common.Result;
import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.enums.LevelDelta;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.ContextField;
import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.DecisionOutcome;
import com.rev.saas.engine.model.MarketContext;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.ScenarioMetrics;
import com.rev.saas.engine.model.Verdict;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.documents.MeasurableOutcome;
import com.rev.saas.engine.model.documents.ScenarioDelta;
import com.rev.saas.engine.model.documents.ScenarioSet;
import com.rev.saas.engine.model.dto.AddOutcomeRequest;
import com.rev.saas.engine.model.dto.ApplyScenarioResult;
import com.rev.saas.engine.model.dto.CreateDecisionRequest;
import com.rev.saas.engine.model.dto.DeltaView;
import com.rev.saas.engine.model.dto.StatusUpdateRequest;
import com.rev.saas.engine.model.dto.UpdateContextRequest;
import com.rev.saas.engine.service.decision.DecisionAdminService;
import com.rev.saas.engine.service.decision.DecisionService;
import com.rev.saas.engine.service.outcome.OutcomeService;
import com.rev.saas.engine.service.scenario.ScenarioDeltaService;
import com.rev.saas.engine.service.scenario.ScenarioService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
@ActiveProfiles("test")
class DecisionLifecycleIT extends BaseContainers {

    @Autowired
    DecisionService decisionService;
    @Autowired
    ScenarioService scenarioService;
    @Autowired
    ScenarioDeltaService scenarioDeltaService;
    @Autowired
    OutcomeService outcomeService;
    @Autowired
    DecisionAdminService adminService;
    @Autowired
    MongoTemplate mongoTemplate;

    private static ScenarioItem scenario(ScenarioKey key, String revenue, String risk, String time) {
        return ScenarioItem.builder()
                .scenarioId(key)
                .title(key.getValue())
                .metrics(ScenarioMetrics.builder()
                        .revenueImpactRange(revenue)
                        .churnImpactRange("+0.5-1%")
                        .riskLabel(risk)
                        .timeToImpact(time)
                        .executionEffort("medium")
                        .build())
                .tradeoffs(List.of("a", "b", "c"))
                .build();
    }

    @Test
    void decisionFromCreationToMeasuredOutcome() {
        String user = "user-" + System.nanoTime();
        Decision created = decisionService.createDecision(user, CreateDecisionRequest.builder()
                .websiteUrl("https://www.acme.io/pricing")
                .context(DecisionContext.builder()
                        .primaryKpi(ContextField.builder().value("mrr_growth").build())
                        .market(MarketContext.builder().segment("smb").build())
                        .build())
                .verdict(Verdict.builder().headline("Raise Pro by 15%").confidenceScore(0.72).build())
                .build()).get();
        String id = created.getId();

        Decision edited = decisionService.updateContext(id, user, UpdateContextRequest.builder()
                .context(created.getContext().toBuilder()
                        .market(MarketContext.builder().segment("mid_market").build()).build())
                .reason("segment corrected")
                .build()).get();
        assertThat(edited.getContextVersion()).isEqualTo(2);
        assertThat(edited.getContextVersions()).hasSize(2);

        assertThat(decisionService.updateStatus(id, user, StatusUpdateRequest.builder().status("implemented").build())
                .get().getStatus()).isEqualTo(DecisionStatus.IMPLEMENTED);

        Result<ScenarioSet> noGenerator = scenarioService.generateScenarios(id, user, true);
        assertThat(noGenerator.getErrorCode()).isEqualTo("ERR-AI-001");

        ScenarioSet set = scenarioService.createScenarioSet(id, user, List.of(
                scenario(ScenarioKey.AGGRESSIVE, "+15-25%", "high", "14-30 days"),
                scenario(ScenarioKey.BALANCED, "+8-15%", "medium", "30-60 days"),
                scenario(ScenarioKey.CONSERVATIVE, "+3-6%", "low", "60-90 days"),
                scenario(ScenarioKey.DO_NOTHING, "Stagnates", "low", "N/A")), null).get();
        assertThat(set.getVersion()).isEqualTo(1);

        DeltaView delta = scenarioDeltaService.getDelta(id, user, null, "aggressive").get();
        assertThat(delta.getBaselineScenarioId()).isEqualTo("balanced");
        assertThat(delta.getDeltas().getRiskDelta()).isEqualTo(LevelDelta.UP);

        ApplyScenarioResult applied = outcomeService.applyScenario(id, user, "balanced").get();
        assertThat(applied.getEpisodeStatus()).isEqualTo(EpisodeStatus.PATH_CHOSEN);
        assertThat(applied.getOutcome().getHorizonDays()).isEqualTo(45);

        MeasurableOutcome measured = outcomeService.updateKpiActual(id, user, "Revenue", 11d).get();
        assertThat(measured.getKpis().get(0).getActual()).isEqualTo(11d);

        DecisionOutcome first = outcomeService.addOutcome(id, user, AddOutcomeRequest.builder()
                .outcomeType("revenue").timeframeDays(30).metricName("MRR").metricBefore(100d).metricAfter(112.5)
                .build()).get();
        outcomeService.addOutcome(id, user, AddOutcomeRequest.builder()
                .outcomeType("revenue").timeframeDays(30).metricName("MRR").metricBefore(100d).metricAfter(108d)
                .correction(true).correctsOutcomeId(first.getId()).correctionReason("double counted upgrades")
                .build());

        Decision after = decisionService.getDecision(id, user).get();
        assertThat(after.getEpisodeStatus()).isEqualTo(EpisodeStatus.OUTCOME_SAVED);
        assertThat(after.getOutcomes()).hasSize(2);
        assertThat(outcomeService.getEffectiveOutcome(id, user).get().getDeltaPercent()).isCloseTo(8d, within(1e-9));
        assertThat(decisionService.listDecisions(user, null).get().getItems())
                .singleElement().satisfies(i -> assertThat(i.getOutcomeSummary()).isEqualTo("+8.0% (30d)"));

        assertThat(outcomeService.listByUser(user, 10, 0).get()).hasSize(1);
        assertThat(decisionService.deleteDecision(id, user).isOk()).isTrue();
        assertThat(decisionService.getDecision(id, user).getErrorCode()).isEqualTo("ERR-DB-001");
        assertThat(outcomeService.listByUser(user, 10, 0).get()).isEmpty();
        assertThat(outcomeService.updateStatus(measured.getId(), user, "achieved").getErrorCode()).isEqualTo("ERR-DB-001");
        assertThat(adminService.getIncludingDeleted(id, user).get().isDeleted()).isTrue();

        assertThat(children(id)).containsExactly(1L, 1L, 1L);
        assertThat(adminService.purgeDecision(id, user).isOk()).isTrue();
        assertThat(adminService.getIncludingDeleted(id, user).getErrorCode()).isEqualTo("ERR-DB-001");
        assertThat(children(id)).containsExactly(0L, 0L, 0L);
    }

    /**
     * Scenario sets, measurable outcomes and cached deltas stored for a decision.
     */
    private List<Long> children(String decisionId) {
        return List.of(
                mongoTemplate.count(Query.query(Criteria.where("decisionId").is(decisionId)), ScenarioSet.class),
                mongoTemplate.count(Query.query(Criteria.where("verdictId").is(decisionId)), MeasurableOutcome.class),
                mongoTemplate.count(Query.query(Criteria.where("verdictId").is(decisionId)), ScenarioDelta.class));
    }
}
