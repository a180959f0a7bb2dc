package com.rev.saas.engine.service.decision;

import com.rev.saas.engine.common.Result;
import com.rev.saas.engine.common.ServiceCalls;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import com.rev.saas.engine.repo.documents.MeasurableOutcomeRepo;
import com.rev.saas.engine.repo.documents.ScenarioDeltaRepo;
import com.rev.saas.engine.repo.documents.ScenarioSetRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Administrative paths that bypass the soft-delete filter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionAdminService {

    private final DecisionAccess decisionAccess;
    private final DecisionRepo decisionRepo;
    private final MeasurableOutcomeRepo measurableOutcomeRepo;
    private final ScenarioSetRepo scenarioSetRepo;
    private final ScenarioDeltaRepo scenarioDeltaRepo;

    public Result<Decision> getIncludingDeleted(String decisionId, String userId) {
        return ServiceCalls.capture("admin.getIncludingDeleted",
                () -> decisionAccess.requireOwnedIncludingDeleted(decisionId, userId));
    }

    /**
     * Hard delete of a decision and everything hanging off it: measurable outcome, scenario sets and cached
     * deltas. Children are removed before the decision itself.
     */
    public Result<Void> purgeDecision(String decisionId, String userId) {
        return ServiceCalls.run("admin.purge", () -> {
            Decision decision = decisionAccess.requireOwnedIncludingDeleted(decisionId, userId);
            long deltas = scenarioDeltaRepo.deleteByVerdictId(decisionId);
            long sets = scenarioSetRepo.deleteByDecisionId(decisionId);
            long outcomes = measurableOutcomeRepo.deleteByVerdictId(decisionId);
            decisionRepo.delete(decision);
            log.info("Purged decision {} ({} scenario sets, {} outcomes, {} cached deltas)",
                    decisionId, sets, outcomes, deltas);
        });
    }
}
