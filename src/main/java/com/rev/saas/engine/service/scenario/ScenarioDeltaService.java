package com.rev.saas.engine.service.scenario;

import com.rev.saas.engine.common.Result;
import com.rev.saas.engine.common.ServiceCalls;
import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.DeltaValues;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.documents.ScenarioDelta;
import com.rev.saas.engine.model.documents.ScenarioSet;
import com.rev.saas.engine.model.dto.BaselineRef;
import com.rev.saas.engine.model.dto.DeltaView;
import com.rev.saas.engine.repo.documents.ScenarioDeltaRepo;
import com.rev.saas.engine.repo.documents.ScenarioSetRepo;
import com.rev.saas.engine.service.decision.DecisionAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Memoized scenario deltas keyed by (verdict, baseline, candidate).
 * A cached row is returned unchanged until {@link #invalidateForDecision(String)} drops it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioDeltaService {

    private final DecisionAccess decisionAccess;
    private final ScenarioSetRepo scenarioSetRepo;
    private final ScenarioDeltaRepo scenarioDeltaRepo;
    private final ScenarioDeltaCalculator calculator;

    /**
     * @param baselineId optional; the decision's baseline (chosen scenario, else balanced) is used when blank
     */
    public Result<DeltaView> getDelta(String decisionId, String userId, String baselineId, String candidateId) {
        return ServiceCalls.capture("scenarioDelta.get", () -> getOrCompute(decisionId, userId, baselineId, candidateId));
    }

    public Result<Long> invalidate(String decisionId, String userId) {
        return ServiceCalls.capture("scenarioDelta.invalidate", () -> {
            decisionAccess.requireOwned(decisionId, userId);
            return invalidateForDecision(decisionId);
        });
    }

    DeltaView getOrCompute(String decisionId, String userId, String baselineId, String candidateId) {
        Decision decision = decisionAccess.requireOwned(decisionId, userId);
        ScenarioKey candidate = requireKey(candidateId, "candidate");

        ScenarioSet current = null;
        BaselineRef baseline;
        if (baselineId == null || baselineId.isBlank()) {
            current = scenarioSetRepo.findCurrent(decisionId, userId).orElse(null);
            baseline = BaselineResolver.resolve(decision, current);
        } else {
            baseline = new BaselineRef(baselineId.trim(), null);
        }
        ScenarioKey base = requireKey(baseline.getScenarioId(), "baseline");

        Optional<ScenarioDelta> cached = scenarioDeltaRepo.findByVerdictIdAndBaselineScenarioIdAndCandidateScenarioId(
                decisionId, base.getValue(), candidate.getValue());
        if (cached.isPresent()) {
            log.debug("Delta cache hit {} {}->{}", decisionId, base.getValue(), candidate.getValue());
            return view(baseline, candidate, cached.get().getDeltas());
        }

        if (current == null) {
            current = scenarioSetRepo.findCurrent(decisionId, userId)
                    .orElseThrow(() -> new EntityNotFoundException("No scenarios found for decision " + decisionId));
        }
        ScenarioItem baseItem = requireScenario(current, base);
        ScenarioItem candItem = requireScenario(current, candidate);
        DeltaValues computed = calculator.compute(baseItem, candItem);

        return view(baseline, candidate, store(decisionId, base, candidate, computed));
    }

    /**
     * Drops every cached delta of the decision. Must run whenever its scenario set changes.
     */
    public long invalidateForDecision(String decisionId) {
        long removed = scenarioDeltaRepo.deleteByVerdictId(decisionId);
        if (removed > 0) {
            log.info("Invalidated {} cached deltas for decision {}", removed, decisionId);
        }
        return removed;
    }

    // Cache population is best effort: a failed write still hands back the computed value.
    private DeltaValues store(String decisionId, ScenarioKey base, ScenarioKey candidate, DeltaValues computed) {
        ScenarioDelta row = ScenarioDelta.builder()
                .verdictId(decisionId)
                .baselineScenarioId(base.getValue())
                .candidateScenarioId(candidate.getValue())
                .deltas(computed)
                .createdAt(Instant.now())
                .build();
        try {
            ScenarioDelta stored = scenarioDeltaRepo.insertIfAbsent(row);
            return stored == null || stored.getDeltas() == null ? computed : stored.getDeltas();
        } catch (DataAccessException e) {
            log.warn("Delta cache write failed for {} {}->{}: {}",
                    decisionId, base.getValue(), candidate.getValue(), e.getMessage());
            return computed;
        }
    }

    private static DeltaView view(BaselineRef baseline, ScenarioKey candidate, DeltaValues deltas) {
        return DeltaView.builder()
                .baselineScenarioId(baseline.getScenarioId())
                .baselineName(baseline.getName())
                .candidateScenarioId(candidate.getValue())
                .deltas(deltas)
                .build();
    }

    private static ScenarioKey requireKey(String raw, String role) {
        return ScenarioKey.fromValue(raw)
                .orElseThrow(() -> new ValidationException("invalid " + role + " scenario id: " + raw));
    }

    private static ScenarioItem requireScenario(ScenarioSet set, ScenarioKey key) {
        return set.find(key).orElseThrow(() -> new EntityNotFoundException("Scenario", key.getValue()));
    }
}
