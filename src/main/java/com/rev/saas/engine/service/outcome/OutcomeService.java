package com.rev.saas.engine.service.outcome;

import com.rev.saas.engine.common.RequestValidator;
import com.rev.saas.engine.common.Result;
import com.rev.saas.engine.common.ServiceCalls;
import com.rev.saas.engine.common.exception.ConflictException;
import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.config.DecisionEngineConfig;
import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.enums.KpiKey;
import com.rev.saas.engine.enums.OutcomeStatus;
import com.rev.saas.engine.enums.OutcomeType;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.DecisionOutcome;
import com.rev.saas.engine.model.OutcomeKpi;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.documents.MeasurableOutcome;
import com.rev.saas.engine.model.documents.ScenarioSet;
import com.rev.saas.engine.model.dto.AddOutcomeRequest;
import com.rev.saas.engine.model.dto.ApplyScenarioResult;
import com.rev.saas.engine.model.dto.UpdateOutcomeRequest;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import com.rev.saas.engine.repo.documents.MeasurableOutcomeRepo;
import com.rev.saas.engine.service.decision.DecisionAccess;
import com.rev.saas.engine.service.scenario.MetricRanges;
import com.rev.saas.engine.service.scenario.ScenarioService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Real-world outcomes of decisions, in both shapes the product uses:
 * <ul>
 *   <li>append-only {@link DecisionOutcome} records embedded in the decision, where corrections supersede
 *   earlier records without removing them;</li>
 *   <li>one {@link MeasurableOutcome} per (verdict, user) tracking KPIs for the applied scenario, updated in
 *   place.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeService {

    private static final int MAX_LIST_LIMIT = 100;

    private final DecisionAccess decisionAccess;
    private final DecisionRepo decisionRepo;
    private final MeasurableOutcomeRepo measurableOutcomeRepo;
    private final ScenarioService scenarioService;
    private final RequestValidator requestValidator;
    private final DecisionEngineConfig config;

    // ---------- embedded outcome history ----------

    public Result<DecisionOutcome> addOutcome(String decisionId, String userId, AddOutcomeRequest request) {
        return ServiceCalls.capture("outcome.add", () -> {
            requestValidator.validate(request, "outcome");
            OutcomeType type = OutcomeType.fromValue(request.getOutcomeType())
                    .orElseThrow(() -> new ValidationException("invalid outcomeType: " + request.getOutcomeType()));

            String correctsId = null;
            if (request.isCorrection()) {
                correctsId = request.getCorrectsOutcomeId();
                if (correctsId == null || correctsId.isBlank()) {
                    throw new ValidationException("correctsOutcomeId is required for a correction");
                }
            }

            Decision decision = decisionAccess.requireOwned(decisionId, userId);
            if (correctsId != null) {
                String target = correctsId;
                boolean known = decision.getOutcomes() != null
                        && decision.getOutcomes().stream().anyMatch(o -> target.equals(o.getId()));
                if (!known) throw new EntityNotFoundException("Outcome", target);
            }

            Instant now = Instant.now();
            DecisionOutcome outcome = DecisionOutcome.builder()
                    .id(new ObjectId().toHexString())
                    .outcomeType(type)
                    .timeframeDays(request.getTimeframeDays())
                    .metricName(request.getMetricName().trim())
                    .metricBefore(request.getMetricBefore())
                    .metricAfter(request.getMetricAfter())
                    .deltaPercent(OutcomeResolver.computeDeltaPercent(request.getMetricBefore(), request.getMetricAfter()))
                    .notes(request.getNotes())
                    .evidenceUrl(request.getEvidenceUrl())
                    .correction(correctsId != null)
                    .correctsOutcomeId(correctsId)
                    .correctionReason(correctsId != null ? request.getCorrectionReason() : null)
                    .createdBy(userId)
                    .createdAt(now)
                    .build();

            decisionRepo.pushOutcome(decisionId, userId, outcome, now)
                    .orElseThrow(() -> new EntityNotFoundException(DecisionAccess.ENTITY, decisionId));
            log.info("Recorded {} outcome {} on decision {}{}", type.getValue(), outcome.getId(), decisionId,
                    outcome.isCorrection() ? " (corrects " + correctsId + ")" : "");
            return outcome;
        });
    }

    /**
     * The outcome to treat as current; the result carries no data when nothing has been recorded.
     */
    public Result<DecisionOutcome> getEffectiveOutcome(String decisionId, String userId) {
        return ServiceCalls.capture("outcome.effective", () -> {
            Decision decision = decisionAccess.requireOwned(decisionId, userId);
            return OutcomeResolver.effectiveOutcome(decision.getOutcomes()).orElse(null);
        });
    }

    public Result<List<DecisionOutcome>> getEffectiveOutcomes(String decisionId, String userId) {
        return ServiceCalls.capture("outcome.effectiveAll", () -> {
            Decision decision = decisionAccess.requireOwned(decisionId, userId);
            return OutcomeResolver.effectiveOutcomes(decision.getOutcomes());
        });
    }

    // ---------- measurable outcome (one per verdict) ----------

    /**
     * Chooses a scenario and (re)creates the measurable outcome for it with prefilled KPIs.
     * Applying twice leaves one outcome row, updated to the latest choice.
     */
    public Result<ApplyScenarioResult> applyScenario(String decisionId, String userId, String scenarioId) {
        return ServiceCalls.capture("outcome.applyScenario", () -> {
            ScenarioKey key = ScenarioKey.fromValue(scenarioId)
                    .orElseThrow(() -> new ValidationException("invalid scenario id: " + scenarioId));
            Decision decision = decisionAccess.requireOwned(decisionId, userId);
            ScenarioSet current = scenarioService.requireCurrent(decisionId, userId);
            ScenarioItem chosen = current.find(key)
                    .orElseThrow(() -> new EntityNotFoundException("Scenario", key.getValue()));

            Decision updated = scenarioService.chooseScenario(decisionId, userId, key);

            List<OutcomeKpi> kpis = KpiPrefill.fromScenario(decision, chosen);
            int horizon = MetricRanges.horizonDays(
                    chosen.getMetrics() == null ? null : chosen.getMetrics().getTimeToImpact(),
                    config.getDefaultHorizonDays());
            MeasurableOutcome outcome = upsert(userId, decisionId, key.getValue(), kpis, horizon);

            decisionRepo.linkOutcome(decisionId, userId, outcome.getId(), Instant.now())
                    .orElseThrow(() -> new EntityNotFoundException(DecisionAccess.ENTITY, decisionId));
            log.info("Applied scenario {} to decision {} (outcome {})", key.getValue(), decisionId, outcome.getId());

            return ApplyScenarioResult.builder()
                    .verdictId(decisionId)
                    .chosenScenarioId(key.getValue())
                    .episodeStatus(updated.getEpisodeStatus())
                    .outcome(outcome)
                    .build();
        });
    }

    public Result<MeasurableOutcome> getOutcome(String decisionId, String userId) {
        return ServiceCalls.capture("outcome.get", () -> {
            decisionAccess.requireOwned(decisionId, userId);
            return requireForVerdict(decisionId, userId);
        });
    }

    /**
     * Partial update. KPI deltas are recomputed from baseline and actual; the decision's episode becomes
     * {@code outcome_saved} once the outcome is complete.
     */
    public Result<MeasurableOutcome> updateOutcome(String decisionId, String userId, UpdateOutcomeRequest request) {
        return ServiceCalls.capture("outcome.update", () -> {
            if (request == null) throw new ValidationException("outcome update is required");
            decisionAccess.requireOwned(decisionId, userId);
            MeasurableOutcome existing = requireForVerdict(decisionId, userId);

            Map<String, Object> sets = new HashMap<>();
            if (request.getStatus() != null) {
                sets.put("status", parseStatus(request.getStatus()));
            }
            if (request.getKpis() != null) {
                sets.put("kpis", recomputeKpis(request.getKpis()));
            }
            if (request.getEvidenceLinks() != null) sets.put("evidenceLinks", request.getEvidenceLinks());
            if (request.getSummary() != null) sets.put("summary", request.getSummary());
            if (request.getNotes() != null) sets.put("notes", request.getNotes());

            Instant now = Instant.now();
            MeasurableOutcome updated = measurableOutcomeRepo.patch(existing.getId(), userId, sets, now)
                    .orElseThrow(() -> new EntityNotFoundException("Outcome", existing.getId()));
            markSavedIfComplete(decisionId, userId, updated, now);
            return updated;
        });
    }

    public Result<MeasurableOutcome> updateStatus(String outcomeId, String userId, String status) {
        return ServiceCalls.capture("outcome.updateStatus", () -> {
            DecisionAccess.requireUser(userId);
            OutcomeStatus parsed = parseStatus(status);
            MeasurableOutcome existing = requireOwnedOutcome(outcomeId, userId);
            decisionAccess.requireActive(existing.getVerdictId(), userId);
            Instant now = Instant.now();
            MeasurableOutcome updated = measurableOutcomeRepo.updateStatus(outcomeId, userId, parsed, now)
                    .orElseThrow(() -> new EntityNotFoundException("Outcome", outcomeId));
            markSavedIfComplete(updated.getVerdictId(), userId, updated, now);
            return updated;
        });
    }

    /**
     * Sets one KPI's actual and recomputes its deltas; other KPIs are untouched. The write only lands while the
     * KPI's baseline is the one the deltas were computed from.
     */
    public Result<MeasurableOutcome> updateKpiActual(String decisionId, String userId, String kpiKey, Double actual) {
        return ServiceCalls.capture("outcome.updateKpiActual", () -> {
            KpiKey key = KpiKey.fromValue(kpiKey)
                    .orElseThrow(() -> new ValidationException("invalid kpi key: " + kpiKey));
            decisionAccess.requireOwned(decisionId, userId);

            int maxAttempts = Math.max(1, config.getVersionAppendMaxAttempts());
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                MeasurableOutcome current = requireForVerdict(decisionId, userId);
                OutcomeKpi kpi = current.getKpis().stream()
                        .filter(k -> k.getKey() == key)
                        .findFirst()
                        .orElseThrow(() -> new EntityNotFoundException("KPI", key.getValue()));

                OutcomeKpi next = OutcomeResolver.withDeltas(kpi.toBuilder().actual(actual).build());
                Instant now = Instant.now();
                Optional<MeasurableOutcome> updated = measurableOutcomeRepo.setKpiActual(current.getId(), userId, key,
                        kpi.getBaseline(), actual, next.getDelta(), next.getDeltaPct(), now);
                if (updated.isPresent()) {
                    markSavedIfComplete(decisionId, userId, updated.get(), now);
                    return updated.get();
                }
                log.debug("KPI {} of decision {} changed underneath (attempt {}/{})", key.getValue(), decisionId,
                        attempt, maxAttempts);
            }
            throw new ConflictException("Concurrent KPI updates on decision " + decisionId);
        });
    }

    /**
     * Owner-scoped hard delete while the decision is live; the decision's link to the outcome is cleared.
     */
    public Result<Void> delete(String outcomeId, String userId) {
        return ServiceCalls.run("outcome.delete", () -> {
            DecisionAccess.requireUser(userId);
            MeasurableOutcome existing = requireOwnedOutcome(outcomeId, userId);
            decisionAccess.requireActive(existing.getVerdictId(), userId);
            if (measurableOutcomeRepo.deleteByIdAndUserId(outcomeId, userId) == 0) {
                throw new EntityNotFoundException("Outcome", outcomeId);
            }
            decisionRepo.linkOutcome(existing.getVerdictId(), userId, null, Instant.now());
            log.info("Deleted outcome {} of decision {}", outcomeId, existing.getVerdictId());
        });
    }

    public Result<List<MeasurableOutcome>> listByUser(String userId, int limit, int offset) {
        return ServiceCalls.capture("outcome.list", () -> {
            DecisionAccess.requireUser(userId);
            int lim = limit <= 0 ? config.getDefaultPageSize() : Math.min(limit, MAX_LIST_LIMIT);
            return measurableOutcomeRepo.listByUser(userId, decisionAccess.deletedIds(userId), lim, Math.max(0, offset));
        });
    }

    private MeasurableOutcome upsert(String userId, String decisionId, String scenarioId, List<OutcomeKpi> kpis,
                                     int horizonDays) {
        try {
            return measurableOutcomeRepo.upsertForVerdict(userId, decisionId, scenarioId, kpis, horizonDays, Instant.now());
        } catch (DuplicateKeyException race) {
            // a concurrent first apply inserted the row; this one becomes an update
            log.debug("Outcome upsert for decision {} raced, retrying as update", decisionId);
            try {
                return measurableOutcomeRepo.upsertForVerdict(userId, decisionId, scenarioId, kpis, horizonDays, Instant.now());
            } catch (DuplicateKeyException again) {
                throw new ConflictException("Concurrent scenario applies on decision " + decisionId, again);
            }
        }
    }

    private MeasurableOutcome requireOwnedOutcome(String outcomeId, String userId) {
        return measurableOutcomeRepo.findByIdAndUserId(outcomeId, userId)
                .orElseThrow(() -> new EntityNotFoundException("Outcome", outcomeId));
    }

    private MeasurableOutcome requireForVerdict(String decisionId, String userId) {
        return measurableOutcomeRepo.findByVerdictIdAndUserId(decisionId, userId)
                .orElseThrow(() -> new EntityNotFoundException("Outcome not found for decision " + decisionId
                        + "; apply a scenario first"));
    }

    private void markSavedIfComplete(String decisionId, String userId, MeasurableOutcome outcome, Instant now) {
        if (OutcomeResolver.isComplete(outcome)) {
            decisionRepo.updateEpisodeStatus(decisionId, userId, EpisodeStatus.OUTCOME_SAVED, now);
        }
    }

    private static List<OutcomeKpi> recomputeKpis(List<OutcomeKpi> kpis) {
        List<OutcomeKpi> out = new ArrayList<>(kpis.size());
        for (OutcomeKpi k : kpis) {
            if (k == null || k.getKey() == null) throw new ValidationException("every KPI needs a key");
            out.add(OutcomeResolver.withDeltas(k));
        }
        return out;
    }

    private static OutcomeStatus parseStatus(String raw) {
        return OutcomeStatus.fromValue(raw)
                .orElseThrow(() -> new ValidationException("invalid outcome status: " + raw));
    }
}
