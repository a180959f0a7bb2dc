package com.rev.saas.engine.service.scenario;

import com.rev.saas.engine.common.Result;
import com.rev.saas.engine.common.ServiceCalls;
import com.rev.saas.engine.common.exception.ConflictException;
import com.rev.saas.engine.common.exception.DependencyUnavailableException;
import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.config.DecisionEngineConfig;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.ModelMeta;
import com.rev.saas.engine.model.ScenarioItem;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.documents.ScenarioSet;
import com.rev.saas.engine.model.dto.BaselineRef;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import com.rev.saas.engine.repo.documents.ScenarioSetRepo;
import com.rev.saas.engine.service.decision.DecisionAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Versioned scenario sets per decision and the user's chosen scenario.
 * <p>
 * A new set always gets {@code max(version) + 1}, soft-deleted versions included, so versions are never reused.
 * The unique (decisionId, userId, version) index settles concurrent creates; the loser retries with the next
 * version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioService {

    private final DecisionAccess decisionAccess;
    private final DecisionRepo decisionRepo;
    private final ScenarioSetRepo scenarioSetRepo;
    private final ScenarioDeltaService scenarioDeltaService;
    private final ScenarioPayloadParser payloadParser;
    private final ObjectProvider<ScenarioGenerator> scenarioGenerator;
    private final DecisionEngineConfig config;

    public Result<ScenarioSet> createScenarioSet(String decisionId, String userId, List<ScenarioItem> scenarios,
                                                 ModelMeta modelMeta) {
        return ServiceCalls.capture("scenario.create", () -> {
            decisionAccess.requireOwned(decisionId, userId);
            return createSet(decisionId, userId, scenarios, modelMeta);
        });
    }

    /**
     * Returns the current set unless {@code force} is set or there is none; otherwise asks the configured
     * {@link ScenarioGenerator} for a new payload and stores it as the next version.
     */
    public Result<ScenarioSet> generateScenarios(String decisionId, String userId, boolean force) {
        return ServiceCalls.capture("scenario.generate", () -> {
            Decision decision = decisionAccess.requireOwned(decisionId, userId);
            if (!force) {
                Optional<ScenarioSet> current = scenarioSetRepo.findCurrent(decisionId, userId);
                if (current.isPresent()) {
                    log.debug("Reusing scenario set v{} for decision {}", current.get().getVersion(), decisionId);
                    return current.get();
                }
            }

            ScenarioGenerator generator = scenarioGenerator.getIfAvailable();
            if (generator == null) {
                throw new DependencyUnavailableException("ERR-AI-001", "No scenario generator configured", null);
            }
            ScenarioGenerator.GeneratedPayload payload = generator.generate(decision);
            if (payload == null) {
                throw new DependencyUnavailableException("ERR-AI-001", "Scenario generator returned no payload", null);
            }
            List<ScenarioItem> items = payloadParser.parse(payload.rawJson());
            return createSet(decisionId, userId, items, payload.modelMeta());
        });
    }

    public Result<ScenarioSet> getCurrent(String decisionId, String userId) {
        return ServiceCalls.capture("scenario.current", () -> {
            decisionAccess.requireOwned(decisionId, userId);
            return requireCurrent(decisionId, userId);
        });
    }

    /**
     * Marks one version deleted. Other versions keep their numbers; the decision's cached deltas are dropped
     * because its current set may have changed.
     */
    public Result<Void> softDelete(String scenarioSetId, String userId) {
        return ServiceCalls.run("scenario.softDelete", () -> {
            DecisionAccess.requireUser(userId);
            ScenarioSet set = scenarioSetRepo.findByIdAndUserId(scenarioSetId, userId)
                    .filter(s -> !s.isDeleted())
                    .orElseThrow(() -> new EntityNotFoundException("ScenarioSet", scenarioSetId));
            Instant now = Instant.now();
            if (!scenarioSetRepo.softDelete(scenarioSetId, userId, now)) {
                throw new EntityNotFoundException("ScenarioSet", scenarioSetId);
            }

            String decisionId = set.getDecisionId();
            scenarioDeltaService.invalidateForDecision(decisionId);
            Optional<ScenarioSet> current = scenarioSetRepo.findCurrent(decisionId, userId);
            if (current.isPresent()) {
                decisionRepo.linkScenarioSet(decisionId, userId, current.get().getId(), now);
            } else {
                decisionRepo.clearScenarioSet(decisionId, userId, now);
            }
            log.info("Soft-deleted scenario set {} (v{}) of decision {}", scenarioSetId, set.getVersion(), decisionId);
        });
    }

    /**
     * Records the user's chosen path. Re-choosing the same scenario only refreshes the timestamp.
     */
    public Result<Void> setChosenScenario(String decisionId, String userId, String scenarioId) {
        return ServiceCalls.run("scenario.choose", () -> {
            ScenarioKey key = requireKey(scenarioId);
            chooseScenario(decisionId, userId, key);
        });
    }

    public Result<BaselineRef> resolveBaseline(String decisionId, String userId) {
        return ServiceCalls.capture("scenario.baseline", () -> {
            Decision decision = decisionAccess.requireOwned(decisionId, userId);
            return BaselineResolver.resolve(decision, scenarioSetRepo.findCurrent(decisionId, userId).orElse(null));
        });
    }

    public Decision chooseScenario(String decisionId, String userId, ScenarioKey key) {
        DecisionAccess.requireUser(userId);
        Decision updated = decisionRepo.setChosenScenario(decisionId, userId, key.getValue(), Instant.now())
                .orElseThrow(() -> new EntityNotFoundException(DecisionAccess.ENTITY, decisionId));
        log.info("Decision {} chose scenario {}", decisionId, key.getValue());
        return updated;
    }

    public ScenarioSet requireCurrent(String decisionId, String userId) {
        return scenarioSetRepo.findCurrent(decisionId, userId)
                .orElseThrow(() -> new EntityNotFoundException("No scenarios found for decision " + decisionId));
    }

    ScenarioSet createSet(String decisionId, String userId, List<ScenarioItem> scenarios, ModelMeta modelMeta) {
        List<ScenarioItem> items = normalize(scenarios);
        int maxAttempts = Math.max(1, config.getScenarioInsertMaxAttempts());

        ScenarioSet saved = null;
        for (int attempt = 1; attempt <= maxAttempts && saved == null; attempt++) {
            Instant now = Instant.now();
            int version = scenarioSetRepo.maxVersion(decisionId, userId) + 1;
            ScenarioSet set = ScenarioSet.builder()
                    .decisionId(decisionId)
                    .userId(userId)
                    .version(version)
                    .scenarios(items)
                    .modelMeta(modelMeta)
                    .deleted(false)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            try {
                saved = scenarioSetRepo.insert(set);
            } catch (DuplicateKeyException e) {
                log.debug("Scenario set v{} for decision {} taken (attempt {}/{})", version, decisionId, attempt, maxAttempts);
            }
        }
        if (saved == null) {
            throw new ConflictException("Concurrent scenario generation for decision " + decisionId);
        }

        scenarioDeltaService.invalidateForDecision(decisionId);
        decisionRepo.linkScenarioSet(decisionId, userId, saved.getId(), saved.getCreatedAt())
                .orElseThrow(() -> new EntityNotFoundException(DecisionAccess.ENTITY, decisionId));
        log.info("Created scenario set v{} for decision {}", saved.getVersion(), decisionId);
        return saved;
    }

    private static List<ScenarioItem> normalize(List<ScenarioItem> scenarios) {
        if (scenarios == null || scenarios.isEmpty()) {
            throw new ValidationException("scenarios are required");
        }
        List<ScenarioItem> out = new ArrayList<>(scenarios.size());
        for (ScenarioItem item : scenarios) {
            if (item == null || item.getScenarioId() == null) {
                throw new ValidationException("every scenario needs a scenarioId");
            }
            item.setBaseline(item.getScenarioId() == ScenarioKey.BALANCED);
            out.add(item);
        }
        return out;
    }

    static ScenarioKey requireKey(String scenarioId) {
        return ScenarioKey.fromValue(scenarioId)
                .orElseThrow(() -> new ValidationException("invalid scenario id: " + scenarioId));
    }
}
