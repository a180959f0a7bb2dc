package com.rev.saas.engine.service.decision;

import com.rev.saas.engine.common.exception.ConflictException;
import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.config.DecisionEngineConfig;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.versioning.VersionEntry;
import com.rev.saas.engine.model.versioning.VersionedField;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Appends a new version of a decision's context or verdict.
 * <p>
 * Each attempt is a single compare-and-swap on the version counter: value, counter and history entry are
 * written together, or not at all. A lost race re-reads the decision and tries again with the fresh counter,
 * so concurrent appends serialize instead of overwriting one another.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VersionedRecordStore {

    private final DecisionRepo decisionRepo;
    private final DecisionEngineConfig config;

    public <T> Decision append(String decisionId, String userId, VersionedField<T> field, T newValue,
                               String actor, String reason) {
        return append(decisionId, userId, field, newValue, actor, reason, Map.of());
    }

    /**
     * @param extraSets additional top-level fields written in the same update (e.g. derived summaries)
     */
    public <T> Decision append(String decisionId, String userId, VersionedField<T> field, T newValue,
                               String actor, String reason, Map<String, Object> extraSets) {
        int maxAttempts = Math.max(1, config.getVersionAppendMaxAttempts());
        Decision current = reload(decisionId, userId);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int expected = field.currentVersion(current);
            Instant now = Instant.now();
            VersionEntry<T> entry = VersionEntry.next(expected, newValue, actor, reason, now);

            Optional<Decision> updated = decisionRepo.appendVersion(decisionId, userId, field, expected, entry,
                    extraSets, now);
            if (updated.isPresent()) {
                log.info("Appended {} v{} to decision {} (attempt {})", field, entry.getVersion(), decisionId, attempt);
                return updated.get();
            }
            log.debug("{} append on decision {} lost race at v{} (attempt {}/{})",
                    field, decisionId, expected, attempt, maxAttempts);
            current = reload(decisionId, userId);
        }
        throw new ConflictException(String.format(
                "Concurrent %s updates on decision %s; gave up after %d attempts", field, decisionId, maxAttempts));
    }

    private Decision reload(String decisionId, String userId) {
        return decisionRepo.findActive(decisionId, userId)
                .orElseThrow(() -> new EntityNotFoundException(DecisionAccess.ENTITY, decisionId));
    }
}
