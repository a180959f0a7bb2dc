package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.model.DecisionOutcome;
import com.rev.saas.engine.model.StatusEvent;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.dto.DecisionListParams;
import com.rev.saas.engine.model.versioning.VersionEntry;
import com.rev.saas.engine.model.versioning.VersionedField;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Atomic single-document updates on decisions. Every method filters on owner and {@code isDeleted != true},
 * and returns the document after the update, or empty when nothing matched.
 */
public interface DecisionRepoCustom {

    /**
     * Compare-and-swap append: matches only when the counter still equals {@code expectedVersion}, then sets the
     * new value and counter and pushes the history entry in the same update.
     */
    <T> Optional<Decision> appendVersion(String id, String userId, VersionedField<T> field, int expectedVersion,
                                         VersionEntry<T> entry, Map<String, Object> extraSets, Instant now);

    Optional<Decision> pushStatusEvent(String id, String userId, StatusEvent event,
                                       Map<String, Object> sideEffects, Instant now);

    Optional<Decision> pushOutcome(String id, String userId, DecisionOutcome outcome, Instant now);

    Optional<Decision> setChosenScenario(String id, String userId, String scenarioId, Instant now);

    /**
     * Links the current scenario set; a draft episode becomes explored.
     */
    Optional<Decision> linkScenarioSet(String id, String userId, String scenarioSetId, Instant now);

    Optional<Decision> clearScenarioSet(String id, String userId, Instant now);

    Optional<Decision> linkOutcome(String id, String userId, String outcomeId, Instant now);

    Optional<Decision> updateEpisodeStatus(String id, String userId, EpisodeStatus status, Instant now);

    boolean softDelete(String id, String userId, Instant now);

    long softDeleteAllForUser(String userId, Instant now);

    Page<Decision> findPage(String userId, DecisionListParams params, Pageable pageable);
}
