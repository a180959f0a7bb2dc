package com.rev.saas.engine.repo.documents;

import com.rev.saas.engine.model.documents.ScenarioSet;

import java.time.Instant;
import java.util.Optional;

public interface ScenarioSetRepoCustom {

    /**
     * Highest non-deleted version for the pair.
     */
    Optional<ScenarioSet> findCurrent(String decisionId, String userId);

    /**
     * Highest version ever written for the pair, soft-deleted ones included; 0 when none.
     */
    int maxVersion(String decisionId, String userId);

    boolean softDelete(String id, String userId, Instant now);
}
