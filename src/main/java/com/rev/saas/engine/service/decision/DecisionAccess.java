package com.rev.saas.engine.service.decision;

import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owner-scoped decision lookups. Absent, soft-deleted and foreign decisions all surface as the same
 * {@link EntityNotFoundException}.
 */
@Component
@RequiredArgsConstructor
public class DecisionAccess {

    public static final String ENTITY = "Decision";

    private final DecisionRepo decisionRepo;

    @Retry(name = "decisionStoreReads")
    public Decision requireOwned(String decisionId, String userId) {
        requireIds(decisionId, userId);
        return decisionRepo.findActive(decisionId, userId)
                .orElseThrow(() -> new EntityNotFoundException(ENTITY, decisionId));
    }

    /**
     * Existence check for paths that hold a child record and only need the parent to still be live.
     */
    @Retry(name = "decisionStoreReads")
    public void requireActive(String decisionId, String userId) {
        requireIds(decisionId, userId);
        if (!decisionRepo.existsActive(decisionId, userId)) {
            throw new EntityNotFoundException(ENTITY, decisionId);
        }
    }

    /**
     * Ids of the owner's soft-deleted decisions.
     */
    @Retry(name = "decisionStoreReads")
    public Set<String> deletedIds(String userId) {
        requireUser(userId);
        return decisionRepo.findDeletedIds(userId).stream()
                .map(Decision::getId)
                .collect(Collectors.toSet());
    }

    /**
     * Administrative lookup that also returns soft-deleted decisions.
     */
    @Retry(name = "decisionStoreReads")
    public Decision requireOwnedIncludingDeleted(String decisionId, String userId) {
        requireIds(decisionId, userId);
        return decisionRepo.findByIdAndUserId(decisionId, userId)
                .orElseThrow(() -> new EntityNotFoundException(ENTITY, decisionId));
    }

    static void requireIds(String decisionId, String userId) {
        requireUser(userId);
        if (decisionId == null || decisionId.isBlank()) {
            throw new ValidationException("decisionId is required");
        }
    }

    public static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
    }
}
