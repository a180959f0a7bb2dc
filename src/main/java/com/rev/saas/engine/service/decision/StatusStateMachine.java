package com.rev.saas.engine.service.decision;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.common.exception.ValidationException;
import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.model.StatusEvent;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.dto.StatusUpdateRequest;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Validates and records lifecycle transitions.
 * <p>
 * Any status may follow any other. The only hard rules are a known target status and a non-blank reason for
 * {@code rejected} and {@code rolled_back}. The status field, its side effects and the audit event are written
 * in one atomic update.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusStateMachine {

    private final DecisionRepo decisionRepo;

    public Decision transition(String decisionId, String userId, StatusUpdateRequest request) {
        DecisionAccess.requireIds(decisionId, userId);
        DecisionStatus target = parseStatus(request.getStatus());
        String reason = trimToNull(request.getReason());
        if (target.requiresReason() && reason == null) {
            throw new ValidationException("reason is required when status is " + target.getValue());
        }

        Instant now = Instant.now();
        Map<String, Object> sideEffects = sideEffects(target, reason, request, now);
        StatusEvent event = StatusEvent.builder()
                .id(new ObjectId().toHexString())
                .status(target)
                .reason(reason)
                .implementedAt((Instant) sideEffects.get("implementedAt"))
                .rollbackAt((Instant) sideEffects.get("rollbackAt"))
                .createdBy(userId)
                .createdAt(now)
                .build();

        Decision updated = decisionRepo.pushStatusEvent(decisionId, userId, event, sideEffects, now)
                .orElseThrow(() -> new EntityNotFoundException(DecisionAccess.ENTITY, decisionId));
        log.info("Decision {} -> {}", decisionId, target.getValue());
        return updated;
    }

    public static DecisionStatus parseStatus(String raw) {
        return DecisionStatus.fromValue(raw)
                .orElseThrow(() -> new ValidationException("invalid status: " + raw));
    }

    /**
     * Top-level fields the target status sets besides {@code status} itself.
     */
    static Map<String, Object> sideEffects(DecisionStatus target, String reason, StatusUpdateRequest request,
                                           Instant now) {
        Map<String, Object> sets = new HashMap<>();
        switch (target) {
            case IMPLEMENTED:
                sets.put("implementedAt", request.getImplementedAt() != null ? request.getImplementedAt() : now);
                break;
            case REJECTED:
                sets.put("rejectionReason", reason);
                break;
            case ROLLED_BACK:
                sets.put("rollbackAt", request.getRollbackAt() != null ? request.getRollbackAt() : now);
                sets.put("rollbackReason", reason);
                break;
            default:
                break;
        }
        return sets;
    }

    public static StatusEvent initialEvent(String actor, Instant now) {
        return StatusEvent.builder()
                .id(new ObjectId().toHexString())
                .status(DecisionStatus.PROPOSED)
                .reason(DecisionConsts.INITIAL_STATUS_REASON)
                .createdBy(actor)
                .createdAt(now)
                .build();
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
