package com.rev.saas.engine.model;

import com.rev.saas.engine.enums.DecisionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit entry for one accepted status change. Never mutated once pushed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusEvent {
    private String id;
    private DecisionStatus status;
    private String reason;
    private Instant implementedAt;
    private Instant rollbackAt;
    private String createdBy;
    private Instant createdAt;
}
