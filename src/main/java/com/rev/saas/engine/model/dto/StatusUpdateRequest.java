package com.rev.saas.engine.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Requested lifecycle transition. {@code implementedAt} / {@code rollbackAt} default to now when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {

    @NotBlank(message = "status is required")
    private String status;
    private String reason;
    private Instant implementedAt;
    private Instant rollbackAt;
}
