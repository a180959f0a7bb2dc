package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.model.DecisionContext;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateContextRequest {

    @NotNull(message = "context is required")
    private DecisionContext context;
    private String reason;
}
