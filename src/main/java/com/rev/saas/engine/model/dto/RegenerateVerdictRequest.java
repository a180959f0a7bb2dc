package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.model.ModelMeta;
import com.rev.saas.engine.model.Verdict;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegenerateVerdictRequest {

    @NotNull(message = "verdict is required")
    private Verdict verdict;
    private String reason;
    private ModelMeta modelMeta;
}
