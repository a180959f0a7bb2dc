package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.ModelMeta;
import com.rev.saas.engine.model.Verdict;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDecisionRequest {

    @NotBlank(message = "websiteUrl is required")
    private String websiteUrl;
    private String companyName; // derived from the host when blank

    @NotNull(message = "context is required")
    private DecisionContext context;
    @NotNull(message = "verdict is required")
    private Verdict verdict;
    private ModelMeta modelMeta;
}
