package com.rev.saas.engine.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddOutcomeRequest {

    @NotBlank(message = "outcomeType is required")
    private String outcomeType;
    @NotNull(message = "timeframeDays is required")
    @Positive(message = "timeframeDays must be greater than 0")
    private Integer timeframeDays;
    @NotBlank(message = "metricName is required")
    private String metricName;

    private Double metricBefore;
    private Double metricAfter;
    private String notes;
    private String evidenceUrl;

    private boolean correction;
    private String correctsOutcomeId;
    private String correctionReason;
}
