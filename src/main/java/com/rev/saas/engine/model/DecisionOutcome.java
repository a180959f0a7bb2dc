package com.rev.saas.engine.model;

import com.rev.saas.engine.enums.OutcomeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Real-world measurement recorded against a decision. Appended only; a correction supersedes an earlier
 * record through {@code correctsOutcomeId} and both stay in the history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionOutcome {
    private String id;
    private OutcomeType outcomeType;
    private int timeframeDays;
    private String metricName;
    private Double metricBefore;
    private Double metricAfter;
    private Double deltaPercent;
    private String notes;
    private String evidenceUrl;
    @Field("isCorrection")
    private boolean correction;
    private String correctsOutcomeId;
    private String correctionReason;
    private String createdBy;
    private Instant createdAt;
}
