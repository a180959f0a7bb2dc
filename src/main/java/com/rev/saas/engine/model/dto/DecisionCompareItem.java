package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.DecisionOutcome;
import com.rev.saas.engine.model.ExpectedImpact;
import com.rev.saas.engine.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Side-by-side view of one decision. {@code latestOutcome} is the effective outcome, never a superseded one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionCompareItem {
    private String id;
    private String companyName;
    private String websiteUrl;
    private String verdictHeadline;
    private String verdictSummary;
    private Double confidenceScore;
    private String confidenceLabel;
    private Double riskScore;
    private String riskLabel;
    private DecisionStatus status;
    private DecisionContext context;
    private ExpectedImpact expectedImpact;
    private DecisionOutcome latestOutcome;
    private Verdict verdict;
    private Instant createdAt;
}
