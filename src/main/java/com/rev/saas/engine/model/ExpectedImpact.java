package com.rev.saas.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpectedImpact {
    private String revenueRange;
    private String churnNote;
    private String confidenceRationale;

    /**
     * Summary view of a verdict, refreshed whenever a new verdict version is appended.
     */
    public static ExpectedImpact from(Verdict verdict) {
        if (verdict == null) return new ExpectedImpact();
        SupportingDetails details = verdict.getSupportingDetails();
        return ExpectedImpact.builder()
                .revenueRange(details == null ? null : details.getExpectedRevenueImpact())
                .churnNote(details == null ? null : details.getChurnOutlook())
                .confidenceRationale(verdict.getWhyThisDecision())
                .build();
    }
}
