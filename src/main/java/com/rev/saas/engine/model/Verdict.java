package com.rev.saas.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recommendation attached to a decision. Produced externally and stored as-is; versioned on every regeneration.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Verdict {
    private String headline;
    private String summary;
    private Double confidenceScore; // 0..1
    private String confidenceLabel;
    private String cta;
    private String whyThisDecision;
    private WhatToExpect whatToExpect;
    private SupportingDetails supportingDetails;

    public static String confidenceLabelFor(double score) {
        if (score >= 0.8) return "high";
        if (score >= 0.6) return "medium";
        return "low";
    }

    public static String riskLabelFor(double score) {
        if (score >= 0.7) return "high";
        if (score >= 0.4) return "medium";
        return "low";
    }
}
