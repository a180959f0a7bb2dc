package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.enums.EpisodeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionListItem {
    private String id;
    private String companyName;
    private String websiteUrl;
    private String verdictHeadline;
    private Double confidenceScore;
    private String confidenceLabel;
    private DecisionStatus status;
    private String segment;
    private String primaryKpi;
    private String outcomeSummary; // "+12.5% (30d)", empty when nothing measured
    private boolean hasScenarios;
    private String chosenScenarioId;
    private EpisodeStatus episodeStatus;
    private Instant createdAt;
}
