package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.model.documents.MeasurableOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplyScenarioResult {
    private String verdictId;
    private String chosenScenarioId;
    private EpisodeStatus episodeStatus;
    private MeasurableOutcome outcome;
}
