package com.rev.saas.engine.model.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw shape of an externally generated scenario response (snake_case JSON).
 */
@Data
@NoArgsConstructor
public class ScenarioPayload {

    private List<Item> scenarios;

    @Data
    @NoArgsConstructor
    public static class Item {
        private String scenarioId;
        private String title;
        private String summary;
        private String positioning;
        private String bestWhen;
        private Metrics metrics;
        private List<String> tradeoffs;
        private String comparedToRecommended;
    }

    @Data
    @NoArgsConstructor
    public static class Metrics {
        private String revenueImpactRange;
        private String churnImpactRange;
        private String riskLabel;
        private String timeToImpact;
        private String executionEffort;
    }
}
