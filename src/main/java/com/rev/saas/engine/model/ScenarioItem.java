package com.rev.saas.engine.model;

import com.rev.saas.engine.enums.ScenarioKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioItem {
    private ScenarioKey scenarioId;
    private String title;
    private String summary;
    private String positioning;
    private String bestWhen;
    private ScenarioMetrics metrics;
    private List<String> tradeoffs;
    private String comparedToRecommended;
    @Field("isBaseline")
    private boolean baseline;
}
