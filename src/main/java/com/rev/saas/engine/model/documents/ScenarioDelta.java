package com.rev.saas.engine.model.documents;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.model.DeltaValues;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Cached difference between two scenarios of a decision. Never refreshed on read; dropped when the
 * decision's scenarios are regenerated.
 */
@Document(DecisionConsts.COLLECTION_SCENARIO_DELTAS)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioDelta {
    @Id
    private String id;

    private String verdictId;
    private String baselineScenarioId;
    private String candidateScenarioId;

    private DeltaValues deltas;
    private Instant createdAt;
}
