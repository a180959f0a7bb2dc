package com.rev.saas.engine.model.documents;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.enums.ScenarioKey;
import com.rev.saas.engine.model.ModelMeta;
import com.rev.saas.engine.model.ScenarioItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Document(DecisionConsts.COLLECTION_SCENARIO_SETS)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioSet {
    @Id
    private String id;

    private String decisionId;
    private String userId;
    private int version;

    @Builder.Default
    private List<ScenarioItem> scenarios = new ArrayList<>();
    private ModelMeta modelMeta;

    @Field(DecisionConsts.F_DELETED)
    private boolean deleted;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public Optional<ScenarioItem> find(ScenarioKey key) {
        if (scenarios == null || key == null) return Optional.empty();
        return scenarios.stream().filter(s -> s.getScenarioId() == key).findFirst();
    }
}
