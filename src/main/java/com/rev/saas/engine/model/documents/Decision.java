package com.rev.saas.engine.model.documents;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.enums.DecisionStatus;
import com.rev.saas.engine.enums.EpisodeStatus;
import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.DecisionOutcome;
import com.rev.saas.engine.model.ExpectedImpact;
import com.rev.saas.engine.model.ModelMeta;
import com.rev.saas.engine.model.StatusEvent;
import com.rev.saas.engine.model.Verdict;
import com.rev.saas.engine.model.versioning.VersionEntry;
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

/**
 * Root aggregate for one pricing decision.
 * Context and verdict keep their full history next to the current value; the history lists are append-only
 * and their size always equals the matching version counter.
 */
@Document(DecisionConsts.COLLECTION_DECISIONS)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Decision {
    @Id
    private String id;

    private String userId;
    private String companyName;
    private String websiteUrl;

    // Versioned context
    private DecisionContext context;
    private int contextVersion;
    @Builder.Default
    private List<VersionEntry<DecisionContext>> contextVersions = new ArrayList<>();

    // Versioned verdict
    private Verdict verdict;
    private int verdictVersion;
    @Builder.Default
    private List<VersionEntry<Verdict>> verdictVersions = new ArrayList<>();
    private ModelMeta modelMeta;
    private ExpectedImpact expectedImpact;

    // Lifecycle
    private DecisionStatus status;
    @Builder.Default
    private List<StatusEvent> statusEvents = new ArrayList<>();
    private Instant implementedAt;
    private String rejectionReason;
    private Instant rollbackAt;
    private String rollbackReason;

    // Outcomes (multi-outcome model, corrections included)
    @Builder.Default
    private List<DecisionOutcome> outcomes = new ArrayList<>();

    // Scenarios / episode
    private String scenariosId;
    private String chosenScenarioId;
    private Instant chosenScenarioAt;
    private String outcomeId;
    private EpisodeStatus episodeStatus;

    @Field(DecisionConsts.F_DELETED)
    private boolean deleted;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
