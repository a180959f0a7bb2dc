package com.rev.saas.engine.model.documents;

import com.rev.saas.engine.common.constants.DecisionConsts;
import com.rev.saas.engine.enums.OutcomeStatus;
import com.rev.saas.engine.model.EvidenceLink;
import com.rev.saas.engine.model.OutcomeKpi;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * KPI tracking for the path a user chose on a verdict. One per (userId, verdictId); applying another
 * scenario updates it in place.
 */
@Document(DecisionConsts.COLLECTION_MEASURABLE_OUTCOMES)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurableOutcome {
    @Id
    private String id;

    private String userId;
    private String verdictId; // decision id
    private String chosenScenarioId;

    private OutcomeStatus status;
    private int horizonDays;
    @Builder.Default
    private List<OutcomeKpi> kpis = new ArrayList<>();
    @Builder.Default
    private List<EvidenceLink> evidenceLinks = new ArrayList<>();
    private String summary;
    private String notes;

    private Instant createdAt;
    private Instant updatedAt;
}
