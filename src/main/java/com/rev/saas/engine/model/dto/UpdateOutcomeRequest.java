package com.rev.saas.engine.model.dto;

import com.rev.saas.engine.model.EvidenceLink;
import com.rev.saas.engine.model.OutcomeKpi;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of a measurable outcome. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOutcomeRequest {
    private String status;
    private List<OutcomeKpi> kpis;
    private List<EvidenceLink> evidenceLinks;
    private String summary;
    private String notes;
}
