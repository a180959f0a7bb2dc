package com.rev.saas.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Scenario that deltas are measured against, with its display name.
 */
@Data
@AllArgsConstructor
public class BaselineRef {
    private String scenarioId;
    private String name;
}
