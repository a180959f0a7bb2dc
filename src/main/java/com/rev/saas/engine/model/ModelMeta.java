package com.rev.saas.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provenance of a generated verdict or scenario set. Opaque to the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMeta {
    private String modelName;
    private String promptVersion;
    private Long inferenceDurationMs;
    private String websiteContentHash;
}
