package com.rev.saas.engine.model;

import com.rev.saas.engine.enums.ContextSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One context attribute together with where it came from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextField {
    private String value;
    private ContextSource source;
    private Double confidenceScore; // only for inferred values
    private String inferredSignal;
}
