package com.rev.saas.engine.model.versioning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One immutable entry of a versioned sub-document history.
 *
 * @param <T> the versioned value type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionEntry<T> {
    private int version;
    private T value;
    private String reason;
    private Instant createdAt;
    private String createdBy;

    /**
     * Entry that follows {@code currentVersion}. The counter always advances by exactly one.
     */
    public static <T> VersionEntry<T> next(int currentVersion, T value, String actor, String reason, Instant at) {
        return VersionEntry.<T>builder()
                .version(currentVersion + 1)
                .value(value)
                .reason(reason)
                .createdAt(at)
                .createdBy(actor)
                .build();
    }
}
