package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle status of a pricing decision.
 * Main path: proposed -> in_review -> approved -> implemented; side branches to rejected and rolled_back.
 */
public enum DecisionStatus {
    PROPOSED("proposed"),
    IN_REVIEW("in_review"),
    APPROVED("approved"),
    REJECTED("rejected"),
    IMPLEMENTED("implemented"),
    ROLLED_BACK("rolled_back");

    private final String value;

    DecisionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Target statuses that cannot be recorded without a reason.
     */
    public boolean requiresReason() {
        return this == REJECTED || this == ROLLED_BACK;
    }

    public static Optional<DecisionStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values()).filter(s -> s.value.equals(v)).findFirst();
    }
}
