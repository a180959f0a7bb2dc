package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum OutcomeStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    ACHIEVED("achieved"),
    MISSED("missed");

    private final String value;

    OutcomeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isFinal() {
        return this == ACHIEVED || this == MISSED;
    }

    public static Optional<OutcomeStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values()).filter(s -> s.value.equals(v)).findFirst();
    }
}
