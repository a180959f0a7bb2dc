package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of measurable outcome kinds. Anything not covered is recorded as {@link #OTHER}.
 */
public enum OutcomeType {
    REVENUE("revenue"),
    CHURN("churn"),
    ACTIVATION("activation"),
    RETENTION("retention"),
    PRICING("pricing"),
    OTHER("other");

    private final String value;

    OutcomeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    // case sensitive, as stored by clients
    public static Optional<OutcomeType> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
