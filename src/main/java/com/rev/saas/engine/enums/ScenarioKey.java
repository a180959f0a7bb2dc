package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four alternative paths every scenario set contains.
 */
public enum ScenarioKey {
    AGGRESSIVE("aggressive"),
    BALANCED("balanced"),
    CONSERVATIVE("conservative"),
    DO_NOTHING("do_nothing");

    private final String value;

    ScenarioKey(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ScenarioKey> fromValue(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values()).filter(k -> k.value.equals(v)).findFirst();
    }
}
