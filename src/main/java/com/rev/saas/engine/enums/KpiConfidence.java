package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum KpiConfidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    KpiConfidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
