package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContextSource {
    USER("user"),
    WORKSPACE("workspace"),
    INFERRED("inferred");

    private final String value;

    ContextSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
