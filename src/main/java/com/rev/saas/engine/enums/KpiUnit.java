package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum KpiUnit {
    PERCENT("%"),
    PERCENTAGE_POINTS("pp"),
    EUR("€"),
    USD("$"),
    COUNT("count"),
    DAYS("days"),
    MULTIPLIER("x");

    private final String symbol;

    KpiUnit(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }
}
