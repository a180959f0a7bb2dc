package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Direction of change between two low/medium/high labels.
 */
public enum LevelDelta {
    DOWN("down"),
    SAME("same"),
    UP("up");

    private static final Map<String, Integer> LEVEL_ORDER = Map.of("low", 1, "medium", 2, "high", 3);

    private final String value;

    LevelDelta(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unknown or blank labels rank below "low".
     */
    public static LevelDelta compare(String baseline, String candidate) {
        int base = rank(baseline);
        int cand = rank(candidate);
        if (cand > base) return UP;
        if (cand < base) return DOWN;
        return SAME;
    }

    private static int rank(String label) {
        if (label == null) return 0;
        return LEVEL_ORDER.getOrDefault(label.trim().toLowerCase(Locale.ROOT), 0);
    }
}
