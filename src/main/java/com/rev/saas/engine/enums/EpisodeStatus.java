package com.rev.saas.engine.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress of a decision through explore / choose / measure, shown in history views.
 */
public enum EpisodeStatus {
    DRAFT("draft"),
    EXPLORED("explored"),
    PATH_CHOSEN("path_chosen"),
    OUTCOME_SAVED("outcome_saved");

    private final String value;

    EpisodeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
