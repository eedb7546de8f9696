package com.evfinder.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * State of a match as reported by a result source.
 */
public enum ResultStatus {
    FINISHED("finished"),
    LIVE("live"),
    CANCELLED("cancelled");

    private final String key;

    ResultStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
