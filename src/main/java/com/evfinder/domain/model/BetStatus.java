package com.evfinder.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a bet. {@code PENDING} is the only non-terminal state.
 */
public enum BetStatus {
    PENDING("pending"),
    WON("won"),
    LOST("lost"),
    VOID("void");

    private final String key;

    BetStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Parses a status key, case-insensitively.
     *
     * @return the status, or null if the key is not one of pending/won/lost/void
     */
    @JsonCreator
    public static BetStatus fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase();
        for (BetStatus status : values()) {
            if (status.key.equals(normalized)) {
                return status;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
