package com.evfinder.application.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RefreshStatus {
    IDLE("idle"),
    LOADING("loading"),
    READY("ready"),
    ERROR("error");

    private final String key;

    RefreshStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
