package io.github.drompincen.promptgate.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResolutionState {
    PENDING("pending"),
    RESOLVED("resolved"),
    TIMED_OUT("timed_out");

    private final String wireName;

    ResolutionState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
