package io.github.drompincen.promptgate.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionState {
    INACTIVE("inactive"),
    ACTIVE("active"),
    HAS_PENDING("has-pending");

    private final String wireName;

    SessionState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
