package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How long an approved permission lasts. Project and global scopes persist the response's pattern
 * as an allow rule in the agent's settings.
 */
public enum PermissionScope {
    ONCE("allow_once"),
    PROJECT("allow_project"),
    GLOBAL("allow_global");

    private final String wireName;

    PermissionScope(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean persistent() {
        return this != ONCE;
    }

    @JsonCreator
    public static PermissionScope fromWireName(String name) {
        for (PermissionScope scope : values()) {
            if (scope.wireName.equals(name)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown permission scope: " + name);
    }
}
