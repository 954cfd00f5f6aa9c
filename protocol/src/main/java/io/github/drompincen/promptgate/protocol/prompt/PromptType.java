package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of human decision an agent can wait on. The priority decides which pending prompt a UI
 * surfaces first; lower values win.
 */
public enum PromptType {
    PERMISSION("permission", 0),
    USER_QUESTION("user_question", 1),
    PLAN_APPROVAL("plan_approval", 2),
    COMMIT_APPROVAL("commit_approval", 3);

    private final String wireName;
    private final int priority;

    PromptType(String wireName, int priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int priority() {
        return priority;
    }

    @JsonCreator
    public static PromptType fromWireName(String name) {
        for (PromptType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown prompt type: " + name);
    }
}
