package io.github.drompincen.promptgate.protocol.hook;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Decision the hook writes to stdout. An allow serializes to {@code {}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HookOutput(HookSpecificOutput hookSpecificOutput) {

    public static final String PRE_TOOL_USE = "PreToolUse";
    public static final String DENY = "deny";

    public static HookOutput allow() {
        return new HookOutput(null);
    }

    public static HookOutput deny(String reason) {
        return new HookOutput(new HookSpecificOutput(PRE_TOOL_USE, DENY, reason));
    }

    public boolean allowed() {
        return hookSpecificOutput == null || !DENY.equals(hookSpecificOutput.permissionDecision());
    }

    public String reason() {
        return hookSpecificOutput != null ? hookSpecificOutput.permissionDecisionReason() : null;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HookSpecificOutput(
            String hookEventName,
            String permissionDecision,
            String permissionDecisionReason
    ) {}
}
