package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * A single outstanding decision request scoped to a session. Each variant carries its own payload;
 * the {@code type} property on the wire selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PermissionPrompt.class, name = "permission"),
        @JsonSubTypes.Type(value = UserQuestionPrompt.class, name = "user_question"),
        @JsonSubTypes.Type(value = PlanApprovalPrompt.class, name = "plan_approval"),
        @JsonSubTypes.Type(value = CommitApprovalPrompt.class, name = "commit_approval")
})
public sealed interface Prompt
        permits PermissionPrompt, UserQuestionPrompt, PlanApprovalPrompt, CommitApprovalPrompt {

    String id();

    String sessionId();

    Instant createdAt();

    PromptType type();

    /**
     * Copy of this prompt with its identity assigned. Prompts submitted by an adapter arrive
     * without id or timestamp; the resolution service stamps them exactly once.
     */
    Prompt withIdentity(String id, String sessionId, Instant createdAt);
}
