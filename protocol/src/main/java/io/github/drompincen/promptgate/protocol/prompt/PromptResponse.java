package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Human decision for a {@link Prompt}, tagged with the same {@code type} as the prompt it answers.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PermissionResponse.class, name = "permission"),
        @JsonSubTypes.Type(value = UserQuestionResponse.class, name = "user_question"),
        @JsonSubTypes.Type(value = PlanApprovalResponse.class, name = "plan_approval"),
        @JsonSubTypes.Type(value = CommitApprovalResponse.class, name = "commit_approval")
})
public sealed interface PromptResponse
        permits PermissionResponse, UserQuestionResponse, PlanApprovalResponse, CommitApprovalResponse {

    PromptType type();

    boolean approved();

    default String reason() {
        return null;
    }

    static PromptResponse denied(PromptType type, String reason) {
        return switch (type) {
            case PERMISSION -> new PermissionResponse(false, null, reason, null);
            case USER_QUESTION -> new UserQuestionResponse(Map.of(), reason);
            case PLAN_APPROVAL -> new PlanApprovalResponse(false, reason);
            case COMMIT_APPROVAL -> new CommitApprovalResponse(false, null, reason);
        };
    }
}
