package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanApprovalPrompt(
        String id,
        String sessionId,
        Instant createdAt,
        String planContent,
        String planPath
) implements Prompt {

    public static PlanApprovalPrompt draft(String planContent, String planPath) {
        return new PlanApprovalPrompt(null, null, null, planContent, planPath);
    }

    @Override
    public PromptType type() {
        return PromptType.PLAN_APPROVAL;
    }

    @Override
    public PlanApprovalPrompt withIdentity(String id, String sessionId, Instant createdAt) {
        return new PlanApprovalPrompt(id, sessionId, createdAt, planContent, planPath);
    }
}
