package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanApprovalResponse(boolean approved, String reason) implements PromptResponse {

    @Override
    public PromptType type() {
        return PromptType.PLAN_APPROVAL;
    }
}
