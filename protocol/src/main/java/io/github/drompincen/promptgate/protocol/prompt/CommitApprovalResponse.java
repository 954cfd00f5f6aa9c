package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommitApprovalResponse(boolean approved, Boolean push, String reason) implements PromptResponse {

    @Override
    public PromptType type() {
        return PromptType.COMMIT_APPROVAL;
    }
}
