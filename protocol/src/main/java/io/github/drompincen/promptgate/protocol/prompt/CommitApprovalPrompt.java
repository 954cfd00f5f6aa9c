package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommitApprovalPrompt(
        String id,
        String sessionId,
        Instant createdAt,
        String commitMessage,
        String gitStatus
) implements Prompt {

    public static CommitApprovalPrompt draft(String commitMessage, String gitStatus) {
        return new CommitApprovalPrompt(null, null, null, commitMessage, gitStatus);
    }

    @Override
    public PromptType type() {
        return PromptType.COMMIT_APPROVAL;
    }

    @Override
    public CommitApprovalPrompt withIdentity(String id, String sessionId, Instant createdAt) {
        return new CommitApprovalPrompt(id, sessionId, createdAt, commitMessage, gitStatus);
    }
}
