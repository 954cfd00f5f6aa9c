package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionPrompt(
        String id,
        String sessionId,
        Instant createdAt,
        String toolName,
        JsonNode toolInput,
        String description,
        String suggestedPattern
) implements Prompt {

    public static PermissionPrompt draft(String toolName, JsonNode toolInput,
                                         String description, String suggestedPattern) {
        return new PermissionPrompt(null, null, null, toolName, toolInput, description, suggestedPattern);
    }

    @Override
    public PromptType type() {
        return PromptType.PERMISSION;
    }

    @Override
    public PermissionPrompt withIdentity(String id, String sessionId, Instant createdAt) {
        return new PermissionPrompt(id, sessionId, createdAt, toolName, toolInput, description, suggestedPattern);
    }
}
