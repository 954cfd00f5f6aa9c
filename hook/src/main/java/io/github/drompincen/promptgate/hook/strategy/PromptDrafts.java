package io.github.drompincen.promptgate.hook.strategy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.hook.policy.PermissionPatterns;
import io.github.drompincen.promptgate.protocol.prompt.CommitApprovalPrompt;
import io.github.drompincen.promptgate.protocol.prompt.PermissionPrompt;
import io.github.drompincen.promptgate.protocol.prompt.PlanApprovalPrompt;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;
import io.github.drompincen.promptgate.protocol.prompt.UserQuestionPrompt;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the prompt draft for a gated tool call from its {@code tool_input}.
 */
final class PromptDrafts {

    private static final TypeReference<List<UserQuestionPrompt.Question>> QUESTIONS = new TypeReference<>() {};
    private static final Pattern COMMIT_MESSAGE = Pattern.compile("-m\\s+(?:\"([^\"]*)\"|'([^']*)'|(\\S+))");

    private PromptDrafts() {}

    static Prompt from(PromptType gate, String toolName, JsonNode toolInput, ObjectMapper objectMapper) {
        JsonNode input = toolInput != null ? toolInput : objectMapper.createObjectNode();
        return switch (gate) {
            case PLAN_APPROVAL -> PlanApprovalPrompt.draft(
                    input.path("plan").asText(null),
                    input.path("planFilePath").asText(null));
            case USER_QUESTION -> UserQuestionPrompt.draft(
                    input.has("questions") ? objectMapper.convertValue(input.get("questions"), QUESTIONS) : List.of());
            case COMMIT_APPROVAL -> CommitApprovalPrompt.draft(commitMessage(input), null);
            case PERMISSION -> PermissionPrompt.draft(toolName, toolInput,
                    PermissionPatterns.describe(toolName, toolInput),
                    PermissionPatterns.suggest(toolName, toolInput));
        };
    }

    static String commitMessage(JsonNode input) {
        if (input.hasNonNull("message")) {
            return input.get("message").asText();
        }
        String command = input.path("command").asText("");
        Matcher m = COMMIT_MESSAGE.matcher(command);
        if (!m.find()) {
            return command.isEmpty() ? null : command;
        }
        for (int g = 1; g <= 3; g++) {
            if (m.group(g) != null) {
                return m.group(g);
            }
        }
        return command;
    }
}
