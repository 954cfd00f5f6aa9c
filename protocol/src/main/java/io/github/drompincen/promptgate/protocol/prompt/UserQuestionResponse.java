package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Answers keyed by question text. A value is either a string or, for multi-select questions, an
 * array of strings. {@code reason} is set only when the question was dismissed by the service
 * (timeout, interrupt) rather than answered.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserQuestionResponse(Map<String, JsonNode> answers, String reason) implements PromptResponse {

    public UserQuestionResponse {
        answers = answers != null ? Map.copyOf(answers) : Map.of();
    }

    @Override
    public PromptType type() {
        return PromptType.USER_QUESTION;
    }

    @Override
    public boolean approved() {
        return !answers.isEmpty();
    }
}
