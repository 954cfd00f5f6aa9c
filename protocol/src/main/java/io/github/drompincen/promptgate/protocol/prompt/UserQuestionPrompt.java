package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserQuestionPrompt(
        String id,
        String sessionId,
        Instant createdAt,
        List<Question> questions
) implements Prompt {

    public UserQuestionPrompt {
        questions = questions != null ? List.copyOf(questions) : List.of();
    }

    public static UserQuestionPrompt draft(List<Question> questions) {
        return new UserQuestionPrompt(null, null, null, questions);
    }

    @Override
    public PromptType type() {
        return PromptType.USER_QUESTION;
    }

    @Override
    public UserQuestionPrompt withIdentity(String id, String sessionId, Instant createdAt) {
        return new UserQuestionPrompt(id, sessionId, createdAt, questions);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Question(String question, String header, List<Option> options, boolean multiSelect) {
        public Question {
            options = options != null ? List.copyOf(options) : List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Option(String label, String description) {}
}
