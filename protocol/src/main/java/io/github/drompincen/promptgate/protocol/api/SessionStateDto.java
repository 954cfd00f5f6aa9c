package io.github.drompincen.promptgate.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStateDto(
        String sessionId,
        SessionState state,
        int pendingCount,
        Prompt activePrompt
) {}
