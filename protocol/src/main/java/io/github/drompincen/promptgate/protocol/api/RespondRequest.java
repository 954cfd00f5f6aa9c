package io.github.drompincen.promptgate.protocol.api;

import io.github.drompincen.promptgate.protocol.prompt.PromptResponse;

public record RespondRequest(
        String requestId,
        PromptResponse response
) {}
