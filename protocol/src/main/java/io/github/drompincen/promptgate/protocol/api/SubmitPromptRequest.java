package io.github.drompincen.promptgate.protocol.api;

import io.github.drompincen.promptgate.protocol.prompt.Prompt;

/**
 * Generic submission. {@code requestId} is optional; adapters that pre-generate one send it so they
 * can start polling without parsing the reply.
 */
public record SubmitPromptRequest(
        String sessionId,
        String requestId,
        Prompt prompt
) {}
