package io.github.drompincen.promptgate.protocol.api;

public record PlanRequest(
        String sessionId,
        String requestId,
        String planContent,
        String planPath
) {}
