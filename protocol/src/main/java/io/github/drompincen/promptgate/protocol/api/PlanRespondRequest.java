package io.github.drompincen.promptgate.protocol.api;

public record PlanRespondRequest(
        String requestId,
        Boolean approved,
        String reason
) {}
