package io.github.drompincen.promptgate.protocol.api;

/**
 * Outcome of a resolve call. {@code applied} is false when the request had already reached a
 * terminal state; {@code state} is then the state it reached first.
 */
public record ResolutionResult(
        String requestId,
        ResolutionState state,
        boolean applied
) {}
