package io.github.drompincen.promptgate.runtime.event;

import io.github.drompincen.promptgate.protocol.api.ResolutionState;
import io.github.drompincen.promptgate.protocol.api.SessionStateDto;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;

/**
 * Change notifications emitted by the resolution service and the session state tracker.
 */
public sealed interface PromptEvent {

    String sessionId();

    /** A prompt became the top of its session's queue. */
    record PromptRequested(String sessionId, Prompt prompt) implements PromptEvent {}

    record PromptResolved(String sessionId, String promptId, ResolutionState state) implements PromptEvent {}

    record SessionStateChanged(String sessionId, SessionStateDto state) implements PromptEvent {}
}
