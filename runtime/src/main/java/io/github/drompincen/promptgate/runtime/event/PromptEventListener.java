package io.github.drompincen.promptgate.runtime.event;

public interface PromptEventListener {
    void onEvent(PromptEvent event);
    default void onError(Throwable t) {}
}
