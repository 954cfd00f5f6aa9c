package io.github.drompincen.promptgate.runtime.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class PromptEventBus {

    private static final Logger log = LoggerFactory.getLogger(PromptEventBus.class);

    private final List<PromptEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(PromptEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PromptEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Delivers synchronously on the caller's thread. A failing listener is told through
     * {@link PromptEventListener#onError} and never blocks delivery to the others.
     */
    public void publish(PromptEvent event) {
        for (PromptEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}: {}", listener.getClass().getSimpleName(),
                        event.getClass().getSimpleName(), e.getMessage());
                listener.onError(e);
            }
        }
    }
}
