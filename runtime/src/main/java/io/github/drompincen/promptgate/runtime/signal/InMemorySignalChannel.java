package io.github.drompincen.promptgate.runtime.signal;

import io.github.drompincen.promptgate.protocol.signal.SignalChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local markers. Other processes reach them through the gateway's signal endpoints.
 */
@Component
@ConditionalOnProperty(name = "promptgate.signal.backend", havingValue = "memory")
public class InMemorySignalChannel implements SignalChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemorySignalChannel.class);

    private final Set<String> marked = ConcurrentHashMap.newKeySet();

    @Override
    public void mark(String sessionId) {
        marked.add(sessionId);
        log.debug("Marked session {}", sessionId);
    }

    @Override
    public boolean check(String sessionId) {
        return marked.contains(sessionId);
    }

    @Override
    public boolean consume(String sessionId) {
        return marked.remove(sessionId);
    }
}
