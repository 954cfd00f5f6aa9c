package io.github.drompincen.promptgate.runtime.session;

import io.github.drompincen.promptgate.protocol.api.SessionState;
import io.github.drompincen.promptgate.protocol.api.SessionStateDto;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import io.github.drompincen.promptgate.runtime.event.PromptEvent;
import io.github.drompincen.promptgate.runtime.event.PromptEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Derives {@code inactive / active / has-pending} from queue occupancy and agent liveness and
 * publishes every observed transition.
 */
@Service
public class SessionStateTracker {

    private static final Logger log = LoggerFactory.getLogger(SessionStateTracker.class);

    private final SessionRegistry registry;
    private final PromptEventBus eventBus;
    private final Duration idleExpiry;

    public SessionStateTracker(SessionRegistry registry, PromptEventBus eventBus,
                               @Value("${promptgate.session.idle-expiry:PT24H}") Duration idleExpiry) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.idleExpiry = idleExpiry;
    }

    public SessionState state(String sessionId) {
        return registry.find(sessionId).map(Session::state).orElse(SessionState.INACTIVE);
    }

    public SessionStateDto describe(String sessionId) {
        return registry.find(sessionId)
                .map(this::toDto)
                .orElseGet(() -> new SessionStateDto(sessionId, SessionState.INACTIVE, 0, null));
    }

    public SessionStateDto agentStarted(String sessionId) {
        Session session = registry.getOrCreate(sessionId);
        session.setAgentRunning(true);
        log.info("Agent started in session {}", sessionId);
        return refresh(sessionId);
    }

    public SessionStateDto agentStopped(String sessionId) {
        registry.find(sessionId).ifPresent(s -> s.setAgentRunning(false));
        log.info("Agent stopped in session {}", sessionId);
        return refresh(sessionId);
    }

    /**
     * Recomputes the state after a queue change and publishes it if it differs from the last
     * published one.
     */
    public SessionStateDto refresh(String sessionId) {
        Session session = registry.find(sessionId).orElse(null);
        if (session == null) {
            return describe(sessionId);
        }
        // publishing under the queue lock keeps concurrent refreshes in queue order
        return session.queue().withLock(() -> {
            SessionStateDto dto = toDto(session);
            SessionState previous = session.publishState(dto.state());
            if (previous != dto.state()) {
                log.debug("Session {} {} -> {}", sessionId, previous, dto.state());
                eventBus.publish(new PromptEvent.SessionStateChanged(sessionId, dto));
            }
            return dto;
        });
    }

    /** Publishes the final {@code inactive} state of a session that was just removed. */
    public void forgotten(String sessionId) {
        eventBus.publish(new PromptEvent.SessionStateChanged(sessionId,
                new SessionStateDto(sessionId, SessionState.INACTIVE, 0, null)));
    }

    @Scheduled(fixedDelayString = "${promptgate.session.sweep-interval:PT10M}")
    public void evictIdleSessions() {
        List<String> evicted = registry.evictIdle(registry.now().minus(idleExpiry));
        if (!evicted.isEmpty()) {
            log.info("Evicted {} idle sessions", evicted.size());
        }
    }

    private SessionStateDto toDto(Session session) {
        return session.queue().withLock(() -> {
            Prompt top = session.queue().peekTop().orElse(null);
            return new SessionStateDto(session.sessionId(), session.state(), session.queue().size(), top);
        });
    }
}
