package io.github.drompincen.promptgate.runtime.session;

import io.github.drompincen.promptgate.protocol.api.SessionState;
import io.github.drompincen.promptgate.runtime.queue.PromptQueue;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

public class Session {

    private final String sessionId;
    private final PromptQueue queue;
    private final AtomicReference<SessionState> lastPublished = new AtomicReference<>(SessionState.INACTIVE);
    private volatile boolean agentRunning;
    private volatile Instant lastActivity;

    public Session(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.queue = new PromptQueue(sessionId);
        this.lastActivity = createdAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public PromptQueue queue() {
        return queue;
    }

    public SessionState state() {
        if (!queue.isEmpty()) {
            return SessionState.HAS_PENDING;
        }
        return agentRunning ? SessionState.ACTIVE : SessionState.INACTIVE;
    }

    void setAgentRunning(boolean agentRunning) {
        this.agentRunning = agentRunning;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    /**
     * Records {@code state} as the last published one.
     *
     * @return the previously published state
     */
    SessionState publishState(SessionState state) {
        return lastPublished.getAndSet(state);
    }

    boolean idleSince(Instant cutoff) {
        return !agentRunning && queue.isEmpty() && lastActivity.isBefore(cutoff);
    }
}
