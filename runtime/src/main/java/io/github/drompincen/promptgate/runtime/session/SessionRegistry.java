package io.github.drompincen.promptgate.runtime.session;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live {@link Session}, keyed by session id. Sessions are created on first use and
 * dropped when cleared or when they have been idle long enough.
 */
@Component
public class SessionRegistry {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry() {
        this(Clock.systemUTC());
    }

    SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public Session getOrCreate(String sessionId) {
        Session session = sessions.computeIfAbsent(sessionId, id -> new Session(id, clock.instant()));
        session.touch(clock.instant());
        return session;
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<Session> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public Collection<Session> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Drops sessions with no agent run, no pending prompt and no activity since {@code cutoff}.
     *
     * @return ids of the evicted sessions
     */
    public List<String> evictIdle(Instant cutoff) {
        List<String> evicted = new ArrayList<>();
        for (String id : sessions.keySet()) {
            sessions.computeIfPresent(id, (k, s) -> {
                if (s.idleSince(cutoff)) {
                    evicted.add(k);
                    return null;
                }
                return s;
            });
        }
        return evicted;
    }

    Instant now() {
        return clock.instant();
    }
}
