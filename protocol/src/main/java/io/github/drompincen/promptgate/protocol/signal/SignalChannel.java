package io.github.drompincen.promptgate.protocol.signal;

/**
 * Out-of-band "this session is resolved" marker that survives process boundaries. {@link #consume}
 * clears the marker atomically, so when several callers race exactly one of them sees {@code true}.
 * Reads that race a mark which has not landed yet report {@code false}; they never throw.
 */
public interface SignalChannel {

    void mark(String sessionId);

    boolean check(String sessionId);

    boolean consume(String sessionId);
}
