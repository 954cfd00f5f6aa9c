package io.github.drompincen.promptgate.runtime.queue;

import io.github.drompincen.promptgate.protocol.prompt.Prompt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Pending prompts of one session. The top is the prompt with the lowest type priority; prompts of
 * equal priority come out in insertion order. Every operation runs under the queue's lock, which
 * callers can also hold across several operations through {@link #withLock}.
 */
public class PromptQueue {

    private static final Comparator<Prompt> ORDER = Comparator.comparingInt(p -> p.type().priority());

    private final String sessionId;
    private final ReentrantLock lock = new ReentrantLock();
    // insertion order; stable sort keeps it within a priority
    private final List<Prompt> prompts = new ArrayList<>();

    public PromptQueue(String sessionId) {
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }

    public void enqueue(Prompt prompt) {
        if (!sessionId.equals(prompt.sessionId())) {
            throw new IllegalArgumentException("Prompt " + prompt.id() + " belongs to session "
                    + prompt.sessionId() + ", not " + sessionId);
        }
        withLock(() -> {
            if (indexOf(prompt.id()) >= 0) {
                throw new IllegalStateException("Prompt " + prompt.id() + " is already queued");
            }
            prompts.add(prompt);
            return null;
        });
    }

    public Optional<Prompt> peekTop() {
        return withLock(() -> prompts.stream().min(ORDER));
    }

    /**
     * Removes the prompt wherever it sits. Unknown ids are ignored.
     */
    public Optional<Prompt> remove(String promptId) {
        return withLock(() -> {
            int i = indexOf(promptId);
            return i < 0 ? Optional.<Prompt>empty() : Optional.of(prompts.remove(i));
        });
    }

    public boolean contains(String promptId) {
        return withLock(() -> indexOf(promptId) >= 0);
    }

    /** Ordered copy, top first. */
    public List<Prompt> snapshot() {
        return withLock(() -> {
            List<Prompt> copy = new ArrayList<>(prompts);
            copy.sort(ORDER);
            return List.copyOf(copy);
        });
    }

    public int size() {
        return withLock(prompts::size);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private int indexOf(String promptId) {
        for (int i = 0; i < prompts.size(); i++) {
            if (prompts.get(i).id().equals(promptId)) {
                return i;
            }
        }
        return -1;
    }
}
