package io.github.drompincen.promptgate.runtime.resolution;

import io.github.drompincen.promptgate.protocol.api.ResolutionState;
import io.github.drompincen.promptgate.protocol.prompt.PromptResponse;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight interception call. Leaves {@code PENDING} exactly once; after that it only serves
 * as a tombstone answering late or duplicate callers.
 */
class OutstandingWait {

    private final String requestId;
    private final String sessionId;
    private final PromptType type;
    private final Instant deadline;
    private final CompletableFuture<PromptResponse> future = new CompletableFuture<>();
    private final AtomicBoolean claimed = new AtomicBoolean();
    private ResolutionState state = ResolutionState.PENDING;
    private ScheduledFuture<?> deadlineTask;

    OutstandingWait(String requestId, String sessionId, PromptType type, Instant deadline) {
        this.requestId = requestId;
        this.sessionId = sessionId;
        this.type = type;
        this.deadline = deadline;
    }

    String requestId() {
        return requestId;
    }

    String sessionId() {
        return sessionId;
    }

    PromptType type() {
        return type;
    }

    Instant deadline() {
        return deadline;
    }

    CompletableFuture<PromptResponse> future() {
        return future;
    }

    synchronized ResolutionState state() {
        return state;
    }

    /** True for the first waiter only. */
    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    /**
     * Moves to {@code terminal} and wakes the waiter.
     *
     * @return false if another transition won
     */
    synchronized boolean complete(ResolutionState terminal, PromptResponse response) {
        if (state.isTerminal()) {
            return false;
        }
        state = terminal;
        if (deadlineTask != null) {
            deadlineTask.cancel(false);
        }
        future.complete(response);
        return true;
    }

    synchronized void deadlineTask(ScheduledFuture<?> task) {
        if (state.isTerminal()) {
            task.cancel(false);
        } else {
            this.deadlineTask = task;
        }
    }
}
