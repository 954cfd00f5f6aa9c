package io.github.drompincen.promptgate.runtime.resolution;

import io.github.drompincen.promptgate.protocol.api.ResolutionResult;
import io.github.drompincen.promptgate.protocol.api.ResolutionState;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import io.github.drompincen.promptgate.protocol.prompt.PromptResponse;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;
import io.github.drompincen.promptgate.protocol.signal.SignalChannel;
import io.github.drompincen.promptgate.runtime.event.PromptEvent;
import io.github.drompincen.promptgate.runtime.event.PromptEventBus;
import io.github.drompincen.promptgate.runtime.queue.PromptQueue;
import io.github.drompincen.promptgate.runtime.session.Session;
import io.github.drompincen.promptgate.runtime.session.SessionRegistry;
import io.github.drompincen.promptgate.runtime.session.SessionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Suspends interception calls until a human decides. Each request id moves from {@code pending} to
 * exactly one of {@code resolved} or {@code timed_out}; the transition removes the prompt from its
 * session queue and wakes the waiter while holding the queue's lock.
 */
@Service
public class ResolutionService {

    private static final Logger log = LoggerFactory.getLogger(ResolutionService.class);

    public static final String TIMEOUT_REASON = "timeout";
    public static final String INTERRUPTED_REASON = "Session interrupted";
    public static final String CLEARED_REASON = "Session cleared";

    private final SessionRegistry registry;
    private final SessionStateTracker tracker;
    private final PromptEventBus eventBus;
    private final SignalChannel signalChannel;
    private final TaskScheduler scheduler;
    private final Duration maxWait;
    private final Duration retention;
    private final boolean markSignalOnPlanApproval;
    private final Map<String, OutstandingWait> waits = new ConcurrentHashMap<>();

    public ResolutionService(SessionRegistry registry,
                             SessionStateTracker tracker,
                             PromptEventBus eventBus,
                             SignalChannel signalChannel,
                             TaskScheduler scheduler,
                             @Value("${promptgate.resolution.max-wait:PT2M}") Duration maxWait,
                             @Value("${promptgate.resolution.retention:PT5M}") Duration retention,
                             @Value("${promptgate.resolution.mark-signal-on-plan-approval:true}")
                             boolean markSignalOnPlanApproval) {
        this.registry = registry;
        this.tracker = tracker;
        this.eventBus = eventBus;
        this.signalChannel = signalChannel;
        this.scheduler = scheduler;
        this.maxWait = maxWait;
        this.retention = retention;
        this.markSignalOnPlanApproval = markSignalOnPlanApproval;
    }

    public String submit(String sessionId, Prompt draft) {
        return submit(sessionId, draft, null);
    }

    /**
     * Enqueues a prompt and starts its deadline.
     *
     * @param requestId caller-chosen id, or null to generate one
     * @return the request id, which is also the prompt id
     */
    public String submit(String sessionId, Prompt draft, String requestId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (draft == null) {
            throw new IllegalArgumentException("prompt is required");
        }
        String id = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
        Instant now = Instant.now();
        OutstandingWait wait = new OutstandingWait(id, sessionId, draft.type(), now.plus(maxWait));
        Prompt prompt = draft.withIdentity(id, sessionId, now);
        Session session = registry.getOrCreate(sessionId);
        PromptQueue queue = session.queue();
        // resolvers can only see the wait once its prompt is queued
        boolean top = queue.withLock(() -> {
            if (waits.putIfAbsent(id, wait) != null) {
                throw new DuplicateRequestException(id);
            }
            queue.enqueue(prompt);
            return queue.peekTop().map(p -> p.id().equals(id)).orElse(false);
        });
        wait.deadlineTask(scheduler.schedule(() -> expire(id), wait.deadline()));
        log.info("Submitted {} prompt {} in session {}", prompt.type().wireName(), id, sessionId);

        tracker.refresh(sessionId);
        if (top) {
            eventBus.publish(new PromptEvent.PromptRequested(sessionId, prompt));
        }
        return id;
    }

    /**
     * Blocks until the request is resolved or its deadline passes. The deadline is owned here, so
     * callers pass no timeout.
     */
    public PromptResponse await(String requestId) {
        OutstandingWait wait = claim(requestId);
        try {
            return wait.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Wait for {} interrupted; the deadline will reclaim it", requestId);
            return PromptResponse.denied(wait.type(), "interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Wait for " + requestId + " failed", e.getCause());
        }
    }

    /** Non-blocking form of {@link #await} for servlet async long-polls. */
    public CompletableFuture<PromptResponse> awaitAsync(String requestId) {
        return claim(requestId).future();
    }

    public ResolutionResult resolve(String requestId, PromptResponse response) {
        OutstandingWait wait = waits.get(requestId);
        if (wait == null) {
            throw new UnknownRequestException(requestId);
        }
        if (response == null) {
            throw new IllegalArgumentException("response is required");
        }
        if (response.type() != wait.type()) {
            throw new IllegalArgumentException("Response type " + response.type().wireName()
                    + " does not match prompt type " + wait.type().wireName());
        }
        return transition(wait, ResolutionState.RESOLVED, response);
    }

    public Optional<ResolutionState> status(String requestId) {
        return Optional.ofNullable(waits.get(requestId)).map(OutstandingWait::state);
    }

    public List<Prompt> pending(String sessionId) {
        return registry.find(sessionId).map(s -> s.queue().snapshot()).orElse(List.of());
    }

    public Optional<Prompt> activePrompt(String sessionId) {
        return registry.find(sessionId).flatMap(s -> s.queue().peekTop());
    }

    /**
     * Denies every pending prompt of the session, top first.
     *
     * @return number of prompts denied
     */
    public int denyAll(String sessionId, String reason) {
        int denied = 0;
        for (Prompt prompt : pending(sessionId)) {
            OutstandingWait wait = waits.get(prompt.id());
            if (wait != null && transition(wait, ResolutionState.RESOLVED,
                    PromptResponse.denied(prompt.type(), reason)).applied()) {
                denied++;
            }
        }
        if (denied > 0) {
            log.info("Denied {} pending prompts in session {}: {}", denied, sessionId, reason);
        }
        return denied;
    }

    public int clearSession(String sessionId) {
        int denied = denyAll(sessionId, CLEARED_REASON);
        if (registry.remove(sessionId).isPresent()) {
            tracker.forgotten(sessionId);
            log.info("Cleared session {}", sessionId);
        }
        return denied;
    }

    void expire(String requestId) {
        OutstandingWait wait = waits.get(requestId);
        if (wait == null) {
            return;
        }
        ResolutionResult result = transition(wait, ResolutionState.TIMED_OUT,
                PromptResponse.denied(wait.type(), TIMEOUT_REASON));
        if (result.applied()) {
            log.info("Request {} timed out after {}", requestId, maxWait);
        }
    }

    int outstanding() {
        return waits.size();
    }

    private OutstandingWait claim(String requestId) {
        OutstandingWait wait = waits.get(requestId);
        if (wait == null) {
            throw new UnknownRequestException(requestId);
        }
        // a terminal wait never suspends, so late pollers may read it freely
        if (!wait.claim() && !wait.state().isTerminal()) {
            throw new ConcurrentAwaitException(requestId);
        }
        return wait;
    }

    private ResolutionResult transition(OutstandingWait wait, ResolutionState terminal, PromptResponse response) {
        String requestId = wait.requestId();
        Session session = registry.find(wait.sessionId()).orElse(null);
        boolean applied;
        Prompt nextTop = null;
        if (session != null) {
            PromptQueue queue = session.queue();
            applied = queue.withLock(() -> {
                if (wait.state().isTerminal()) {
                    return false;
                }
                queue.remove(requestId);
                return wait.complete(terminal, response);
            });
            if (applied) {
                nextTop = queue.peekTop().orElse(null);
            }
        } else {
            applied = wait.complete(terminal, response);
        }

        if (!applied) {
            log.info("Ignoring {} for request {}: already {}", terminal.wireName(), requestId,
                    wait.state().wireName());
            return new ResolutionResult(requestId, wait.state(), false);
        }

        log.info("Request {} {} (approved={})", requestId, terminal.wireName(), response.approved());
        if (terminal == ResolutionState.RESOLVED && wait.type() == PromptType.PLAN_APPROVAL
                && response.approved() && markSignalOnPlanApproval) {
            markSignal(wait.sessionId());
        }
        scheduler.schedule(() -> waits.remove(requestId, wait), Instant.now().plus(retention));

        tracker.refresh(wait.sessionId());
        eventBus.publish(new PromptEvent.PromptResolved(wait.sessionId(), requestId, terminal));
        if (nextTop != null) {
            eventBus.publish(new PromptEvent.PromptRequested(wait.sessionId(), nextTop));
        }
        return new ResolutionResult(requestId, terminal, true);
    }

    private void markSignal(String sessionId) {
        try {
            signalChannel.mark(sessionId);
        } catch (RuntimeException e) {
            // the waiter already has its answer
            log.error("Failed to mark signal for session {}", sessionId, e);
        }
    }
}
