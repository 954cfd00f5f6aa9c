package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.api.ResolutionState;
import io.github.drompincen.promptgate.runtime.resolution.ResolutionService;
import io.github.drompincen.promptgate.runtime.resolution.UnknownRequestException;

import java.util.concurrent.CompletableFuture;

/**
 * Shared long-poll for the plan and prompt endpoints. Unknown ids answer immediately with a
 * "not found" body instead of an error status, which is what polling adapters expect.
 */
final class LongPoll {

    private LongPoll() {}

    static CompletableFuture<PollResponse> poll(ResolutionService service, String requestId) {
        try {
            return service.awaitAsync(requestId)
                    .thenApply(response -> PollResponse.of(response,
                            service.status(requestId).orElse(ResolutionState.RESOLVED)));
        } catch (UnknownRequestException e) {
            return CompletableFuture.completedFuture(PollResponse.notFound());
        }
    }
}
