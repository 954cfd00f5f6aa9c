package io.github.drompincen.promptgate.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.drompincen.promptgate.protocol.prompt.PromptResponse;

/**
 * Body of the long-poll reply. {@code approved} and {@code reason} are lifted out of the typed
 * response so simple adapters never need to understand the per-type payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PollResponse(
        boolean approved,
        String reason,
        String error,
        ResolutionState state,
        PromptResponse response
) {
    public static final String TIMEOUT_ERROR = "Approval timeout. Please try again.";
    public static final String NOT_FOUND_ERROR = "Request not found";

    public static PollResponse of(PromptResponse response, ResolutionState state) {
        String error = state == ResolutionState.TIMED_OUT ? TIMEOUT_ERROR : null;
        return new PollResponse(response.approved(), response.reason(), error, state, response);
    }

    public static PollResponse notFound() {
        return new PollResponse(false, null, NOT_FOUND_ERROR, null, null);
    }
}
