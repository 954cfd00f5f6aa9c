package io.github.drompincen.promptgate.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitResponse(
        boolean success,
        String requestId,
        String error
) {
    public static SubmitResponse accepted(String requestId) {
        return new SubmitResponse(true, requestId, null);
    }

    public static SubmitResponse rejected(String error) {
        return new SubmitResponse(false, null, error);
    }
}
