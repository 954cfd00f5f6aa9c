package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.api.ApiError;
import io.github.drompincen.promptgate.runtime.resolution.ConcurrentAwaitException;
import io.github.drompincen.promptgate.runtime.resolution.DuplicateRequestException;
import io.github.drompincen.promptgate.runtime.resolution.UnknownRequestException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void unknownRequestIs404() {
        ResponseEntity<ApiError> response = handler.handleUnknown(new UnknownRequestException("R1"));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody().success()).isFalse();
        assertThat(response.getBody().error()).contains("not found or expired");
    }

    @Test
    void duplicatesAndSecondWaitersAre409() {
        assertThat(handler.handleConflict(new DuplicateRequestException("R1")).getStatusCode().value())
                .isEqualTo(409);
        assertThat(handler.handleConflict(new ConcurrentAwaitException("R1")).getStatusCode().value())
                .isEqualTo(409);
    }

    @Test
    void invalidInputIs400() {
        var response = handler.handleIllegalArgument(new IllegalArgumentException("sessionId is required"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody().error()).isEqualTo("sessionId is required");
    }

    @Test
    void unexpectedErrorsAre500WithoutDetails() {
        var response = handler.handleGeneric(new RuntimeException("secret stack detail"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().error()).isEqualTo("Internal server error");
    }
}
