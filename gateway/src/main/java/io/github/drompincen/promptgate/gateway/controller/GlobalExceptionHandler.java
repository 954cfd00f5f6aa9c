package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.api.ApiError;
import io.github.drompincen.promptgate.runtime.resolution.ConcurrentAwaitException;
import io.github.drompincen.promptgate.runtime.resolution.DuplicateRequestException;
import io.github.drompincen.promptgate.runtime.resolution.UnknownRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownRequestException.class)
    public ResponseEntity<ApiError> handleUnknown(UnknownRequestException ex) {
        log.info("[API] Not found: {}", ex.getMessage());
        return status(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({DuplicateRequestException.class, ConcurrentAwaitException.class})
    public ResponseEntity<ApiError> handleConflict(RuntimeException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return status(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return status(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("[API] Malformed body: {}", ex.getMostSpecificCause().getMessage());
        return status(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
            AsyncRequestTimeoutException.class})
    public ResponseEntity<ApiError> handleFramework(Exception ex) {
        HttpStatusCode code = ((ErrorResponse) ex).getStatusCode();
        log.info("[API] {}: {}", code, ex.getMessage());
        return ResponseEntity.status(code).body(ApiError.of(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return status(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiError> status(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiError.of(message));
    }
}
