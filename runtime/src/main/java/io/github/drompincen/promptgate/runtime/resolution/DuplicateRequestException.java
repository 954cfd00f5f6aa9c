package io.github.drompincen.promptgate.runtime.resolution;

public class DuplicateRequestException extends RuntimeException {

    public DuplicateRequestException(String requestId) {
        super("Request " + requestId + " already exists");
    }
}
