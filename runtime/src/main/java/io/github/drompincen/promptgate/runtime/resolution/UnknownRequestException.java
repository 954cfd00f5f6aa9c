package io.github.drompincen.promptgate.runtime.resolution;

public class UnknownRequestException extends RuntimeException {

    private final String requestId;

    public UnknownRequestException(String requestId) {
        super("Request " + requestId + " not found or expired");
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
