package io.github.drompincen.promptgate.hook.client;

/**
 * The gateway could not be reached or answered with an error status.
 */
public class GatewayException extends Exception {

    private final int status;

    public GatewayException(String message, int status) {
        super(message);
        this.status = status;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /** HTTP status, or -1 when no response arrived. */
    public int getStatus() {
        return status;
    }
}
