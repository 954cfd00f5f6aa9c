package io.github.drompincen.promptgate.runtime.resolution;

/**
 * A second caller tried to wait on a request that already has a waiter.
 */
public class ConcurrentAwaitException extends RuntimeException {

    public ConcurrentAwaitException(String requestId) {
        super("Request " + requestId + " is already being awaited");
    }
}
