package io.github.drompincen.promptgate.protocol.api;

public record ApiError(boolean success, String error) {

    public static ApiError of(String error) {
        return new ApiError(false, error);
    }
}
