package com.example.resq_ai.util;

/**
 * Failure classes of the pipeline. Each class decides whether the orchestrator may retry
 * and whether the caller or the service is at fault.
 */
public enum ErrorKind {
    INVALID_INPUT(false, true),
    NOT_FOUND(false, true),
    UNAUTHORIZED(false, true),
    PAYLOAD_TOO_LARGE(false, true),
    TRANSIENT(true, false),
    ENGINE_UNAVAILABLE(true, false),
    INFERENCE_FAILURE(false, false),
    TIMEOUT(false, false),
    CAPACITY_EXCEEDED(false, false),
    INTERNAL(false, false);

    private final boolean retryable;
    private final boolean clientError;

    ErrorKind(boolean retryable, boolean clientError) {
        this.retryable = retryable;
        this.clientError = clientError;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isClientError() {
        return clientError;
    }
}
