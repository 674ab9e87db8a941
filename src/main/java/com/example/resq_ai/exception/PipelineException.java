package com.example.resq_ai.exception;

import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;

/**
 * Classified failure of one pipeline request. Messages name the stage and the object reference
 * but never carry payload contents or credentials.
 */
public class PipelineException extends RuntimeException {
    private final ErrorKind kind;
    private final PipelineStage stage;

    public PipelineException(ErrorKind kind, PipelineStage stage, String message) {
        super(message);
        this.kind = kind;
        this.stage = stage;
    }

    public PipelineException(ErrorKind kind, PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /** Reason code shown to callers, e.g. {@code RETRIEVAL_NOT_FOUND}. */
    public String reasonCode() {
        return stage.category().name() + "_" + kind.name();
    }
}
