package com.example.resq_ai.exception;

import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;

public class ObjectFetchException extends PipelineException {
    public ObjectFetchException(ErrorKind kind, String message) {
        super(kind, PipelineStage.FETCHING, message);
    }

    public ObjectFetchException(ErrorKind kind, String message, Throwable cause) {
        super(kind, PipelineStage.FETCHING, message, cause);
    }
}
