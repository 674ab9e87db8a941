package com.example.resq_ai.exception;

import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;

public class SummarizationException extends PipelineException {
    public SummarizationException(ErrorKind kind, String message) {
        super(kind, PipelineStage.SUMMARIZING, message);
    }

    public SummarizationException(ErrorKind kind, String message, Throwable cause) {
        super(kind, PipelineStage.SUMMARIZING, message, cause);
    }
}
