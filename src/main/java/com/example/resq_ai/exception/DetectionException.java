package com.example.resq_ai.exception;

import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;

public class DetectionException extends PipelineException {
    public DetectionException(ErrorKind kind, PipelineStage stage, String message) {
        super(kind, stage, message);
    }

    public DetectionException(ErrorKind kind, PipelineStage stage, String message, Throwable cause) {
        super(kind, stage, message, cause);
    }

    public static DetectionException invalidImage(String message) {
        return new DetectionException(ErrorKind.INVALID_INPUT, PipelineStage.DECODING, message);
    }

    public static DetectionException invalidImage(String message, Throwable cause) {
        return new DetectionException(ErrorKind.INVALID_INPUT, PipelineStage.DECODING, message, cause);
    }
}
