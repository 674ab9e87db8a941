package com.example.resq_ai.controller;

import com.example.resq_ai.exception.PipelineException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps a classified pipeline failure onto an HTTP status with a {@code CATEGORY_KIND} reason.
 */
final class PipelineErrors {
    private PipelineErrors() {}

    static ResponseStatusException toResponse(PipelineException e) {
        return new ResponseStatusException(statusOf(e), e.reasonCode(), e);
    }

    static HttpStatus statusOf(PipelineException e) {
        return switch (e.getKind()) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case PAYLOAD_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case CAPACITY_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case INFERENCE_FAILURE -> HttpStatus.BAD_GATEWAY;
            case TRANSIENT, ENGINE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
