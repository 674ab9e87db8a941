package com.example.resq_ai.controller;

import com.example.resq_ai.dto.SummarizationRequest;
import com.example.resq_ai.dto.SummarizationResult;
import com.example.resq_ai.dto.web.SummarizeTextRequest;
import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.service.PipelineOrchestrator;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/text")
@Validated
public class SummarizeController {

    private final PipelineOrchestrator orchestrator;

    public SummarizeController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/summarize")
    public SummarizationResult summarize(@Valid @RequestBody SummarizeTextRequest req) {
        try {
            return orchestrator.summarize(new SummarizationRequest(req.text(), req.sentenceCount()));
        } catch (PipelineException e) {
            throw PipelineErrors.toResponse(e);
        }
    }
}
