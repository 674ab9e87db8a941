package com.example.resq_ai.controller;

import com.example.resq_ai.dto.DetectionResult;
import com.example.resq_ai.dto.MediaReference;
import com.example.resq_ai.dto.web.AnalyzeMediaRequest;
import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.service.PipelineOrchestrator;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/media")
@Validated
public class AnalysisController {

    private final PipelineOrchestrator orchestrator;

    public AnalysisController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/analyze")
    public DetectionResult analyze(@Valid @RequestBody AnalyzeMediaRequest req) {
        try {
            return orchestrator.analyzeMedia(new MediaReference(req.bucket().trim(), req.key().trim()), req.confidenceThreshold());
        } catch (PipelineException e) {
            throw PipelineErrors.toResponse(e);
        }
    }
}
