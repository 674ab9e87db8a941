package com.example.resq_ai.controller;

import com.example.resq_ai.dto.ReportCategorization;
import com.example.resq_ai.dto.ReportDigest;
import com.example.resq_ai.dto.web.ReportCategorizeRequest;
import com.example.resq_ai.dto.web.ReportDigestRequest;
import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.service.ReportCategoryService;
import com.example.resq_ai.service.ReportDigestService;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reports")
@Validated
public class ReportController {

    private final ReportDigestService digestService;
    private final ReportCategoryService categoryService;

    public ReportController(ReportDigestService digestService, ReportCategoryService categoryService) {
        this.digestService = digestService;
        this.categoryService = categoryService;
    }

    @PostMapping("/digest")
    public ReportDigest digest(@Valid @RequestBody ReportDigestRequest req) {
        try {
            return digestService.digest(req.tags(), req.extraDescription());
        } catch (PipelineException e) {
            throw PipelineErrors.toResponse(e);
        }
    }

    @PostMapping("/categorize")
    public ReportCategorization categorize(@Valid @RequestBody ReportCategorizeRequest req) {
        try {
            return categoryService.categorize(req.title(), req.description(), req.metadata());
        } catch (PipelineException e) {
            throw PipelineErrors.toResponse(e);
        }
    }
}
