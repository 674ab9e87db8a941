package com.example.resq_ai.dto.web;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalyzeMediaRequest(
        @NotBlank @Size(max = 255) String bucket,
        @NotBlank @Size(max = 1024) String key,
        @DecimalMin("0.0") @DecimalMax("1.0") Double confidenceThreshold
) {
}
