package com.example.resq_ai.dto.web;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SummarizeTextRequest(
        @NotBlank @Size(max = 200_000) String text,
        @Min(1) @Max(100) Integer sentenceCount
) {
}
