package com.example.resq_ai.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record ReportCategorizeRequest(
        @NotBlank @Size(max = 500) String title,
        @Size(max = 10_000) String description,
        @Size(max = 50) Map<String, String> metadata
) {
}
