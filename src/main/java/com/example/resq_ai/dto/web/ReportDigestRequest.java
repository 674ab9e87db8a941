package com.example.resq_ai.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ReportDigestRequest(
        @NotEmpty @Size(max = 200) List<@NotBlank String> tags,
        @Size(max = 50) List<String> extraDescription
) {
}
