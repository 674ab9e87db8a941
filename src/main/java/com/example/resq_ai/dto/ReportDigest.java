package com.example.resq_ai.dto;

public record ReportDigest(String title, String description) {
}
