package com.example.resq_ai.dto;

/**
 * {@code matchedKeyword} is null when nothing matched and the category is {@code other}.
 */
public record ReportCategorization(String category, String matchedKeyword) {
}
