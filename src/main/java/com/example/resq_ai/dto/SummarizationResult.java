package com.example.resq_ai.dto;

import java.util.List;

/**
 * Extractive summary. {@code sentenceCount} is what was produced, which is lower than
 * {@code requestedCount} when the source has fewer sentences.
 */
public record SummarizationResult(String summary, int sentenceCount, int requestedCount, List<String> sentences) {
    public SummarizationResult {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
    }
}
