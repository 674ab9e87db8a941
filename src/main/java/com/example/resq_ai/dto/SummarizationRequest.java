package com.example.resq_ai.dto;

public record SummarizationRequest(String text, Integer sentenceCount) {

    public int resolveSentenceCount(int defaultCount) {
        return sentenceCount != null ? sentenceCount : defaultCount;
    }
}
