package com.example.resq_ai.engine.Interfaces;

import com.example.resq_ai.dto.SummarizationResult;

public interface Summarizer {

    /**
     * Picks up to {@code sentenceCount} sentences of {@code text}, returned in source order.
     */
    SummarizationResult summarize(String text, int sentenceCount);

    default String name() {
        return getClass().getSimpleName();
    }
}
