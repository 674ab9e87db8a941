package com.example.resq_ai.util;

public enum PipelineStage {
    RECEIVED(Category.PROCESSING),
    FETCHING(Category.RETRIEVAL),
    DECODING(Category.PROCESSING),
    INFERRING(Category.PROCESSING),
    NORMALIZING(Category.PROCESSING),
    SUMMARIZING(Category.PROCESSING),
    COMPLETED(Category.PROCESSING);

    /** What a caller sees: a bad object reference versus media the engines could not process. */
    public enum Category { RETRIEVAL, PROCESSING }

    private final Category category;

    PipelineStage(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
