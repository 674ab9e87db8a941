package com.example.resq_ai.util;

import java.util.List;
import java.util.Locale;

/**
 * Coarse report categories with their trigger words. Declaration order is the match priority;
 * {@link #OTHER} has no words and is the fallback.
 */
public enum ReportCategory {
    FINANCE(List.of("invoice", "price", "cost", "budget", "payment")),
    HEALTH(List.of("doctor", "hospital", "health", "medicine", "disease")),
    TECHNOLOGY(List.of("software", "app", "ai", "computer", "network")),
    EDUCATION(List.of("school", "teacher", "learning", "exam", "university")),
    MEDIA(List.of("image", "video", "audio", "picture")),
    OTHER(List.of());

    private final List<String> keywords;

    ReportCategory(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
