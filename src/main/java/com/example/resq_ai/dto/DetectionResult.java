package com.example.resq_ai.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one analyzed object. Images carry {@code metadata} and detections; stored text
 * documents carry {@code textSummary} instead and leave both empty.
 */
public record DetectionResult(
        MediaReference source,
        String contentType,
        ImageMetadata metadata,
        List<Detection> detections,
        Map<String, Integer> labelCounts,
        String summaryText,
        String detector,
        double confidenceThreshold,
        long processingMs,
        SummarizationResult textSummary
) {
    public DetectionResult {
        detections = detections == null ? List.of() : List.copyOf(detections);
        // keeps first-seen label order
        labelCounts = labelCounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labelCounts));
    }
}
