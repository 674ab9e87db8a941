package com.example.resq_ai.util;

import com.example.resq_ai.dto.BoundingBox;
import com.example.resq_ai.dto.Detection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DetectionNormalizer {
    private DetectionNormalizer() {}

    /**
     * Keeps detections at or above {@code threshold}, in input order, with confidence in [0,1] and
     * boxes clamped to the image. Boxes that end up with no area are dropped.
     */
    public static List<Detection> normalize(List<Detection> raw, int width, int height, double threshold) {
        if (raw == null || raw.isEmpty()) return List.of();
        List<Detection> out = new ArrayList<>(raw.size());
        for (Detection d : raw) {
            if (d == null || d.box() == null || Double.isNaN(d.confidence())) continue;
            double confidence = Math.max(0.0, Math.min(1.0, d.confidence()));
            if (confidence < threshold) continue;
            BoundingBox box = d.box().clampTo(width, height);
            if (box.area() <= 0) continue;
            String label = d.label() == null || d.label().isBlank() ? "unknown" : d.label();
            out.add(new Detection(label, confidence, box));
        }
        return List.copyOf(out);
    }

    public static Map<String, Integer> countByLabel(List<Detection> detections) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Detection d : detections) {
            counts.merge(d.label(), 1, Integer::sum);
        }
        return counts;
    }

    /** e.g. {@code Detected 2 persons, 1 dog and 1 car in the image.} */
    public static String describe(Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return "No objects detected in the image.";
        }
        List<String> parts = new ArrayList<>(counts.size());
        counts.forEach((label, count) -> parts.add(count + " " + label + (count > 1 ? "s" : "")));
        if (parts.size() == 1) {
            return "Detected " + parts.get(0) + " in the image.";
        }
        String last = parts.remove(parts.size() - 1);
        return "Detected " + String.join(", ", parts) + " and " + last + " in the image.";
    }
}
