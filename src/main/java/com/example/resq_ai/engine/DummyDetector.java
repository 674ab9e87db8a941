package com.example.resq_ai.engine;

import com.example.resq_ai.dto.BoundingBox;
import com.example.resq_ai.dto.DecodedImage;
import com.example.resq_ai.dto.Detection;
import com.example.resq_ai.engine.Interfaces.Detector;
import com.example.resq_ai.util.DetectionNormalizer;

import java.time.Duration;
import java.util.List;

/**
 * Fixed detections placed relative to the image size. For local runs without an inference sidecar.
 */
public class DummyDetector implements Detector {

    @Override
    public List<Detection> detect(DecodedImage image, double confidenceThreshold, Duration timeout) {
        double w = image.width();
        double h = image.height();
        List<Detection> raw = List.of(
                new Detection("person", 0.91, new BoundingBox(w * 0.10, h * 0.20, w * 0.40, h * 0.90)),
                new Detection("person", 0.64, new BoundingBox(w * 0.55, h * 0.25, w * 0.80, h * 0.95)),
                new Detection("car", 0.32, new BoundingBox(w * 0.05, h * 0.60, w * 0.50, h * 0.98))
        );
        return DetectionNormalizer.normalize(raw, image.width(), image.height(), confidenceThreshold);
    }

    @Override
    public String name() {
        return "dummy";
    }
}
