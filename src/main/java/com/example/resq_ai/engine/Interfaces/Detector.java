package com.example.resq_ai.engine.Interfaces;

import com.example.resq_ai.dto.DecodedImage;
import com.example.resq_ai.dto.Detection;

import java.time.Duration;
import java.util.List;

/**
 * Object detection model. Output keeps model order, drops everything below the threshold and
 * keeps boxes inside the image. Same model and same input give the same output.
 */
public interface Detector {

    List<Detection> detect(DecodedImage image, double confidenceThreshold, Duration timeout);

    default List<Detection> detect(DecodedImage image, double confidenceThreshold) {
        return detect(image, confidenceThreshold, null);
    }

    String name();
}
