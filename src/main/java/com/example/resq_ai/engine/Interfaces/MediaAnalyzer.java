package com.example.resq_ai.engine.Interfaces;

import com.example.resq_ai.dto.DecodedMedia;
import com.example.resq_ai.dto.Detection;
import com.example.resq_ai.dto.RawMedia;

import java.time.Duration;
import java.util.List;

/**
 * One media family (images today) going from fetched bytes to detections. New families are added
 * as further implementations, picked by {@link #supports(String)}.
 */
public interface MediaAnalyzer<T extends DecodedMedia> {

    boolean supports(String contentType);

    T decode(RawMedia media);

    List<Detection> detect(T decoded, double confidenceThreshold, Duration timeout);

    String detectorName();
}
