package com.example.resq_ai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "engine.detection")
public class DetectionProperties {

    private String backend = "yolo-http";
    private String baseUrl = "http://localhost:8001";
    private String model = "yolov8n.pt";
    private double defaultConfidenceThreshold = 0.25;
    private long defaultTimeoutMs = 20_000;
    private int maxInMemoryBytes = 4 * 1024 * 1024;

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getDefaultConfidenceThreshold() {
        return defaultConfidenceThreshold;
    }

    public void setDefaultConfidenceThreshold(double defaultConfidenceThreshold) {
        if (defaultConfidenceThreshold < 0.0 || defaultConfidenceThreshold > 1.0) {
            throw new IllegalArgumentException("engine.detection.default-confidence-threshold must be within [0,1]");
        }
        this.defaultConfidenceThreshold = defaultConfidenceThreshold;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public int getMaxInMemoryBytes() {
        return maxInMemoryBytes;
    }

    public void setMaxInMemoryBytes(int maxInMemoryBytes) {
        this.maxInMemoryBytes = maxInMemoryBytes;
    }
}
