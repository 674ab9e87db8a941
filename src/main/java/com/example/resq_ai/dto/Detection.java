package com.example.resq_ai.dto;

public record Detection(String label, double confidence, BoundingBox box) {
}
