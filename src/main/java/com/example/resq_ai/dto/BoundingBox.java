package com.example.resq_ai.dto;

/**
 * Corner coordinates (x1, y1) top-left and (x2, y2) bottom-right, in source image pixels.
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

    public BoundingBox clampTo(int width, int height) {
        double cx1 = clamp(Math.min(x1, x2), width);
        double cy1 = clamp(Math.min(y1, y2), height);
        double cx2 = clamp(Math.max(x1, x2), width);
        double cy2 = clamp(Math.max(y1, y2), height);
        return new BoundingBox(cx1, cy1, cx2, cy2);
    }

    public boolean isWithin(int width, int height) {
        return x1 >= 0 && y1 >= 0 && x2 <= width && y2 <= height && x1 <= x2 && y1 <= y2;
    }

    public double area() {
        return Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
    }

    private static double clamp(double v, int max) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(max, v));
    }
}
