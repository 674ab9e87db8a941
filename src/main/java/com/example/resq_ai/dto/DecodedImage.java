package com.example.resq_ai.dto;

import java.awt.image.BufferedImage;

/**
 * Decoded pixel buffer plus the encoded form it came from. Detectors read it and never write to it.
 */
public record DecodedImage(
        BufferedImage pixels,
        int width,
        int height,
        String format,
        String contentType,
        byte[] encoded
) implements DecodedMedia {
    public DecodedImage {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("image dimensions must be at least 1x1, got " + width + "x" + height);
        }
        encoded = encoded == null ? new byte[0] : encoded.clone();
    }

    @Override
    public byte[] encoded() {
        return encoded.clone();
    }

    public int encodedSize() {
        return encoded.length;
    }

    @Override
    public String toString() {
        return "DecodedImage{" + width + "x" + height + ", format='" + format + "', encodedSize=" + encoded.length + "}";
    }
}
