package com.example.resq_ai.dto;

/**
 * Media that has been decoded far enough for a detector to run on it.
 */
public interface DecodedMedia {
    int width();

    int height();

    String format();

    int encodedSize();
}
