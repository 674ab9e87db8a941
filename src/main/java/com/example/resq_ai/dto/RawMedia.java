package com.example.resq_ai.dto;

import java.util.Map;
import java.util.Optional;

/**
 * Bytes of one fetched object. Lives only for the request that fetched it.
 */
public record RawMedia(
        MediaReference source,
        byte[] bytes,
        String contentType,
        Map<String, String> metadata
) {
    public RawMedia {
        bytes = bytes == null ? new byte[0] : bytes.clone();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    /** Integer user metadata written by the uploader, e.g. {@code width}. */
    public Optional<Integer> intMetadata(String name) {
        String value = metadata.get(name);
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "RawMedia{source=" + source + ", size=" + bytes.length + ", contentType='" + contentType + "'}";
    }
}
