package com.example.resq_ai.util;

import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    IMAGE(Set.of("image/jpeg", "image/png", "image/gif", "image/webp", "image/tiff", "image/bmp")),
    VIDEO(Set.of("video/mp4", "video/mpeg", "video/quicktime", "video/x-msvideo", "video/webm")),
    AUDIO(Set.of("audio/mpeg", "audio/wav", "audio/ogg", "audio/webm", "audio/aac", "audio/flac")),
    TEXT(Set.of("text/plain", "text/html", "text/csv", "text/markdown", "application/json", "application/xml")),
    UNKNOWN(Set.of());

    private final Set<String> contentTypes;

    MediaKind(Set<String> contentTypes) {
        this.contentTypes = contentTypes;
    }

    public Set<String> contentTypes() {
        return contentTypes;
    }

    public boolean matches(String contentType) {
        return contentType != null && contentTypes.contains(ContentTypes.normalize(contentType));
    }

    public static MediaKind of(String contentType) {
        if (contentType == null) return UNKNOWN;
        String normalized = ContentTypes.normalize(contentType);
        for (MediaKind kind : values()) {
            if (kind.contentTypes.contains(normalized)) return kind;
        }
        return UNKNOWN;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
