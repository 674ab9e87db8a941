package com.example.resq_ai.util;

import java.util.Locale;
import java.util.Map;

public final class ContentTypes {
    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("tif", "image/tiff"),
            Map.entry("tiff", "image/tiff"),
            Map.entry("webp", "image/webp"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("mpeg", "video/mpeg"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("webm", "video/webm"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("aac", "audio/aac"),
            Map.entry("flac", "audio/flac"),
            Map.entry("txt", "text/plain"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("csv", "text/csv"),
            Map.entry("md", "text/markdown"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml")
    );

    private ContentTypes() {}

    /**
     * Picks the content type of a stored object: the store's own value when it names a concrete
     * type, else a guess from the key extension, else {@link #UNKNOWN}.
     */
    public static String resolve(String declared, String key) {
        if (isConcrete(declared)) {
            return normalize(declared);
        }
        String byExtension = fromKey(key);
        return byExtension != null ? byExtension : UNKNOWN;
    }

    public static String fromKey(String key) {
        if (key == null) return null;
        int slash = key.lastIndexOf('/');
        String name = slash >= 0 ? key.substring(slash + 1) : key;
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) return null;
        return BY_EXTENSION.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /** Lower-cases and strips parameters such as {@code ; charset=utf-8}. */
    public static String normalize(String contentType) {
        if (contentType == null) return null;
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isConcrete(String contentType) {
        if (contentType == null || contentType.isBlank()) return false;
        String normalized = normalize(contentType);
        return !normalized.isEmpty()
                && !normalized.equals("application/octet-stream")
                && !normalized.equals("binary/octet-stream")
                && !normalized.equals(UNKNOWN);
    }
}
