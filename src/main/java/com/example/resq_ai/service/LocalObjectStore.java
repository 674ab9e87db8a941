package com.example.resq_ai.service;

import com.example.resq_ai.dto.MediaReference;
import com.example.resq_ai.dto.RawMedia;
import com.example.resq_ai.exception.ObjectFetchException;
import com.example.resq_ai.service.Interfaces.ObjectStore;
import com.example.resq_ai.util.ContentTypes;
import com.example.resq_ai.util.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Filesystem stand-in for the object store used in local development. A bucket is a directory
 * below the base dir, a key a relative path inside it.
 */
public class LocalObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalObjectStore.class);

    private final Path baseDir;
    private final long maxObjectBytes;

    public LocalObjectStore(Path baseDir, long maxObjectBytes) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.maxObjectBytes = maxObjectBytes;
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("LocalObjectStore ready. base={}", this.baseDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create storage directory " + this.baseDir, e);
        }
    }

    @Override
    public RawMedia fetch(String bucket, String key, Duration timeout) {
        Path bucketDir = safeResolve(baseDir, bucket, "bucket");
        Path file = safeResolve(bucketDir, key, "key");
        if (Files.isDirectory(file)) {
            throw new ObjectFetchException(ErrorKind.NOT_FOUND, "Object not found: " + bucket + "/" + key);
        }
        try {
            long size = Files.size(file);
            if (size > maxObjectBytes) {
                throw new ObjectFetchException(ErrorKind.PAYLOAD_TOO_LARGE,
                        "Object " + bucket + "/" + key + " has " + size + " bytes, limit is " + maxObjectBytes);
            }
            byte[] bytes = Files.readAllBytes(file);
            String contentType = ContentTypes.resolve(Files.probeContentType(file), key);
            LOGGER.info("FETCH ok store=local bucket={} key={} bytes={} contentType={}", bucket, key, bytes.length, contentType);
            return new RawMedia(new MediaReference(bucket, key), bytes, contentType, Map.of());
        } catch (NoSuchFileException e) {
            throw new ObjectFetchException(ErrorKind.NOT_FOUND, "Object not found: " + bucket + "/" + key, e);
        } catch (AccessDeniedException e) {
            throw new ObjectFetchException(ErrorKind.UNAUTHORIZED, "Access denied: " + bucket + "/" + key, e);
        } catch (IOException e) {
            throw new ObjectFetchException(ErrorKind.TRANSIENT, "Read failed: " + bucket + "/" + key, e);
        }
    }

    @Override
    public String name() {
        return "local";
    }

    private Path safeResolve(Path root, String segment, String field) {
        if (segment == null || segment.isBlank()) {
            throw new ObjectFetchException(ErrorKind.INVALID_INPUT, field + " must not be empty");
        }
        // Force forward slashes; strip leading slashes
        String normalized = segment.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalized).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new ObjectFetchException(ErrorKind.INVALID_INPUT, "Invalid " + field + " (path traversal?): " + segment);
        }
        return p;
    }
}
