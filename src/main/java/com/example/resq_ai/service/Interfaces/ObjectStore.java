package com.example.resq_ai.service.Interfaces;

import com.example.resq_ai.dto.RawMedia;

import java.time.Duration;

/**
 * Read access to an object store. Every call goes to the store; nothing is cached here.
 * Failures are thrown as {@link com.example.resq_ai.exception.ObjectFetchException}.
 */
public interface ObjectStore {

    /**
     * @param timeout upper bound for the whole call; the in-flight request is aborted when it expires.
     *                {@code null} uses the store default.
     */
    RawMedia fetch(String bucket, String key, Duration timeout);

    default RawMedia fetch(String bucket, String key) {
        return fetch(bucket, key, null);
    }

    String name();
}
