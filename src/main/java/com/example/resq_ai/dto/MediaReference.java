package com.example.resq_ai.dto;

public record MediaReference(String bucket, String key) {

    @Override
    public String toString() {
        return bucket + "/" + key;
    }
}
