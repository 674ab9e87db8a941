package com.example.resq_ai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    private String backend = "s3";
    private String region = "us-east-1";
    private String accessKeyId;
    private String secretAccessKey;
    private String endpointOverride;
    private boolean pathStyleAccess = false;
    private long maxObjectBytes = 25L * 1024 * 1024;
    private long defaultTimeoutMs = 15_000;
    private Local local = new Local();

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public String getAccessKeyId() { return accessKeyId; }
    public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

    public String getSecretAccessKey() { return secretAccessKey; }
    public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

    public String getEndpointOverride() { return endpointOverride; }
    public void setEndpointOverride(String endpointOverride) { this.endpointOverride = endpointOverride; }

    public boolean isPathStyleAccess() { return pathStyleAccess; }
    public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }

    public long getMaxObjectBytes() { return maxObjectBytes; }
    public void setMaxObjectBytes(long maxObjectBytes) { this.maxObjectBytes = maxObjectBytes; }

    public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
    public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public boolean hasStaticCredentials() {
        return accessKeyId != null && !accessKeyId.isBlank()
                && secretAccessKey != null && !secretAccessKey.isBlank();
    }

    public static class Local {
        private String baseDir = "./data/buckets";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
    }
}
