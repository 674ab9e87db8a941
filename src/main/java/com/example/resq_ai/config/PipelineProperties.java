package com.example.resq_ai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * End-to-end budget, retry and admission limits of the processing pipeline.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private long timeoutMs = 30_000;
    private long retryBackoffMs = 200;
    private boolean retryInferenceFailures = false;
    private Inference inference = new Inference();
    private Executor executor = new Executor();

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Duration timeout() {
        return Duration.ofMillis(Math.max(1, timeoutMs));
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public boolean isRetryInferenceFailures() {
        return retryInferenceFailures;
    }

    public void setRetryInferenceFailures(boolean retryInferenceFailures) {
        this.retryInferenceFailures = retryInferenceFailures;
    }

    public Inference getInference() {
        return inference;
    }

    public void setInference(Inference inference) {
        this.inference = inference;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public static class Inference {
        private int maxConcurrent = 4;
        private long queueWaitMs = 250;

        public Inference() {
        }

        public Inference(int maxConcurrent, long queueWaitMs) {
            this.maxConcurrent = maxConcurrent;
            this.queueWaitMs = queueWaitMs;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public long getQueueWaitMs() {
            return queueWaitMs;
        }

        public void setQueueWaitMs(long queueWaitMs) {
            this.queueWaitMs = queueWaitMs;
        }
    }

    public static class Executor {
        private int threads = 8;
        private int queueCapacity = 64;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
