package com.example.resq_ai.service;

import com.example.resq_ai.exception.PipelineException;
import com.example.resq_ai.util.ErrorKind;
import com.example.resq_ai.util.PipelineStage;
import com.example.resq_ai.util.TimeBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Caps the number of in-flight engine calls. Callers wait briefly for a permit and are turned
 * away with {@link ErrorKind#CAPACITY_EXCEEDED} otherwise.
 */
public class InferenceGate {
    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceGate.class);

    private final Semaphore permits;
    private final int maxConcurrent;
    private final long queueWaitMs;

    public InferenceGate(int maxConcurrent, long queueWaitMs) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.queueWaitMs = Math.max(0, queueWaitMs);
        this.permits = new Semaphore(this.maxConcurrent, true);
    }

    public <T> T call(PipelineStage stage, TimeBudget budget, Supplier<T> work) {
        long waitMs = Math.min(queueWaitMs, budget.remainingMs());
        boolean acquired;
        try {
            acquired = permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(ErrorKind.TIMEOUT, stage, "Interrupted while waiting for an engine slot", e);
        }
        if (!acquired) {
            LOGGER.warn("GATE rejected stage={} inFlight={} waitedMs={}", stage, inFlight(), waitMs);
            throw new PipelineException(ErrorKind.CAPACITY_EXCEEDED, stage,
                    "All " + maxConcurrent + " engine slots busy");
        }
        try {
            return work.get();
        } finally {
            permits.release();
        }
    }

    public int inFlight() {
        return maxConcurrent - permits.availablePermits();
    }
}
