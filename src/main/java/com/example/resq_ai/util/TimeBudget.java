package com.example.resq_ai.util;

import java.time.Clock;
import java.time.Duration;

/**
 * End-to-end deadline of one request. Every external call receives what is left of it.
 */
public final class TimeBudget {
    private final Clock clock;
    private final long startMs;
    private final long deadlineMs;

    private TimeBudget(Clock clock, long totalMs) {
        this.clock = clock;
        this.startMs = clock.millis();
        this.deadlineMs = startMs + Math.max(0, totalMs);
    }

    public static TimeBudget of(Duration total) {
        return new TimeBudget(Clock.systemUTC(), total.toMillis());
    }

    public static TimeBudget of(Duration total, Clock clock) {
        return new TimeBudget(clock, total.toMillis());
    }

    public long remainingMs() {
        return Math.max(0, deadlineMs - clock.millis());
    }

    public Duration remaining() {
        return Duration.ofMillis(remainingMs());
    }

    public long elapsedMs() {
        return clock.millis() - startMs;
    }

    public boolean exhausted() {
        return remainingMs() <= 0;
    }
}
