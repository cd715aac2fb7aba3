package com.horae.schedule;

import java.time.Instant;
import java.util.Objects;

/**
 * Fires once at a fixed time, and never again unless the job is reloaded.
 */
public final class OnceAtSchedule implements Schedule {

    private final Instant time;

    public OnceAtSchedule(Instant time) {
        this.time = Objects.requireNonNull(time, "time cannot be null");
    }

    public Instant getTime() {
        return time;
    }

    @Override
    public Instant getNextRunTime(Instant after) {
        if (after == null || time.isAfter(after)) {
            return time;
        }
        return null;
    }

    @Override
    public String toString() {
        return "once at " + time;
    }
}
