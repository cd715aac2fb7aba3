package com.horae.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires every given interval, with an optional delay before the first run.
 * Never stops firing.
 */
public final class IntervalSchedule implements Schedule {

    private final Duration every;
    private final Duration startDelay; // null = no delay

    public IntervalSchedule(Duration every) {
        this(every, null);
    }

    public IntervalSchedule(Duration every, Duration startDelay) {
        this.every = Objects.requireNonNull(every, "every cannot be null");
        if (every.isNegative() || every.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + every);
        }
        this.startDelay = startDelay;
    }

    /**
     * @return a copy of this schedule with the given delay before the first run
     */
    public IntervalSchedule withStartDelay(Duration startDelay) {
        return new IntervalSchedule(every, Objects.requireNonNull(startDelay, "startDelay cannot be null"));
    }

    public Duration getEvery() {
        return every;
    }

    public Duration getStartDelay() {
        return startDelay;
    }

    @Override
    public Instant getNextRunTime(Instant after) {
        if (after == null) {
            Instant next = Instant.now();
            if (startDelay != null) {
                next = next.plus(startDelay);
            }
            return next.plus(every);
        }
        return after.plus(every);
    }

    @Override
    public String toString() {
        return startDelay == null
            ? "every " + every
            : "every " + every + " after " + startDelay;
    }
}
