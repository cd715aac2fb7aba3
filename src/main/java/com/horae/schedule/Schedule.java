package com.horae.schedule;

import java.time.Instant;

/**
 * Computes when a job should run next.
 * 
 * Implementations are pure functions of their argument (and of the current time
 * when {@code after} is null), except {@link ImmediateSchedule}, which remembers
 * whether it has already fired.
 */
@FunctionalInterface
public interface Schedule {

    /**
     * Returns the next run time after a previous run.
     * 
     * @param after time of the previous run, or null if the job has never run
     * @return the next run time, or null if the job should not run again
     */
    Instant getNextRunTime(Instant after);
}
