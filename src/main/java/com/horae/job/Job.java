package com.horae.job;

import com.horae.schedule.Schedule;

import java.time.Duration;

/**
 * Interface that represents a named unit of work loaded into the JobManager.
 * 
 * Only {@link #getName()} and {@link #execute(JobContext)} are mandatory.
 * Every other method is an optional capability with a default; the JobManager
 * reads them once, when the job is loaded.
 * 
 * Lifecycle of one run:
 *   1. JobManager decides the job is due (or it is run on demand)
 *   2. {@link #onStart(JobContext)} is called
 *   3. {@link #execute(JobContext)} runs on its own thread
 *   4. exactly one of onComplete / onFailure / onCancellation is called
 *   5. onFixed or onBroken is called if the outcome differs from the previous run
 */
public interface Job {

    /**
     * @return unique name of the job, used as registry key
     */
    String getName();

    /**
     * Runs the job body.
     * 
     * Long-running bodies should check {@link JobContext#isCancelled()} or react
     * to thread interruption: once the invocation is cancelled the manager stops waiting.
     * 
     * @param context context of this invocation
     * @throws Exception any failure, reported as a failed invocation
     */
    void execute(JobContext context) throws Exception;

    /**
     * @return schedule of the job, or null if the job only runs on demand
     */
    default Schedule getSchedule() {
        return null;  // Default: not scheduled
    }

    /**
     * @return maximum run time of one invocation (zero = no timeout)
     */
    default Duration getTimeout() {
        return Duration.ZERO;
    }

    /**
     * @return false to keep the job from running, checked before every run
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * @return true to forbid overlapping runs of this job
     */
    default boolean isSerial() {
        return false;
    }

    /**
     * @return false to suppress lifecycle events for this job
     */
    default boolean shouldTriggerListeners() {
        return true;
    }

    /**
     * @return false to mark this job's events as not to be written to output
     */
    default boolean shouldWriteOutput() {
        return true;
    }

    // ==================== Lifecycle hooks ====================

    default void onStart(JobContext context) {
        // Default: no-op
    }

    default void onCancellation(JobContext context) {
        // Default: no-op
    }

    default void onComplete(JobContext context) {
        // Default: no-op
    }

    default void onFailure(JobContext context) {
        // Default: no-op
    }

    /**
     * Called when a run fails after a previous run succeeded.
     */
    default void onBroken(JobContext context) {
        // Default: no-op
    }

    /**
     * Called when a run succeeds after a previous run failed.
     */
    default void onFixed(JobContext context) {
        // Default: no-op
    }
}
