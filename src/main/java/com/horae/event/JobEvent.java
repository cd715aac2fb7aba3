package com.horae.event;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A single lifecycle event for one job invocation.
 * 
 * Immutable. Created by the JobManager and handed to an {@link EventSink}.
 */
public final class JobEvent {

    private final EventFlag flag;
    private final String jobName;
    private final String invocationId;
    private final Instant timestamp;
    private final Duration elapsed; // null for STARTED
    private final Throwable error;  // set for FAILED only
    private final boolean writable;

    /**
     * Private constructor - use factory methods.
     */
    private JobEvent(EventFlag flag, String jobName, String invocationId,
                     Duration elapsed, Throwable error, boolean writable) {
        this.flag = Objects.requireNonNull(flag, "flag cannot be null");
        this.jobName = Objects.requireNonNull(jobName, "jobName cannot be null");
        this.invocationId = invocationId;
        this.timestamp = Instant.now();
        this.elapsed = elapsed;
        this.error = error;
        this.writable = writable;
    }

    // ==================== Factory Methods ====================

    public static JobEvent started(String jobName, String invocationId, boolean writable) {
        return new JobEvent(EventFlag.STARTED, jobName, invocationId, null, null, writable);
    }

    public static JobEvent finished(EventFlag flag, String jobName, String invocationId,
                                    Duration elapsed, boolean writable) {
        return new JobEvent(flag, jobName, invocationId, elapsed, null, writable);
    }

    public static JobEvent failed(String jobName, String invocationId, Duration elapsed,
                                  Throwable error, boolean writable) {
        return new JobEvent(EventFlag.FAILED, jobName, invocationId, elapsed, error, writable);
    }

    // ==================== Getters ====================

    public EventFlag getFlag() {
        return flag;
    }

    public String getJobName() {
        return jobName;
    }

    public String getInvocationId() {
        return invocationId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return elapsed time of the invocation, or null for STARTED
     */
    public Duration getElapsed() {
        return elapsed;
    }

    /**
     * @return the failure cause, or null
     */
    public Throwable getError() {
        return error;
    }

    /**
     * @return false if the job asked for its events not to be written to output
     */
    public boolean isWritable() {
        return writable;
    }

    public boolean isComplete() {
        return flag == EventFlag.COMPLETE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(flag).append("] ").append(jobName);
        if (elapsed != null) {
            sb.append(" (").append(elapsed.toMillis()).append("ms)");
        }
        if (error != null) {
            sb.append(": ").append(error.getMessage());
        }
        return sb.toString();
    }
}
