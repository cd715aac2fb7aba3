package com.horae.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * One run of a job.
 * 
 * Created by the {@link JobManager} when the job is launched. Error and elapsed
 * time are set exactly once, when the run completes or is cancelled.
 * Instances returned by {@link JobManager#status()} are detached copies.
 */
public final class JobInvocation {

    private final String id;
    private final String name;
    private final Instant startTime;
    private final Instant timeout; // absolute deadline, null = none
    private final JobMeta jobMeta; // null on copies

    private final CompletableFuture<Void> cancellation;
    private volatile Future<?> body;

    private volatile Throwable error;
    private volatile Duration elapsed;

    JobInvocation(String id, JobMeta jobMeta, Instant startTime, Instant timeout) {
        this(id, Objects.requireNonNull(jobMeta, "jobMeta cannot be null").getName(),
             jobMeta, startTime, timeout, new CompletableFuture<>());
    }

    private JobInvocation(String id, String name, JobMeta jobMeta, Instant startTime,
                          Instant timeout, CompletableFuture<Void> cancellation) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = name;
        this.jobMeta = jobMeta;
        this.startTime = Objects.requireNonNull(startTime, "startTime cannot be null");
        this.timeout = timeout;
        this.cancellation = cancellation;
    }

    // ==================== Getters ====================

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Instant getStartTime() {
        return startTime;
    }

    /**
     * @return absolute deadline of this run, or null if the job has no timeout
     */
    public Instant getTimeout() {
        return timeout;
    }

    /**
     * @return the failure of this run, or null while running / on success
     */
    public Throwable getError() {
        return error;
    }

    /**
     * @return duration of the run, or null while running
     */
    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isCancelled() {
        return cancellation.isDone();
    }

    public boolean isCompleted() {
        return elapsed != null;
    }

    // ==================== Manager side ====================

    JobMeta getJobMeta() {
        return jobMeta;
    }

    CompletableFuture<Void> cancellationSignal() {
        return cancellation;
    }

    /**
     * Attaches the future of the running body, so that cancel() can interrupt it.
     */
    void attachBody(Future<?> body) {
        this.body = body;
        if (isCancelled()) {
            body.cancel(true);
        }
    }

    /**
     * Fires the cancellation signal and interrupts the body. Idempotent.
     */
    void cancel() {
        cancellation.complete(null);
        Future<?> current = body;
        if (current != null) {
            current.cancel(true);
        }
    }

    /**
     * Records the outcome. Only the first call has an effect.
     *
     * @return false if the outcome was already recorded
     */
    synchronized boolean complete(Throwable error, Duration elapsed) {
        Objects.requireNonNull(elapsed, "elapsed cannot be null");
        if (this.elapsed != null) {
            return false;
        }
        this.error = error;
        this.elapsed = elapsed;
        return true;
    }

    /**
     * @return a detached copy, without manager references
     */
    JobInvocation copy() {
        CompletableFuture<Void> signal = new CompletableFuture<>();
        if (isCancelled()) {
            signal.complete(null);
        }
        JobInvocation copy = new JobInvocation(id, name, null, startTime, timeout, signal);
        synchronized (this) {
            copy.error = error;
            copy.elapsed = elapsed;
        }
        return copy;
    }

    @Override
    public String toString() {
        return "JobInvocation[" + name + "#" + id + ", started=" + startTime
                + (elapsed != null ? ", elapsed=" + elapsed.toMillis() + "ms" : ", running")
                + (error != null ? ", error=" + error.getMessage() : "") + "]";
    }
}
