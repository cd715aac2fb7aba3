package com.horae.scheduler;

import com.horae.job.Job;
import com.horae.schedule.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Registry entry of a loaded job.
 * 
 * Capabilities of the job are captured once, at load time, as providers that are
 * queried on every use. Mutable state (disabled flag, next run time,
 * last invocation) is only changed by the {@link JobManager} under its lock.
 * Copies handed out by the manager carry no schedule; use {@link #getNextRunTime()}.
 */
public final class JobMeta {

    private final String name;
    private final Job job;
    private final Schedule schedule;

    private final Supplier<Duration> timeoutProvider;
    private final BooleanSupplier enabledProvider;
    private final BooleanSupplier serialProvider;
    private final BooleanSupplier triggerListenersProvider;
    private final BooleanSupplier writeOutputProvider;

    private volatile boolean disabled;
    private volatile Instant nextRunTime; // null = never
    private volatile JobInvocation last;

    JobMeta(Job job) {
        this.job = Objects.requireNonNull(job, "job cannot be null");
        this.name = Objects.requireNonNull(job.getName(), "job name cannot be null");
        this.schedule = job.getSchedule();
        this.timeoutProvider = job::getTimeout;
        this.enabledProvider = job::isEnabled;
        this.serialProvider = job::isSerial;
        this.triggerListenersProvider = job::shouldTriggerListeners;
        this.writeOutputProvider = job::shouldWriteOutput;
    }

    private JobMeta(JobMeta other) {
        this.name = other.name;
        this.job = other.job;
        this.schedule = null; // schedules may be stateful, snapshots must not drive them
        this.timeoutProvider = other.timeoutProvider;
        this.enabledProvider = other.enabledProvider;
        this.serialProvider = other.serialProvider;
        this.triggerListenersProvider = other.triggerListenersProvider;
        this.writeOutputProvider = other.writeOutputProvider;
        this.disabled = other.disabled;
        this.nextRunTime = other.nextRunTime;
        JobInvocation previous = other.last;
        this.last = previous != null ? previous.copy() : null;
    }

    // ==================== Getters ====================

    public String getName() {
        return name;
    }

    public Job getJob() {
        return job;
    }

    /**
     * @return schedule of the job, null if it only runs on demand.
     *         Always null on the copies returned by {@link JobManager#getJob} and {@link JobManager#status()}
     */
    public Schedule getSchedule() {
        return schedule;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public boolean isSerial() {
        return serialProvider.getAsBoolean();
    }

    public boolean shouldTriggerListeners() {
        return triggerListenersProvider.getAsBoolean();
    }

    public boolean shouldWriteOutput() {
        return writeOutputProvider.getAsBoolean();
    }

    /**
     * @return next time the heartbeat runs the job, null if never
     */
    public Instant getNextRunTime() {
        return nextRunTime;
    }

    /**
     * @return the last completed invocation, null if the job never completed a run
     */
    public JobInvocation getLast() {
        return last;
    }

    // ==================== Manager side ====================

    /**
     * @return current timeout, zero or negative means none
     */
    Duration currentTimeout() {
        Duration timeout = timeoutProvider.get();
        return timeout != null ? timeout : Duration.ZERO;
    }

    boolean currentlyEnabled() {
        return enabledProvider.getAsBoolean();
    }

    void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    void setNextRunTime(Instant nextRunTime) {
        this.nextRunTime = nextRunTime;
    }

    void setLast(JobInvocation last) {
        this.last = last;
    }

    JobMeta copy() {
        return new JobMeta(this);
    }

    @Override
    public String toString() {
        return "JobMeta[" + name + ", next=" + nextRunTime + (disabled ? ", disabled" : "") + "]";
    }
}
