package com.horae.scheduler;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of a {@link JobManager}.
 * 
 * Holds detached copies: later changes in the manager are not visible here,
 * and nothing here can change the manager.
 */
public final class JobManagerStatus {

    private final Instant timestamp;
    private final boolean running;
    private final List<JobMeta> jobs;
    private final Map<String, JobInvocation> runningJobs;

    JobManagerStatus(boolean running, List<JobMeta> jobs, Map<String, JobInvocation> runningJobs) {
        this.timestamp = Instant.now();
        this.running = running;
        this.jobs = Collections.unmodifiableList(jobs);
        this.runningJobs = Collections.unmodifiableMap(runningJobs);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return true if the manager was started when the snapshot was taken
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * @return copies of every loaded job, sorted by name
     */
    public List<JobMeta> getJobs() {
        return jobs;
    }

    /**
     * @return copies of the in-flight invocations, keyed by job name
     */
    public Map<String, JobInvocation> getRunningJobs() {
        return runningJobs;
    }

    @Override
    public String toString() {
        return String.format("JobManagerStatus[jobs=%d, running=%s]", jobs.size(), runningJobs.keySet());
    }
}
