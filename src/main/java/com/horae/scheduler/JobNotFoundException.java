package com.horae.scheduler;

/**
 * Thrown by {@link JobManager#cancelJob(String)} when the job has no running invocation.
 */
public class JobNotFoundException extends JobManagerException {

    public JobNotFoundException(String jobName) {
        super(jobName, "job not found (not running): " + jobName);
    }
}
