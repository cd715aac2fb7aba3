package com.horae.scheduler;

/**
 * Thrown when an operation names a job that is not in the registry.
 */
public class JobNotLoadedException extends JobManagerException {

    public JobNotLoadedException(String jobName) {
        super(jobName, "job not loaded: " + jobName);
    }
}
