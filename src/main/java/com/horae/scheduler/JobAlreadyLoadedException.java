package com.horae.scheduler;

/**
 * Thrown when a job with the same name is already registered.
 */
public class JobAlreadyLoadedException extends JobManagerException {

    public JobAlreadyLoadedException(String jobName) {
        super(jobName, "job already loaded: " + jobName);
    }
}
