package com.horae.scheduler;

/**
 * Wraps a non-Exception throwable (an Error) raised by a job body,
 * so that it is reported as a failure of that invocation only.
 */
public class JobPanicException extends JobManagerException {

    public JobPanicException(String jobName, Throwable cause) {
        super(jobName, "job panicked: " + jobName + ": " + cause, cause);
    }
}
