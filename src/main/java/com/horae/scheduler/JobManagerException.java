package com.horae.scheduler;

/**
 * Base class of the errors raised by the {@link JobManager}.
 */
public class JobManagerException extends RuntimeException {

    private final String jobName;

    public JobManagerException(String jobName, String message) {
        super(message);
        this.jobName = jobName;
    }

    public JobManagerException(String jobName, String message, Throwable cause) {
        super(message, cause);
        this.jobName = jobName;
    }

    /**
     * @return name of the job the error refers to, may be null
     */
    public String getJobName() {
        return jobName;
    }
}
