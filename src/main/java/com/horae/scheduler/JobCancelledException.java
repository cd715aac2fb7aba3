package com.horae.scheduler;

/**
 * Error recorded on an invocation that was cancelled: by timeout, by the reaper
 * or by an explicit {@link JobManager#cancelJob(String)}.
 * 
 * Job bodies may also throw it from {@link com.horae.job.JobContext#throwIfCancelled()}.
 */
public class JobCancelledException extends JobManagerException {

    public JobCancelledException(String jobName) {
        super(jobName, "job cancelled: " + jobName);
    }
}
