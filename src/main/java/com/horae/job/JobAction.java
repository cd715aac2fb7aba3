package com.horae.job;

/**
 * Body of a job built with {@link JobBuilder}.
 */
@FunctionalInterface
public interface JobAction {

    void run(JobContext context) throws Exception;
}
