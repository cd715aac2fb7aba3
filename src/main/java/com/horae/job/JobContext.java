package com.horae.job;

import com.horae.scheduler.JobCancelledException;
import com.horae.scheduler.JobInvocation;

import java.util.Objects;

/**
 * Context passed to {@link Job#execute(JobContext)} and to every lifecycle hook.
 * Gives access to the current invocation and to its cancellation state.
 */
public final class JobContext {

    private final JobInvocation invocation;

    public JobContext(JobInvocation invocation) {
        this.invocation = Objects.requireNonNull(invocation, "invocation cannot be null");
    }

    public JobInvocation getInvocation() {
        return invocation;
    }

    public String getJobName() {
        return invocation.getName();
    }

    /**
     * @return true once the invocation was cancelled (timeout, reaper or explicit cancel)
     */
    public boolean isCancelled() {
        return invocation.isCancelled();
    }

    /**
     * Cooperative cancellation point for job bodies.
     * 
     * @throws JobCancelledException if the invocation was cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException(invocation.getName());
        }
    }

    @Override
    public String toString() {
        return "JobContext[" + invocation.getName() + "#" + invocation.getId() + "]";
    }
}
