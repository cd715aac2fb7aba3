package com.horae.event;

import com.horae.job.JobContext;

/**
 * Optional tracing hook wrapped around every job invocation.
 */
@FunctionalInterface
public interface Tracer {

    /**
     * Called before the job's start hook.
     * 
     * @param context context of the invocation being started
     * @return finisher called once the invocation is over (may be null)
     */
    TraceFinisher start(JobContext context);
}
