package com.horae.event;

import com.horae.job.JobContext;

/**
 * Closes a trace opened by a {@link Tracer}.
 */
@FunctionalInterface
public interface TraceFinisher {

    void finish(JobContext context);
}
