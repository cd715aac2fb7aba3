package com.horae.event;

/**
 * Receives job lifecycle events.
 * 
 * The sink decides formatting and output; the JobManager only decides
 * whether to call it, based on the job's should-trigger-listeners flag.
 * Implementations must be thread-safe: events of different jobs arrive concurrently.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Sink that drops every event.
     */
    EventSink NONE = event -> { };

    void emit(JobEvent event);
}
