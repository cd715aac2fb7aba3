package com.horae.scheduler;

import com.horae.event.EventSink;
import com.horae.event.Tracer;
import com.horae.util.Durations;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of a {@link JobManager}.
 * 
 * Uses Builder pattern for clean, validated construction.
 * Immutable after creation.
 * 
 * Example usage:
 * JobManagerConfig config = new JobManagerConfig.Builder()
 *     .heartbeatInterval(Duration.ofMillis(100))
 *     .eventSink(new LoggingEventSink())
 *     .build();
 * 
 * JobManager manager = new JobManager(config);
 */
public class JobManagerConfig {

    /**
     * Environment variable overriding the heartbeat interval.
     */
    public static final String ENV_HEARTBEAT_INTERVAL = "CRON_HEARTBEAT_INTERVAL";

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(50);

    private final Duration heartbeatInterval;
    private final Duration reaperInterval;
    private final EventSink eventSink;
    private final Tracer tracer;

    /**
     * Private constructor - use Builder to create instances.
     */
    private JobManagerConfig(Builder builder) {
        this.heartbeatInterval = builder.heartbeatInterval;
        this.reaperInterval = builder.reaperInterval != null ? builder.reaperInterval : builder.heartbeatInterval;
        this.eventSink = builder.eventSink;
        this.tracer = builder.tracer;
    }

    /**
     * @return configuration with every default
     */
    public static JobManagerConfig defaults() {
        return new Builder().build();
    }

    /**
     * @param env environment variables, usually {@code System.getenv()}
     * @return builder pre-filled from the given environment
     * @throws IllegalArgumentException if {@value #ENV_HEARTBEAT_INTERVAL} is not a valid duration
     */
    public static Builder builderFromEnvironment(Map<String, String> env) {
        Builder builder = new Builder();
        String heartbeat = env.get(ENV_HEARTBEAT_INTERVAL);
        if (heartbeat != null && !heartbeat.isBlank()) {
            try {
                builder.heartbeatInterval(Durations.parse(heartbeat));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "Invalid " + ENV_HEARTBEAT_INTERVAL + " value '" + heartbeat + "'", e);
            }
        }
        return builder;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration getReaperInterval() {
        return reaperInterval;
    }

    public EventSink getEventSink() {
        return eventSink;
    }

    /**
     * @return tracer wrapped around every invocation, or null
     */
    public Tracer getTracer() {
        return tracer;
    }

    @Override
    public String toString() {
        return String.format("JobManagerConfig[heartbeat=%s, reaper=%s]",
                             Durations.format(heartbeatInterval), Durations.format(reaperInterval));
    }

    /**
     * Builder for JobManagerConfig with sensible defaults.
     * 
     * Defaults:
     *   - Heartbeat: 50ms
     *   - Reaper: same as heartbeat
     *   - Event sink: none
     *   - Tracer: none
     */
    public static class Builder {
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration reaperInterval;
        private EventSink eventSink = EventSink.NONE;
        private Tracer tracer;

        /**
         * Sets the tick of the heartbeat, which launches due jobs.
         */
        public Builder heartbeatInterval(Duration interval) {
            this.heartbeatInterval = requirePositive(interval, "heartbeat interval");
            return this;
        }

        /**
         * Sets the tick of the reaper, which cancels hanging jobs.
         */
        public Builder reaperInterval(Duration interval) {
            this.reaperInterval = requirePositive(interval, "reaper interval");
            return this;
        }

        public Builder eventSink(EventSink eventSink) {
            this.eventSink = Objects.requireNonNull(eventSink, "Event sink cannot be null");
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        /**
         * Builds the immutable JobManagerConfig.
         */
        public JobManagerConfig build() {
            return new JobManagerConfig(this);
        }

        private static Duration requirePositive(Duration interval, String what) {
            Objects.requireNonNull(interval, what + " cannot be null");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException(what + " must be positive, got " + interval);
            }
            return interval;
        }
    }
}
