package com.horae.job;

import com.horae.schedule.Schedule;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Builds a {@link Job} out of lambdas, without writing a class.
 * 
 * Example usage:
 * Job job = JobBuilder.newJob("cleanup")
 *     .schedule(Schedules.everyMinute())
 *     .timeout(Duration.ofSeconds(30))
 *     .action(ctx -> cleanup())
 *     .onFailure(ctx -> alert(ctx.getInvocation().getError()))
 *     .build();
 * 
 * Unset providers fall back to the {@link Job} defaults.
 */
public class JobBuilder {

    private String name;
    private Schedule schedule;
    private JobAction action;
    private boolean serial;

    private Supplier<Duration> timeoutProvider;
    private BooleanSupplier enabledProvider;
    private BooleanSupplier shouldTriggerListenersProvider;
    private BooleanSupplier shouldWriteOutputProvider;

    private Consumer<JobContext> onStart;
    private Consumer<JobContext> onCancellation;
    private Consumer<JobContext> onComplete;
    private Consumer<JobContext> onFailure;
    private Consumer<JobContext> onBroken;
    private Consumer<JobContext> onFixed;

    private JobBuilder(String name) {
        this.name = name;
    }

    /**
     * @param name unique job name
     * @return a new builder
     */
    public static JobBuilder newJob(String name) {
        return new JobBuilder(name);
    }

    public JobBuilder name(String name) {
        this.name = name;
        return this;
    }

    public JobBuilder schedule(Schedule schedule) {
        this.schedule = schedule;
        return this;
    }

    public JobBuilder action(JobAction action) {
        this.action = action;
        return this;
    }

    public JobBuilder serial(boolean serial) {
        this.serial = serial;
        return this;
    }

    /**
     * Sets a fixed timeout.
     */
    public JobBuilder timeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        this.timeoutProvider = () -> timeout;
        return this;
    }

    public JobBuilder timeoutProvider(Supplier<Duration> timeoutProvider) {
        this.timeoutProvider = timeoutProvider;
        return this;
    }

    public JobBuilder enabledProvider(BooleanSupplier enabledProvider) {
        this.enabledProvider = enabledProvider;
        return this;
    }

    public JobBuilder shouldTriggerListenersProvider(BooleanSupplier provider) {
        this.shouldTriggerListenersProvider = provider;
        return this;
    }

    public JobBuilder shouldWriteOutputProvider(BooleanSupplier provider) {
        this.shouldWriteOutputProvider = provider;
        return this;
    }

    // ==================== Lifecycle hooks ====================

    public JobBuilder onStart(Consumer<JobContext> receiver) {
        this.onStart = receiver;
        return this;
    }

    public JobBuilder onCancellation(Consumer<JobContext> receiver) {
        this.onCancellation = receiver;
        return this;
    }

    public JobBuilder onComplete(Consumer<JobContext> receiver) {
        this.onComplete = receiver;
        return this;
    }

    public JobBuilder onFailure(Consumer<JobContext> receiver) {
        this.onFailure = receiver;
        return this;
    }

    public JobBuilder onBroken(Consumer<JobContext> receiver) {
        this.onBroken = receiver;
        return this;
    }

    public JobBuilder onFixed(Consumer<JobContext> receiver) {
        this.onFixed = receiver;
        return this;
    }

    /**
     * Builds the job. Later changes to this builder do not affect it.
     * 
     * @return the job
     * @throws NullPointerException if no name was set
     */
    public Job build() {
        Objects.requireNonNull(name, "name cannot be null");
        return new BuiltJob(this);
    }

    /**
     * Job backed by the values captured from a builder.
     */
    private static final class BuiltJob implements Job {
        private final String name;
        private final Schedule schedule;
        private final JobAction action;
        private final boolean serial;
        private final Supplier<Duration> timeoutProvider;
        private final BooleanSupplier enabledProvider;
        private final BooleanSupplier shouldTriggerListenersProvider;
        private final BooleanSupplier shouldWriteOutputProvider;
        private final Consumer<JobContext> onStart;
        private final Consumer<JobContext> onCancellation;
        private final Consumer<JobContext> onComplete;
        private final Consumer<JobContext> onFailure;
        private final Consumer<JobContext> onBroken;
        private final Consumer<JobContext> onFixed;

        BuiltJob(JobBuilder builder) {
            this.name = builder.name;
            this.schedule = builder.schedule;
            this.action = builder.action;
            this.serial = builder.serial;
            this.timeoutProvider = builder.timeoutProvider;
            this.enabledProvider = builder.enabledProvider;
            this.shouldTriggerListenersProvider = builder.shouldTriggerListenersProvider;
            this.shouldWriteOutputProvider = builder.shouldWriteOutputProvider;
            this.onStart = builder.onStart;
            this.onCancellation = builder.onCancellation;
            this.onComplete = builder.onComplete;
            this.onFailure = builder.onFailure;
            this.onBroken = builder.onBroken;
            this.onFixed = builder.onFixed;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void execute(JobContext context) throws Exception {
            if (action != null) {
                action.run(context);
            }
        }

        @Override
        public Schedule getSchedule() {
            return schedule;
        }

        @Override
        public Duration getTimeout() {
            return timeoutProvider != null ? timeoutProvider.get() : Duration.ZERO;
        }

        @Override
        public boolean isEnabled() {
            return enabledProvider == null || enabledProvider.getAsBoolean();
        }

        @Override
        public boolean isSerial() {
            return serial;
        }

        @Override
        public boolean shouldTriggerListeners() {
            return shouldTriggerListenersProvider == null || shouldTriggerListenersProvider.getAsBoolean();
        }

        @Override
        public boolean shouldWriteOutput() {
            return shouldWriteOutputProvider == null || shouldWriteOutputProvider.getAsBoolean();
        }

        @Override
        public void onStart(JobContext context) {
            notify(onStart, context);
        }

        @Override
        public void onCancellation(JobContext context) {
            notify(onCancellation, context);
        }

        @Override
        public void onComplete(JobContext context) {
            notify(onComplete, context);
        }

        @Override
        public void onFailure(JobContext context) {
            notify(onFailure, context);
        }

        @Override
        public void onBroken(JobContext context) {
            notify(onBroken, context);
        }

        @Override
        public void onFixed(JobContext context) {
            notify(onFixed, context);
        }

        private static void notify(Consumer<JobContext> receiver, JobContext context) {
            if (receiver != null) {
                receiver.accept(context);
            }
        }

        @Override
        public String toString() {
            return "Job[" + name + "]";
        }
    }
}
