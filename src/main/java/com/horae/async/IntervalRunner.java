package com.horae.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs an {@link Action} on a fixed tick until stopped.
 * 
 * The first run happens one interval after {@link #start()} (plus the optional start delay).
 * Anything thrown by the action goes to the error handler, or to the log when no
 * handler is set; it never stops the loop. Errors reach the handler wrapped in an
 * {@link ExecutionException}.
 * 
 * Lifecycle is coordinated through a {@link Latch}:
 *   - start() fails with {@link CannotStartException} unless stopped, and returns once the loop runs
 *   - stop() fails with {@link CannotStopException} unless running, and returns once the loop has exited
 * 
 * A runner can be started again after it has been stopped.
 */
public class IntervalRunner {
    private static final Logger log = LoggerFactory.getLogger(IntervalRunner.class);

    private final String name; // used for the thread name and for logging
    private final Latch latch = new Latch();

    private final Action action;
    private final Duration interval;
    private volatile Duration delay = Duration.ZERO;
    private volatile Consumer<Exception> errorHandler;

    private ScheduledExecutorService scheduler; // recreated on every start, a shut down executor cannot be reused
    private ScheduledFuture<?> tickTask;

    /**
     * Creates a new IntervalRunner.
     * 
     * @param name descriptive name (e.g. "heartbeat")
     * @param action action to run on every tick
     * @param interval time between two runs, must be positive
     */
    public IntervalRunner(String name, Action action, Duration interval) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.action = Objects.requireNonNull(action, "action cannot be null");
        this.interval = requirePositive(interval);
    }

    // ==================== Configuration (before start) ====================

    /**
     * Sets a delay applied once before the first tick.
     */
    public IntervalRunner withDelay(Duration delay) {
        this.delay = Objects.requireNonNull(delay, "delay cannot be null");
        return this;
    }

    /**
     * Sets the sink for action exceptions (null = log them).
     */
    public IntervalRunner withErrorHandler(Consumer<Exception> errorHandler) {
        this.errorHandler = errorHandler;
        return this;
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getDelay() {
        return delay;
    }

    public boolean isRunning() {
        return latch.isRunning();
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the loop and waits until it is running.
     * 
     * @throws CannotStartException if the runner is not stopped
     */
    public synchronized void start() {
        if (!latch.canStart()) {
            throw new CannotStartException("interval " + name);
        }
        latch.starting();
        CountDownLatch startedSignal = latch.notifyStarted();

        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("horae-" + name);
            thread.setDaemon(true);  // Don't prevent JVM shutdown
            return thread;
        });

        // the loop thread itself flips the latch to running
        scheduler.execute(latch::started);

        long intervalNanos = interval.toNanos();
        tickTask = scheduler.scheduleAtFixedRate(
            this::tick,
            delay.toNanos() + intervalNanos, // first tick after delay + one interval
            intervalNanos,
            TimeUnit.NANOSECONDS
        );

        awaitSignal(startedSignal);
        log.debug("[{}] Interval started (every {}ms, delay {}ms)", name, interval.toMillis(), delay.toMillis());
    }

    /**
     * Signals the loop to stop and waits until it has exited.
     * An action already in progress is allowed to finish.
     * 
     * @throws CannotStopException if the runner is not running
     */
    public synchronized void stop() {
        if (!latch.canStop()) {
            throw new CannotStopException("interval " + name);
        }
        latch.stopping();
        CountDownLatch stoppedSignal = latch.notifyStopped();

        tickTask.cancel(false);  // Don't interrupt if running
        // queued behind any running tick on the single loop thread
        scheduler.execute(latch::stopped);

        awaitSignal(stoppedSignal);
        scheduler.shutdown();
        log.debug("[{}] Interval stopped", name);
    }

    /**
     * Runs a single tick. Called periodically by the scheduler.
     */
    private void tick() {
        if (!latch.isRunning()) {
            return;
        }
        try {
            action.run();
        } catch (Exception e) {
            handleError(e);
        } catch (Throwable t) {
            // a throwable escaping tick() would cancel every later run
            handleError(new ExecutionException(t));
        }
    }

    private void handleError(Exception e) {
        Consumer<Exception> handler = errorHandler;
        if (handler == null) {
            log.warn("[{}] Interval action failed: {}", name, e.getMessage(), e);
            return;
        }
        try {
            handler.accept(e);
        } catch (Throwable t) {
            log.error("[{}] Error handler failed: {}", name, t.getMessage(), t);
        }
    }

    private void awaitSignal(CountDownLatch signal) {
        try {
            signal.await();
        } catch (InterruptedException e) {
            // give up waiting, force the loop down
            scheduler.shutdownNow();
            latch.stopped();
            Thread.currentThread().interrupt();
        }
    }

    private static Duration requirePositive(Duration interval) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        return interval;
    }
}
