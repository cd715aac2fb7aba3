package com.horae.scheduler;

import com.horae.async.CannotStartException;
import com.horae.async.CannotStopException;
import com.horae.async.IntervalRunner;
import com.horae.async.Latch;
import com.horae.event.EventFlag;
import com.horae.event.EventSink;
import com.horae.event.JobEvent;
import com.horae.event.TraceFinisher;
import com.horae.event.Tracer;
import com.horae.job.Job;
import com.horae.job.JobContext;
import com.horae.schedule.Schedule;
import com.horae.util.InvocationIds;
import com.horae.util.Times;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Loads jobs, runs them on their schedules and keeps track of their invocations.
 *
 * Two background loops drive the manager once started:
 *   - heartbeat: launches every job whose next run time has passed
 *   - reaper: cancels invocations past their timeout or past their next run time
 *
 * Lifecycle of one invocation:
 *   1. Heartbeat (or runJob) finds the job due and allowed to run
 *   2. Next run time is recomputed, a JobInvocation is registered as running
 *   3. execute() runs on its own thread: tracer, STARTED event, onStart hook
 *   4. The job body runs on a nested thread, raced against cancellation
 *   5. Cleanup: invocation removed from running, outcome classified,
 *      COMPLETE / FAILED / CANCELLED plus FIXED / BROKEN emitted, hooks called
 *   6. The invocation becomes the job's last invocation
 *
 * Registry and running map share one lock. It is held for the critical
 * sections only, never while a job body runs.
 * Execution errors never reach the caller of a manager method: they are visible
 * through events, job hooks and {@link #status()}.
 */
public class JobManager {
    private static final Logger log = LoggerFactory.getLogger(JobManager.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Object lock = new Object();
    private final Object lifecycleLock = new Object();

    // guarded by lock
    private final Map<String, JobMeta> jobs = new HashMap<>();
    private final Map<String, JobInvocation> running = new HashMap<>();

    private final Latch latch = new Latch();
    private final IntervalRunner heartbeat;
    private final IntervalRunner reaper;

    private final ExecutorService executions;
    private final ExecutorService bodies;

    private volatile EventSink eventSink;
    private volatile Tracer tracer;

    /**
     * Creates a manager with the default configuration.
     */
    public JobManager() {
        this(JobManagerConfig.defaults());
    }

    /**
     * Creates a new JobManager. Nothing runs until {@link #start()}.
     *
     * @param config heartbeat/reaper intervals, event sink and tracer
     */
    public JobManager(JobManagerConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.eventSink = config.getEventSink();
        this.tracer = config.getTracer();

        this.heartbeat = new IntervalRunner("heartbeat", this::runDueJobs, config.getHeartbeatInterval())
            .withErrorHandler(e -> log.error("Heartbeat tick failed: {}", e.getMessage(), e));
        this.reaper = new IntervalRunner("reaper", this::killHangingJobs, config.getReaperInterval())
            .withErrorHandler(e -> log.error("Reaper tick failed: {}", e.getMessage(), e));

        this.executions = Executors.newCachedThreadPool(daemonThreads("horae-job-"));
        this.bodies = Executors.newCachedThreadPool(daemonThreads("horae-body-"));

        log.debug("JobManager created with {}", config);
    }

    /**
     * Replaces the event sink. Meant to be called before {@link #start()}.
     */
    public JobManager withEventSink(EventSink eventSink) {
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink cannot be null");
        return this;
    }

    /**
     * Sets the tracer wrapped around every invocation (null disables tracing).
     */
    public JobManager withTracer(Tracer tracer) {
        this.tracer = tracer;
        return this;
    }

    // ==================== Registry ====================

    /**
     * Registers a job. If the job has a schedule, its first run time is computed now.
     *
     * @throws JobAlreadyLoadedException if a job with the same name is loaded
     */
    public void loadJob(Job job) {
        Objects.requireNonNull(job, "job cannot be null");
        synchronized (lock) {
            if (jobs.containsKey(job.getName())) {
                throw new JobAlreadyLoadedException(job.getName());
            }
            JobMeta meta = new JobMeta(job);
            Schedule schedule = meta.getSchedule();
            if (schedule != null) {
                meta.setNextRunTime(schedule.getNextRunTime(null));
            }
            jobs.put(meta.getName(), meta);
            log.debug("Loaded job {} (next run: {})", meta.getName(), meta.getNextRunTime());
        }
    }

    /**
     * Loads jobs in order, stopping at the first failure.
     */
    public void loadJobs(Job... jobsToLoad) {
        for (Job job : jobsToLoad) {
            loadJob(job);
        }
    }

    public void enableJob(String name) {
        synchronized (lock) {
            requireLoaded(name).setDisabled(false);
        }
        log.debug("Enabled job {}", name);
    }

    public void enableJobs(String... names) {
        for (String name : names) {
            enableJob(name);
        }
    }

    /**
     * Keeps a job from running, on schedule or on demand, until enabled again.
     */
    public void disableJob(String name) {
        synchronized (lock) {
            requireLoaded(name).setDisabled(true);
        }
        log.debug("Disabled job {}", name);
    }

    public void disableJobs(String... names) {
        for (String name : names) {
            disableJob(name);
        }
    }

    public boolean hasJob(String name) {
        synchronized (lock) {
            return jobs.containsKey(name);
        }
    }

    /**
     * @return a detached copy of the job's registry entry
     * @throws JobNotLoadedException if the job is not loaded
     */
    public JobMeta getJob(String name) {
        synchronized (lock) {
            return requireLoaded(name).copy();
        }
    }

    /**
     * @return true if the job was disabled or reports itself as not enabled
     * @throws JobNotLoadedException if the job is not loaded
     */
    public boolean isJobDisabled(String name) {
        synchronized (lock) {
            JobMeta meta = requireLoaded(name);
            return meta.isDisabled() || !meta.currentlyEnabled();
        }
    }

    public boolean isJobRunning(String name) {
        synchronized (lock) {
            return running.containsKey(name);
        }
    }

    // ==================== On-demand runs ====================

    /**
     * Runs a job now, regardless of its schedule. The run is still skipped if the
     * job is disabled, or serial and already running.
     *
     * @throws JobNotLoadedException if the job is not loaded
     */
    public void runJob(String name) {
        synchronized (lock) {
            runJobUnsafe(requireLoaded(name));
        }
    }

    /**
     * Runs several jobs now. All names are checked before anything runs.
     */
    public void runJobs(String... names) {
        synchronized (lock) {
            List<JobMeta> metas = new ArrayList<>(names.length);
            for (String name : names) {
                metas.add(requireLoaded(name));
            }
            for (JobMeta meta : metas) {
                runJobUnsafe(meta);
            }
        }
    }

    public void runAllJobs() {
        synchronized (lock) {
            for (JobMeta meta : jobs.values()) {
                launchIsolated(meta);
            }
        }
    }

    /**
     * Cancels the running invocation of a job. Does not wait for it to finish.
     *
     * @throws JobNotFoundException if the job has no running invocation
     */
    public void cancelJob(String name) {
        synchronized (lock) {
            JobInvocation invocation = running.get(name);
            if (invocation == null) {
                throw new JobNotFoundException(name);
            }
            invocation.cancel();
            log.info("Cancelled job {} (invocation {})", name, invocation.getId());
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the heartbeat and the reaper. Returns once both are running.
     *
     * @throws CannotStartException if the manager is not stopped, or has been shut down
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (!latch.canStart() || executions.isShutdown()) {
                throw new CannotStartException("job manager");
            }
            latch.starting();
            try {
                heartbeat.start();
                reaper.start();
            } catch (RuntimeException e) {
                if (heartbeat.isRunning()) {
                    heartbeat.stop();
                }
                latch.reset();
                throw e;
            }
            latch.started();
        }
        log.info("JobManager started (heartbeat={}ms, reaper={}ms)",
                 heartbeat.getInterval().toMillis(), reaper.getInterval().toMillis());
    }

    /**
     * Stops the heartbeat, then the reaper. Invocations already running are not cancelled.
     *
     * @throws CannotStopException if the manager is not running
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!latch.canStop()) {
                throw new CannotStopException("job manager");
            }
            latch.stopping();
            heartbeat.stop();
            reaper.stop();
            latch.stopped();
        }
        log.info("JobManager stopped");
    }

    /**
     * Stops the manager if it is running and releases its threads.
     * Running invocations get {@value #SHUTDOWN_TIMEOUT_SECONDS} seconds to finish,
     * then they are interrupted. The manager cannot be started again afterwards.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (latch.canStop()) {
                stop();
            }
            executions.shutdown();
        }
        try {
            if (!executions.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Jobs still running after {} seconds, interrupting them", SHUTDOWN_TIMEOUT_SECONDS);
                executions.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("JobManager shutdown interrupted", e);
            executions.shutdownNow();
            Thread.currentThread().interrupt();
        }
        bodies.shutdownNow();
        log.info("JobManager shutdown complete");
    }

    /**
     * @return true if the manager and both of its loops are running
     */
    public boolean isRunning() {
        return latch.isRunning() && heartbeat.isRunning() && reaper.isRunning();
    }

    /**
     * @return signal released when the current start completes
     */
    public CountDownLatch notifyStarted() {
        return latch.notifyStarted();
    }

    /**
     * The stopped signal is re-armed when a stop begins, so waiters
     * should fetch it once the manager is stopping.
     *
     * @return signal released when the current stop completes
     */
    public CountDownLatch notifyStopped() {
        return latch.notifyStopped();
    }

    /**
     * @return detached snapshot of every loaded job and every running invocation
     */
    public JobManagerStatus status() {
        synchronized (lock) {
            List<JobMeta> jobCopies = new ArrayList<>(jobs.size());
            for (JobMeta meta : jobs.values()) {
                jobCopies.add(meta.copy());
            }
            jobCopies.sort(Comparator.comparing(JobMeta::getName));

            Map<String, JobInvocation> runningCopies = new HashMap<>();
            for (Map.Entry<String, JobInvocation> entry : running.entrySet()) {
                runningCopies.put(entry.getKey(), entry.getValue().copy());
            }
            return new JobManagerStatus(latch.isRunning(), jobCopies, runningCopies);
        }
    }

    // ==================== Heartbeat & reaper ====================

    /**
     * Heartbeat tick: launches every job whose next run time has passed.
     */
    void runDueJobs() {
        synchronized (lock) {
            Instant now = Instant.now();
            for (JobMeta meta : jobs.values()) {
                Instant next = meta.getNextRunTime();
                if (next != null && next.isBefore(now)) {
                    launchIsolated(meta);
                }
            }
        }
    }

    /**
     * Reaper tick: cancels invocations past their deadline, which is the earlier
     * of their own timeout and the next run time of their job.
     */
    void killHangingJobs() {
        synchronized (lock) {
            Instant now = Instant.now();
            for (JobInvocation invocation : running.values()) {
                if (invocation.isCancelled()) {
                    continue;
                }
                Instant deadline = Times.min(invocation.getTimeout(), invocation.getJobMeta().getNextRunTime());
                if (deadline != null && deadline.isBefore(now)) {
                    log.warn("Job {} (invocation {}) is past its deadline {}, cancelling",
                             invocation.getName(), invocation.getId(), deadline);
                    invocation.cancel();
                }
            }
        }
    }

    /**
     * Launches one job on behalf of a loop over the registry. A job whose
     * capabilities or schedule throw is unscheduled so the other jobs still run.
     * Caller must hold the lock.
     */
    private void launchIsolated(JobMeta meta) {
        try {
            runJobUnsafe(meta);
        } catch (RuntimeException e) {
            log.error("Job {} could not be launched, unscheduling it: {}", meta.getName(), e.getMessage(), e);
            meta.setNextRunTime(null);
        }
    }

    private boolean jobCanRun(JobMeta meta) {
        if (meta.isDisabled()) {
            return false;
        }
        if (!meta.currentlyEnabled()) {
            return false;
        }
        if (meta.isSerial() && running.containsKey(meta.getName())) {
            log.debug("Serial job {} is still running, skipping", meta.getName());
            return false;
        }
        return true;
    }

    /**
     * Launches one run of the job. Caller must hold the lock.
     */
    private void runJobUnsafe(JobMeta meta) {
        if (!jobCanRun(meta)) {
            return;
        }
        Instant now = Instant.now();

        Schedule schedule = meta.getSchedule();
        meta.setNextRunTime(schedule != null ? schedule.getNextRunTime(now) : null);

        Duration timeout = meta.currentTimeout();
        Instant deadline = timeout.isZero() || timeout.isNegative() ? null : now.plus(timeout);

        JobInvocation invocation = new JobInvocation(InvocationIds.newId(), meta, now, deadline);
        running.put(meta.getName(), invocation);

        try {
            executions.execute(() -> execute(invocation));
        } catch (RejectedExecutionException e) {
            running.remove(meta.getName(), invocation);
            throw new JobManagerException(meta.getName(), "cannot launch job " + meta.getName(), e);
        }
        log.debug("Launched job {} (invocation {}, next run: {})",
                  meta.getName(), invocation.getId(), meta.getNextRunTime());
    }

    // ==================== Execution ====================

    /**
     * Runs one invocation to completion. Runs on an execution thread.
     */
    private void execute(JobInvocation invocation) {
        JobMeta meta = invocation.getJobMeta();
        Job job = meta.getJob();
        JobContext context = new JobContext(invocation);

        TraceFinisher finisher = null;
        Throwable error = null;
        try {
            Tracer currentTracer = tracer;
            if (currentTracer != null) {
                finisher = currentTracer.start(context);
            }

            emit(meta, JobEvent.started(meta.getName(), invocation.getId(), meta.shouldWriteOutput()));
            try {
                job.onStart(context);
            } catch (RuntimeException e) {
                log.error("Hook onStart of job {} failed: {}", meta.getName(), e.getMessage(), e);
            }

            error = runBody(job, context, invocation);
        } catch (Exception e) {
            log.error("Job {} could not be started: {}", meta.getName(), e.getMessage(), e);
            error = e;
        } catch (Throwable t) {
            log.error("Job {} could not be started: {}", meta.getName(), t.getMessage(), t);
            error = new JobPanicException(meta.getName(), t);
        } finally {
            complete(meta, invocation, context, finisher, error);
        }
    }

    /**
     * Runs the body on a nested thread and waits for it or for cancellation,
     * whichever comes first. A cancelled body is interrupted, not joined.
     *
     * @return the error of the run, null on success
     */
    private Throwable runBody(Job job, JobContext context, JobInvocation invocation) {
        String name = invocation.getName();
        CompletableFuture<Optional<Throwable>> outcome = new CompletableFuture<>();

        invocation.cancellationSignal()
            .thenRun(() -> outcome.complete(Optional.of(new JobCancelledException(name))));

        Future<?> body = bodies.submit(() -> {
            Throwable result = null;
            try {
                job.execute(context);
            } catch (Exception e) {
                result = e;
            } catch (Throwable t) {
                result = new JobPanicException(name, t);
            }
            outcome.complete(Optional.ofNullable(result));
        });
        invocation.attachBody(body);

        try {
            return outcome.get().orElse(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            invocation.cancel();
            return new JobCancelledException(name);
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    private void complete(JobMeta meta, JobInvocation invocation, JobContext context,
                          TraceFinisher finisher, Throwable error) {
        String name = meta.getName();
        if (finisher != null) {
            try {
                finisher.finish(context);
            } catch (Throwable t) {
                log.error("Tracer failed to finish job {}: {}", name, t.getMessage(), t);
            }
        }

        synchronized (lock) {
            running.remove(name, invocation);
        }

        Duration elapsed = Duration.between(invocation.getStartTime(), Instant.now());
        if (!invocation.complete(error, elapsed)) {
            error = invocation.getError();
            elapsed = invocation.getElapsed();
        }
        boolean writable = meta.shouldWriteOutput();

        if (error instanceof JobCancelledException) {
            log.debug("Job {} cancelled after {}ms", name, elapsed.toMillis());
            emit(meta, JobEvent.finished(EventFlag.CANCELLED, name, invocation.getId(), elapsed, writable));
            callHook(meta, "onCancellation", meta.getJob()::onCancellation, context);
        } else if (error != null) {
            log.error("Job {} failed after {}ms: {}", name, elapsed.toMillis(), error.getMessage());
            emit(meta, JobEvent.failed(name, invocation.getId(), elapsed, error, writable));
            callHook(meta, "onFailure", meta.getJob()::onFailure, context);
        } else {
            log.debug("Job {} completed in {}ms", name, elapsed.toMillis());
            emit(meta, JobEvent.finished(EventFlag.COMPLETE, name, invocation.getId(), elapsed, writable));
            callHook(meta, "onComplete", meta.getJob()::onComplete, context);
        }

        JobInvocation previous = meta.getLast();
        if (previous != null) {
            if (error == null && previous.getError() != null) {
                log.info("Job {} fixed", name);
                emit(meta, JobEvent.finished(EventFlag.FIXED, name, invocation.getId(), elapsed, writable));
                callHook(meta, "onFixed", meta.getJob()::onFixed, context);
            } else if (error != null && !(error instanceof JobCancelledException) && previous.getError() == null) {
                log.warn("Job {} broken", name);
                emit(meta, JobEvent.finished(EventFlag.BROKEN, name, invocation.getId(), elapsed, writable));
                callHook(meta, "onBroken", meta.getJob()::onBroken, context);
            }
        }

        synchronized (lock) {
            meta.setLast(invocation);
        }
    }

    // ==================== Helpers ====================

    private void emit(JobMeta meta, JobEvent event) {
        if (!meta.shouldTriggerListeners()) {
            return;
        }
        try {
            eventSink.emit(event);
        } catch (Throwable t) {
            log.error("Event sink failed on {}: {}", event, t.getMessage(), t);
        }
    }

    /**
     * Calls a completion hook. A failing hook is logged and never changes the recorded outcome.
     */
    private static void callHook(JobMeta meta, String hook, Consumer<JobContext> callback, JobContext context) {
        try {
            callback.accept(context);
        } catch (Throwable t) {
            log.error("Hook {} of job {} failed: {}", hook, meta.getName(), t.getMessage(), t);
        }
    }

    private JobMeta requireLoaded(String name) {
        JobMeta meta = jobs.get(name);
        if (meta == null) {
            throw new JobNotLoadedException(name);
        }
        return meta;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
