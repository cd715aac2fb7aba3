package com.horae.job;

import com.horae.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Job that runs an external command.
 * 
 * The command's combined stdout/stderr is forwarded line by line to the log.
 * A non-zero exit code fails the invocation. If the invocation is cancelled
 * (the running thread is interrupted) the process is destroyed.
 */
public class ProcessJob extends AbstractJob {
    private static final Logger log = LoggerFactory.getLogger(ProcessJob.class);

    private final List<String> command;
    private final Duration timeout;
    private final boolean serial;

    /**
     * Creates a new ProcessJob.
     * 
     * @param name unique job name
     * @param schedule schedule of the job (null = on demand only)
     * @param command command and arguments, must not be empty
     * @param timeout maximum run time (zero = none)
     * @param serial true to forbid overlapping runs
     */
    public ProcessJob(String name, Schedule schedule, List<String> command, Duration timeout, boolean serial) {
        super(name, schedule);
        Objects.requireNonNull(command, "command cannot be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.serial = serial;
    }

    public List<String> getCommand() {
        return command;
    }

    @Override
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isSerial() {
        return serial;
    }

    @Override
    public void execute(JobContext context) throws Exception {
        String invocationId = context.getInvocation().getId();
        log.debug("[{}#{}] Running {}", getName(), invocationId, command);

        Process process = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .start();

        // readLine() is not interruptible, so output is pumped on its own thread
        Thread pump = new Thread(() -> forwardOutput(process, invocationId));
        pump.setName("horae-output-" + getName());
        pump.setDaemon(true);
        pump.start();

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            log.info("[{}#{}] Cancelled, destroying process", getName(), invocationId);
            process.destroyForcibly();
            throw e;
        }
        pump.join(1000);

        if (exitCode != 0) {
            throw new IOException(String.format("command %s exited with code %d", command, exitCode));
        }
    }

    private void forwardOutput(Process process, String invocationId) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[{}#{}] {}", getName(), invocationId, line);
            }
        } catch (IOException e) {
            // stream closed by destroy()
            log.debug("[{}#{}] Output closed: {}", getName(), invocationId, e.getMessage());
        }
    }
}
