package com.horae.cli.commands;

import com.horae.cli.DurationConverter;
import com.horae.cli.ScheduleOptions;
import com.horae.event.LoggingEventSink;
import com.horae.job.ProcessJob;
import com.horae.schedule.Schedule;
import com.horae.scheduler.JobManager;
import com.horae.scheduler.JobManagerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs an external command on a schedule until the process is stopped (Ctrl+C).
 * 
 * Example:
 *   horae run --name backup --every 1h --timeout 10m -- tar czf /tmp/backup.tgz /data
 */
@Command(name = "run", description = "Run a command on a schedule until interrupted")
public class RunCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Spec
    CommandSpec spec;

    @Option(
        names = {"-n", "--name"},
        description = "Job name",
        required = true
    )
    String name;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    ScheduleOptions scheduleOptions;

    @Option(
        names = {"--immediately"},
        description = "Run once right away, then follow the selected schedule"
    )
    boolean immediately;

    @Option(
        names = {"--timeout"},
        paramLabel = "DURATION",
        description = "Cancel a run that takes longer than this",
        converter = DurationConverter.class
    )
    Duration timeout = Duration.ZERO;

    @Option(
        names = {"--serial"},
        description = "Never start a run while the previous one is still running"
    )
    boolean serial;

    @Option(
        names = {"--heartbeat"},
        paramLabel = "DURATION",
        description = "Heartbeat interval (default: $CRON_HEARTBEAT_INTERVAL or 50ms)",
        converter = DurationConverter.class
    )
    Duration heartbeat;

    @Parameters(
        arity = "1..*",
        paramLabel = "COMMAND",
        description = "Command to run, with its arguments (put it after --)"
    )
    List<String> command;

    @Override
    public Integer call() throws Exception {
        Schedule schedule = ScheduleOptions.resolve(scheduleOptions, immediately, spec);
        if (schedule == null) {
            throw new ParameterException(spec.commandLine(), "A schedule option or --immediately is required");
        }

        JobManagerConfig.Builder config = JobManagerConfig.builderFromEnvironment(System.getenv())
            .eventSink(new LoggingEventSink());
        if (heartbeat != null) {
            config.heartbeatInterval(heartbeat);
        }

        JobManager manager = new JobManager(config.build());
        manager.loadJob(new ProcessJob(name, schedule, command, timeout, serial));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            manager.shutdown();
        }, "horae-shutdown"));

        manager.start();

        System.out.println("[OK] Job '" + name + "' loaded");
        System.out.println("  Schedule: " + schedule);
        System.out.println("  Next run: " + manager.getJob(name).getNextRunTime());
        System.out.println("  Command:  " + String.join(" ", command));
        System.out.println();
        System.out.println("Press Ctrl+C to stop");

        // Keep alive, the shutdown hook shuts the manager down
        Thread.currentThread().join();
        return 0;
    }
}
