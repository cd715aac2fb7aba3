package com.horae.cli.commands;

import com.horae.cli.ScheduleOptions;
import com.horae.schedule.Schedule;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Prints the next run times of a schedule, without running anything.
 */
@Command(name = "next", description = "Preview the next run times of a schedule")
public class NextCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    ScheduleOptions scheduleOptions;

    @Option(
        names = {"--immediately"},
        description = "Run once right away, then follow the selected schedule"
    )
    boolean immediately;

    @Option(
        names = {"-c", "--count"},
        description = "Number of run times to print (default: ${DEFAULT-VALUE})",
        defaultValue = "5"
    )
    int count;

    @Option(
        names = {"--after"},
        paramLabel = "INSTANT",
        description = "Reference time of the last run (default: never run)"
    )
    Instant after;

    @Override
    public Integer call() {
        if (count <= 0) {
            throw new ParameterException(spec.commandLine(), "--count must be positive");
        }
        Schedule schedule = ScheduleOptions.resolve(scheduleOptions, immediately, spec);
        if (schedule == null) {
            throw new ParameterException(spec.commandLine(), "A schedule option is required");
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("Schedule: " + schedule);

        Instant previous = after;
        for (int i = 1; i <= count; i++) {
            Instant next = schedule.getNextRunTime(previous);
            if (next == null) {
                out.println("  (no further runs)");
                break;
            }
            out.printf("  %d. %s%n", i, next);
            previous = next;
        }
        out.flush();
        return 0;
    }
}
