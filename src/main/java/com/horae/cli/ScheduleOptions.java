package com.horae.cli;

import com.horae.schedule.Schedule;
import com.horae.schedule.Schedules;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Model.CommandSpec;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

/**
 * Mutually exclusive schedule options shared by the run and next commands.
 * 
 * Used as {@code @ArgGroup(exclusive = true, multiplicity = "0..1")}; at most one
 * schedule can be selected. Times of day are UTC.
 */
public class ScheduleOptions {

    @ArgGroup(exclusive = false, multiplicity = "0..1")
    EveryOptions every;

    @Option(
        names = {"--daily"},
        paramLabel = "HH:MM[:SS]",
        description = "Every day at the given time"
    )
    LocalTime daily;

    @Option(
        names = {"--weekdays"},
        paramLabel = "HH:MM[:SS]",
        description = "Monday to Friday at the given time"
    )
    LocalTime weekdays;

    @Option(
        names = {"--weekends"},
        paramLabel = "HH:MM[:SS]",
        description = "Saturday and Sunday at the given time"
    )
    LocalTime weekends;

    @ArgGroup(exclusive = false, multiplicity = "0..1")
    WeeklyOptions weekly;

    @Option(
        names = {"--hourly-at"},
        paramLabel = "MM:SS",
        description = "Every hour at the given minute and second"
    )
    String hourlyAt;

    @Option(
        names = {"--once"},
        paramLabel = "INSTANT",
        description = "Once, at the given instant (e.g. 2030-01-01T09:00:00Z)"
    )
    Instant once;

    static class EveryOptions {
        @Option(
            names = {"--every"},
            paramLabel = "DURATION",
            description = "Fixed interval (e.g. 500ms, 10s, 5m, 1h)",
            converter = DurationConverter.class,
            required = true
        )
        Duration interval;

        @Option(
            names = {"--start-delay"},
            paramLabel = "DURATION",
            description = "Extra delay before the first run",
            converter = DurationConverter.class
        )
        Duration startDelay;
    }

    static class WeeklyOptions {
        @Option(
            names = {"--weekly"},
            paramLabel = "HH:MM[:SS]",
            description = "On the days given by --days, at the given time",
            required = true
        )
        LocalTime at;

        @Option(
            names = {"--days"},
            paramLabel = "DAY",
            description = "Comma separated days for --weekly (e.g. MON,WED,FRI)",
            split = ",",
            converter = DayOfWeekConverter.class,
            required = true
        )
        List<DayOfWeek> days;
    }

    /**
     * Builds the selected schedule.
     * 
     * @param options parsed options, null if no schedule option was given
     * @param immediately run once right away, then follow the selected schedule
     * @param spec command spec, used to report invalid values
     * @return the schedule, or null if nothing was selected
     */
    public static Schedule resolve(ScheduleOptions options, boolean immediately, CommandSpec spec) {
        Schedule selected = options != null ? options.toSchedule(spec) : null;
        if (immediately) {
            return Schedules.immediately().then(selected);
        }
        return selected;
    }

    Schedule toSchedule(CommandSpec spec) {
        if (every != null) {
            return every.startDelay != null
                ? Schedules.every(every.interval).withStartDelay(every.startDelay)
                : Schedules.every(every.interval);
        }
        if (daily != null) {
            return Schedules.dailyAt(daily.getHour(), daily.getMinute(), daily.getSecond());
        }
        if (weekdays != null) {
            return Schedules.weekdaysAt(weekdays.getHour(), weekdays.getMinute(), weekdays.getSecond());
        }
        if (weekends != null) {
            return Schedules.weekendsAt(weekends.getHour(), weekends.getMinute(), weekends.getSecond());
        }
        if (weekly != null) {
            return Schedules.weeklyAt(weekly.at.getHour(), weekly.at.getMinute(), weekly.at.getSecond(),
                                      weekly.days.toArray(new DayOfWeek[0]));
        }
        if (hourlyAt != null) {
            return parseHourlyAt(hourlyAt, spec);
        }
        if (once != null) {
            return Schedules.onceAt(once);
        }
        return null;
    }

    private static Schedule parseHourlyAt(String value, CommandSpec spec) {
        String[] parts = value.split(":");
        try {
            if (parts.length == 2) {
                return Schedules.everyHourAt(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
            }
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(),
                "Invalid value for --hourly-at: '" + value + "' (" + e.getMessage() + ")");
        }
        throw new ParameterException(spec.commandLine(),
            "Invalid value for --hourly-at: '" + value + "' (expected MM:SS)");
    }
}
