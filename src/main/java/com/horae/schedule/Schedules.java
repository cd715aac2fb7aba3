package com.horae.schedule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;

/**
 * Factory methods for the built-in schedules. All times are UTC.
 */
public final class Schedules {

    private Schedules() {
    }

    public static IntervalSchedule everySecond() {
        return every(Duration.ofSeconds(1));
    }

    public static IntervalSchedule everyMinute() {
        return every(Duration.ofMinutes(1));
    }

    public static IntervalSchedule everyHour() {
        return every(Duration.ofHours(1));
    }

    public static IntervalSchedule every(Duration interval) {
        return new IntervalSchedule(interval);
    }

    public static DailySchedule dailyAt(int hour, int minute, int second) {
        return new DailySchedule(DayOfWeekMask.ALL_DAYS, LocalTime.of(hour, minute, second));
    }

    public static DailySchedule weekdaysAt(int hour, int minute, int second) {
        return new DailySchedule(DayOfWeekMask.WEEKDAYS, LocalTime.of(hour, minute, second));
    }

    public static DailySchedule weekendsAt(int hour, int minute, int second) {
        return new DailySchedule(DayOfWeekMask.WEEKEND_DAYS, LocalTime.of(hour, minute, second));
    }

    public static DailySchedule weeklyAt(int hour, int minute, int second, DayOfWeek... days) {
        return new DailySchedule(DayOfWeekMask.of(days), LocalTime.of(hour, minute, second));
    }

    public static OnTheHourAt everyHourOnTheHour() {
        return new OnTheHourAt(0, 0);
    }

    public static OnTheHourAt everyHourAt(int minute, int second) {
        return new OnTheHourAt(minute, second);
    }

    public static OnceAtSchedule onceAt(Instant time) {
        return new OnceAtSchedule(time);
    }

    /**
     * @return a schedule that fires right away; chain {@link ImmediateSchedule#then(Schedule)} to keep going
     */
    public static ImmediateSchedule immediately() {
        return new ImmediateSchedule();
    }
}
