package com.horae.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Fires at a fixed UTC time of day, on every day whose bit is set in a day-of-week mask.
 * 
 * @see DayOfWeekMask
 */
public final class DailySchedule implements Schedule {

    private final int dayOfWeekMask;
    private final LocalTime timeOfDayUtc;

    public DailySchedule(int dayOfWeekMask, LocalTime timeOfDayUtc) {
        if ((dayOfWeekMask & DayOfWeekMask.ALL_DAYS) == 0) {
            throw new IllegalArgumentException("day of week mask selects no day: " + dayOfWeekMask);
        }
        this.dayOfWeekMask = dayOfWeekMask;
        // only hour, minute and second are kept
        this.timeOfDayUtc = Objects.requireNonNull(timeOfDayUtc, "timeOfDayUtc cannot be null").withNano(0);
    }

    public int getDayOfWeekMask() {
        return dayOfWeekMask;
    }

    public LocalTime getTimeOfDayUtc() {
        return timeOfDayUtc;
    }

    @Override
    public Instant getNextRunTime(Instant after) {
        Instant reference = after != null ? after : Instant.now();

        LocalDate today = reference.atZone(ZoneOffset.UTC).toLocalDate();
        ZonedDateTime todayInstance = ZonedDateTime.of(today, timeOfDayUtc, ZoneOffset.UTC);

        // day 0 is today, so a time still ahead of us fires the same day
        for (int day = 0; day < 8; day++) {
            ZonedDateTime next = todayInstance.plusDays(day);
            if (DayOfWeekMask.contains(dayOfWeekMask, next.getDayOfWeek())
                && next.toInstant().isAfter(reference)) {
                return next.toInstant();
            }
        }
        // unreachable with a non-empty mask
        return Instant.EPOCH;
    }

    @Override
    public String toString() {
        return "daily at " + timeOfDayUtc + "Z (mask " + Integer.toBinaryString(dayOfWeekMask) + ")";
    }
}
