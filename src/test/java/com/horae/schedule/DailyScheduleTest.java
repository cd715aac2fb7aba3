package com.horae.schedule;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DailyScheduleTest {

    // 2024-01-01 is a Monday
    private static final Instant MONDAY_0859 = Instant.parse("2024-01-01T08:59:00Z");
    private static final Instant MONDAY_0900 = Instant.parse("2024-01-01T09:00:00Z");
    private static final Instant MONDAY_090001 = Instant.parse("2024-01-01T09:00:01Z");

    @Test
    void firesSameDayWhenTimeIsStillAhead() {
        Schedule schedule = Schedules.weeklyAt(9, 0, 0, DayOfWeek.MONDAY);

        assertEquals(MONDAY_0900, schedule.getNextRunTime(MONDAY_0859));
    }

    @Test
    void rollsToNextWeekOncePast() {
        Schedule schedule = Schedules.weeklyAt(9, 0, 0, DayOfWeek.MONDAY);

        assertEquals(Instant.parse("2024-01-08T09:00:00Z"), schedule.getNextRunTime(MONDAY_090001));
    }

    @Test
    void exactTimeIsNotStrictlyAfter() {
        Schedule schedule = Schedules.weeklyAt(9, 0, 0, DayOfWeek.MONDAY);

        assertEquals(Instant.parse("2024-01-08T09:00:00Z"), schedule.getNextRunTime(MONDAY_0900));
    }

    @Test
    void dailyFiresNextDay() {
        Schedule schedule = Schedules.dailyAt(9, 0, 0);

        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), schedule.getNextRunTime(MONDAY_090001));
    }

    @Test
    void weekdaysSkipTheWeekend() {
        Schedule schedule = Schedules.weekdaysAt(9, 0, 0);
        Instant friday = Instant.parse("2024-01-05T10:00:00Z");

        assertEquals(Instant.parse("2024-01-08T09:00:00Z"), schedule.getNextRunTime(friday));
    }

    @Test
    void weekendsSkipTheWeek() {
        Schedule schedule = Schedules.weekendsAt(6, 30, 0);

        assertEquals(Instant.parse("2024-01-06T06:30:00Z"), schedule.getNextRunTime(MONDAY_0900));
    }

    @Test
    void multipleDays() {
        Schedule schedule = Schedules.weeklyAt(12, 0, 0, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);
        Instant wednesdayAfternoon = Instant.parse("2024-01-03T13:00:00Z");

        assertEquals(Instant.parse("2024-01-05T12:00:00Z"), schedule.getNextRunTime(wednesdayAfternoon));
    }

    @Test
    void factoriesSetTheDayMask() {
        assertEquals(DayOfWeekMask.WEEKDAYS, Schedules.weekdaysAt(9, 0, 0).getDayOfWeekMask());
        assertEquals(DayOfWeekMask.WEEKEND_DAYS, Schedules.weekendsAt(9, 0, 0).getDayOfWeekMask());
        assertEquals(DayOfWeekMask.ALL_DAYS, Schedules.dailyAt(9, 0, 0).getDayOfWeekMask());
        assertEquals(DayOfWeekMask.MONDAY | DayOfWeekMask.FRIDAY,
                     Schedules.weeklyAt(9, 0, 0, DayOfWeek.MONDAY, DayOfWeek.FRIDAY).getDayOfWeekMask());
    }

    @Test
    void dayOfWeekMaskUsesSundayAsBitZero() {
        assertEquals(1, DayOfWeekMask.bit(DayOfWeek.SUNDAY));
        assertEquals(2, DayOfWeekMask.bit(DayOfWeek.MONDAY));
        assertEquals(DayOfWeekMask.WEEKEND_DAYS, DayOfWeekMask.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));
        assertTrue(DayOfWeekMask.contains(DayOfWeekMask.WEEKDAYS, DayOfWeek.FRIDAY));
        assertFalse(DayOfWeekMask.contains(DayOfWeekMask.WEEKDAYS, DayOfWeek.SUNDAY));
        assertTrue(DayOfWeekMask.isWeekendDay(DayOfWeek.SATURDAY));
        assertTrue(DayOfWeekMask.isWeekDay(DayOfWeek.MONDAY));
    }
}
