package com.horae.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IntervalScheduleTest {

    @Test
    void addsIntervalToPreviousRun() {
        Instant after = Instant.parse("2024-03-10T12:34:56.789Z");

        Instant next = Schedules.every(Duration.ofHours(1)).getNextRunTime(after);

        assertEquals(after.plus(Duration.ofHours(1)), next);
    }

    @Test
    void firstRunIsOneIntervalFromNow() {
        Instant before = Instant.now();

        Instant next = Schedules.everyMinute().getNextRunTime(null);

        assertFalse(next.isBefore(before.plusSeconds(60)));
        assertFalse(next.isAfter(Instant.now().plusSeconds(60)));
    }

    @Test
    void startDelayOnlyAppliesToFirstRun() {
        IntervalSchedule schedule = Schedules.everySecond().withStartDelay(Duration.ofMinutes(10));
        Instant before = Instant.now();

        Instant first = schedule.getNextRunTime(null);
        Instant second = schedule.getNextRunTime(first);

        assertFalse(first.isBefore(before.plus(Duration.ofMinutes(10)).plusSeconds(1)));
        assertEquals(first.plusSeconds(1), second);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> Schedules.every(Duration.ZERO));
    }
}
