package com.horae.schedule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ImmediateScheduleTest {

    @Test
    void firesNowThenNever() {
        Schedule schedule = Schedules.immediately();
        Instant before = Instant.now();

        Instant first = schedule.getNextRunTime(Instant.parse("2030-01-01T00:00:00Z"));

        assertNotNull(first);
        assertFalse(first.isBefore(before));
        assertNull(schedule.getNextRunTime(first));
    }

    @Test
    void delegatesToContinuationAfterFirstRun() {
        ImmediateSchedule schedule = Schedules.immediately().then(Schedules.every(Duration.ofMinutes(5)));
        assertInstanceOf(IntervalSchedule.class, schedule.getThen());

        Instant first = schedule.getNextRunTime(null);
        Instant second = schedule.getNextRunTime(first);

        assertEquals(first.plus(Duration.ofMinutes(5)), second);
    }
}
