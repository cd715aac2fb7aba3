package com.horae.schedule;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Fires every hour at a fixed minute and second (UTC).
 */
public final class OnTheHourAt implements Schedule {

    private final int minute;
    private final int second;

    public OnTheHourAt(int minute, int second) {
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute out of range: " + minute);
        }
        if (second < 0 || second > 59) {
            throw new IllegalArgumentException("second out of range: " + second);
        }
        this.minute = minute;
        this.second = second;
    }

    public int getMinute() {
        return minute;
    }

    public int getSecond() {
        return second;
    }

    @Override
    public Instant getNextRunTime(Instant after) {
        Instant reference = after != null ? after : Instant.now();

        ZonedDateTime candidate = reference.atZone(ZoneOffset.UTC)
            .truncatedTo(ChronoUnit.HOURS)
            .withMinute(minute)
            .withSecond(second);
        if (!candidate.toInstant().isAfter(reference)) {
            candidate = candidate.plusHours(1);
        }
        return candidate.toInstant();
    }

    @Override
    public String toString() {
        return String.format("every hour at %02d:%02d", minute, second);
    }
}
