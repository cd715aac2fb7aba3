package com.horae.schedule;

import java.time.DayOfWeek;

/**
 * Bitmask helpers for day-of-week sets.
 * 
 * Bit {@code i} stands for weekday {@code i} counted from Sunday (Sunday = 0 ... Saturday = 6).
 */
public final class DayOfWeekMask {

    public static final int SUNDAY = 1;
    public static final int MONDAY = 1 << 1;
    public static final int TUESDAY = 1 << 2;
    public static final int WEDNESDAY = 1 << 3;
    public static final int THURSDAY = 1 << 4;
    public static final int FRIDAY = 1 << 5;
    public static final int SATURDAY = 1 << 6;

    public static final int WEEKDAYS = MONDAY | TUESDAY | WEDNESDAY | THURSDAY | FRIDAY;
    public static final int WEEKEND_DAYS = SATURDAY | SUNDAY;
    public static final int ALL_DAYS = WEEKDAYS | WEEKEND_DAYS;

    private DayOfWeekMask() {
    }

    /**
     * @return the bit for the given day
     */
    public static int bit(DayOfWeek day) {
        // DayOfWeek is Monday = 1 ... Sunday = 7
        return 1 << (day.getValue() % 7);
    }

    /**
     * @return the mask with the bits of all given days set
     */
    public static int of(DayOfWeek... days) {
        int mask = 0;
        for (DayOfWeek day : days) {
            mask |= bit(day);
        }
        return mask;
    }

    public static boolean contains(int mask, DayOfWeek day) {
        return (mask & bit(day)) != 0;
    }

    public static boolean isWeekendDay(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public static boolean isWeekDay(DayOfWeek day) {
        return !isWeekendDay(day);
    }
}
