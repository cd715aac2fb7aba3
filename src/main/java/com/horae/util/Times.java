package com.horae.util;

import java.time.Instant;

/**
 * Helpers for nullable instants, where null stands for "no time".
 */
public final class Times {

    private Times() {
    }

    /**
     * @return the earlier of two instants, ignoring nulls; null if both are null
     */
    public static Instant min(Instant t1, Instant t2) {
        if (t1 == null) {
            return t2;
        }
        if (t2 == null) {
            return t1;
        }
        return t1.isBefore(t2) ? t1 : t2;
    }

    /**
     * @return the later of two instants, ignoring nulls; null if both are null
     */
    public static Instant max(Instant t1, Instant t2) {
        if (t1 == null) {
            return t2;
        }
        if (t2 == null) {
            return t1;
        }
        return t1.isAfter(t2) ? t1 : t2;
    }
}
