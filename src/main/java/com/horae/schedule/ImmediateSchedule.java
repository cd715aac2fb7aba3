package com.horae.schedule;

import java.time.Instant;

/**
 * Fires immediately the first time it is asked, then hands over to an
 * optional continuation schedule.
 * 
 * This is the only stateful schedule: the "already fired" flag is guarded
 * by the instance lock, since the heartbeat may call it concurrently with loads.
 */
public final class ImmediateSchedule implements Schedule {

    private boolean didRun;
    private Schedule then;

    /**
     * Sets the schedule used after the first run.
     * 
     * @param then continuation schedule (null = never run again)
     * @return this schedule
     */
    public synchronized ImmediateSchedule then(Schedule then) {
        this.then = then;
        return this;
    }

    public synchronized Schedule getThen() {
        return then;
    }

    @Override
    public synchronized Instant getNextRunTime(Instant after) {
        if (!didRun) {
            didRun = true;
            return Instant.now();
        }
        if (then != null) {
            return then.getNextRunTime(after);
        }
        return null;
    }

    @Override
    public synchronized String toString() {
        return then == null ? "immediately" : "immediately, then " + then;
    }
}
