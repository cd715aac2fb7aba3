package com.horae.event;

/**
 * Lifecycle events emitted for a job invocation.
 * 
 * For one invocation STARTED always comes first, followed by exactly one of
 * COMPLETE, FAILED or CANCELLED, optionally followed by BROKEN or FIXED.
 */
public enum EventFlag {
    STARTED("cron.started"),
    FAILED("cron.failed"),
    CANCELLED("cron.cancelled"),
    COMPLETE("cron.complete"),
    /** A failure that follows a success. */
    BROKEN("cron.broken"),
    /** A success that follows a failure. */
    FIXED("cron.fixed");

    private final String flag;

    EventFlag(String flag) {
        this.flag = flag;
    }

    /**
     * @return the flag name as written to logs (e.g. "cron.complete")
     */
    public String getFlag() {
        return flag;
    }

    @Override
    public String toString() {
        return flag;
    }
}
