package com.horae.job;

import com.horae.schedule.Schedule;

import java.util.Objects;

/**
 * Abstract base class for Job implementations.
 * Holds the name and an optional schedule.
 * 
 * Subclasses only need to implement:
 *   - execute(JobContext context)
 * 
 * Optional overrides: every capability and hook of {@link Job}.
 */
public abstract class AbstractJob implements Job {

    private final String name;
    private final Schedule schedule;

    protected AbstractJob(String name) {
        this(name, null);
    }

    protected AbstractJob(String name, Schedule schedule) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.schedule = schedule;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Schedule getSchedule() {
        return schedule;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
