package com.horae.async;

/**
 * A unit of repeating work run by an {@link IntervalRunner}.
 */
@FunctionalInterface
public interface Action {

    /**
     * Runs the action once.
     * 
     * @throws Exception forwarded to the runner's error handler, never fatal to the loop
     */
    void run() throws Exception;
}
