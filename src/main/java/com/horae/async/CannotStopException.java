package com.horae.async;

/**
 * Thrown when a component is asked to stop while it is not running.
 */
public class CannotStopException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public CannotStopException(String component) {
        super("cannot stop " + component + "; already stopped");
    }
}
