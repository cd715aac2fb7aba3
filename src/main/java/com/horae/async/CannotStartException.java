package com.horae.async;

/**
 * Thrown when a component is asked to start while it is not stopped.
 */
public class CannotStartException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public CannotStartException(String component) {
        super("cannot start " + component + "; already started");
    }
}
