package com.metrics.insights.engine.stats;

/**
 * Raised when a directly invoked computation needs more observations than it was given.
 */
public class InsufficientDataException extends RuntimeException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String message, int required, int actual) {
        super(message);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
