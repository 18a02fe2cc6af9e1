package com.healthsentinel.core.error;

/**
 * Raised when a window holds too few observations for a model to be fitted.
 * Non-fatal: the detector abstains.
 */
public class InsufficientDataException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int actual;

    public InsufficientDataException(int required, int actual) {
        super("Insufficient data: need at least " + required + " points, got " + actual);
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
