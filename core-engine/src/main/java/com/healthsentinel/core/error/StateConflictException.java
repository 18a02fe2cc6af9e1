package com.healthsentinel.core.error;

/**
 * A personal-threshold update could not be serialised against a concurrent
 * update of the same (metric, detector) key.
 */
public class StateConflictException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public StateConflictException(String message) {
        super(message);
    }

    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
