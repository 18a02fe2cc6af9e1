package com.healthsentinel.core.error;

import com.healthsentinel.core.model.DetectorKind;

/**
 * Raised when an optional detector cannot initialise or train. The detector is
 * dropped from the ensemble for the affected window.
 */
public class DetectorUnavailableException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    private final DetectorKind kind;

    public DetectorUnavailableException(DetectorKind kind, String message) {
        super("[" + kind.getId() + "] " + message);
        this.kind = kind;
    }

    public DetectorUnavailableException(DetectorKind kind, String message, Throwable cause) {
        super("[" + kind.getId() + "] " + message, cause);
        this.kind = kind;
    }

    public DetectorKind getKind() {
        return kind;
    }
}
