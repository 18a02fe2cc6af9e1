package com.healthsentinel.core.error;

/**
 * Root of the detection engine's unchecked exception hierarchy.
 *
 * <p>
 * Detector-level subclasses are recovered inside the engine; callers only
 * see them when they use a component directly.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
