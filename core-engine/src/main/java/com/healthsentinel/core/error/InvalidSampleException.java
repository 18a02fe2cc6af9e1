package com.healthsentinel.core.error;

/**
 * Raised for a sample whose value is not numeric, NaN or infinite, or whose
 * identity fields are missing. The preprocessor skips such samples.
 */
public class InvalidSampleException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public InvalidSampleException(String message) {
        super(message);
    }

    public InvalidSampleException(String message, Throwable cause) {
        super(message, cause);
    }
}
