package com.healthsentinel.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Machine-readable cause of a {@link DetectionStatus#FAILED} report.
 *
 * @since 1.0.0
 */
public enum FailureReason {

    NO_VALID_SAMPLES,
    NO_DETECTORS_AVAILABLE,
    ALL_DETECTORS_FAILED,
    STATE_STORE_UNAVAILABLE;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
