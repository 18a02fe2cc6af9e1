package com.healthsentinel.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome class of a {@link DetectionReport}.
 *
 * @since 1.0.0
 */
public enum DetectionStatus {

    /** Every active detector ran on every evaluated window. */
    COMPLETE,

    /** Some detector was skipped, timed out or failed for some window. */
    DEGRADED,

    /** No window held enough points for any detector. */
    INSUFFICIENT_DATA,

    /** Nothing could be evaluated; see {@link FailureReason}. */
    FAILED;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
