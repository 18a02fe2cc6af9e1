package com.healthsentinel.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Execution path of a detection request.
 *
 * @since 1.0.0
 */
public enum DetectionMode {

    /** Latest point of each metric, under the real-time latency budget. */
    REALTIME,

    /** Every observed point, fanned out over the worker pool. */
    BATCH;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
