package com.healthsentinel.core.error;

import com.healthsentinel.core.model.DetectorKind;

import java.time.Duration;

/**
 * A detector did not finish inside its real-time budget. The partial
 * ensemble proceeds without it.
 */
public class TimeoutExceededException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    private final DetectorKind kind;
    private final Duration budget;

    public TimeoutExceededException(DetectorKind kind, Duration budget, Throwable cause) {
        super("[" + kind.getId() + "] exceeded real-time budget of " + budget.toMillis() + " ms", cause);
        this.kind = kind;
        this.budget = budget;
    }

    public DetectorKind getKind() {
        return kind;
    }

    public Duration getBudget() {
        return budget;
    }
}
