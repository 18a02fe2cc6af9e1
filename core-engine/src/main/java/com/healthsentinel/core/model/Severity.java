package com.healthsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete severity bucket, ordered from {@link #LOW} to {@link #CRITICAL}.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    static final double MEDIUM_SCORE = 3.5;
    static final double HIGH_SCORE = 4.0;
    static final double CRITICAL_SCORE = 5.0;

    /** Ensemble bounds, in multiples of the firing threshold. */
    static final double MEDIUM_RATIO = 1.5;
    static final double HIGH_RATIO = 2.0;
    static final double CRITICAL_RATIO = 3.0;

    /**
     * Bucket a detector score expressed in standard-deviation-like units.
     *
     * @param score raw detector score; the sign is ignored
     * @return severity for {@code |score|}
     */
    public static Severity fromScore(double score) {
        double abs = Math.abs(score);
        if (abs > CRITICAL_SCORE) {
            return CRITICAL;
        }
        if (abs > HIGH_SCORE) {
            return HIGH;
        }
        if (abs > MEDIUM_SCORE) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Bucket an ensemble score in {@code [0, 1]}.
     *
     * <p>
     * Every detector normalises so that its firing threshold lands on 0.5,
     * which makes {@code s / (1 - s)} the number of thresholds the evidence
     * reaches. Up to 1.5 thresholds is low, up to 2 medium, up to 3 high and
     * anything beyond critical. For the z-score at its default threshold that
     * is 4.5, 6 and 9 standard deviations. The mapping is monotonic in
     * {@code s}.
     * </p>
     *
     * @param ensembleScore combined score
     * @return severity bucket
     */
    public static Severity fromEnsembleScore(double ensembleScore) {
        if (ensembleScore >= 1.0) {
            return CRITICAL;
        }
        double s = Math.max(0.0, ensembleScore);
        double ratio = s / (1.0 - s);
        if (ratio > CRITICAL_RATIO) {
            return CRITICAL;
        }
        if (ratio > HIGH_RATIO) {
            return HIGH;
        }
        if (ratio > MEDIUM_RATIO) {
            return MEDIUM;
        }
        return LOW;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
