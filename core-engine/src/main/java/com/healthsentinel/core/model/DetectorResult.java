package com.healthsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict of one detector on one (metric, timestamp) candidate.
 *
 * <p>
 * Immutable. Every detector normalises its raw score so that its own firing
 * threshold lands on {@value #FIRING_LEVEL}; {@code fired} is therefore
 * equivalent to {@code normalizedScore > 0.5}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorResult {

    /** Normalised score that corresponds to a detector's firing threshold. */
    public static final double FIRING_LEVEL = 0.5;

    private final DetectorKind detectorKind;
    private final Instant timestamp;
    private final String metricName;
    private final double value;
    private final double rawScore;
    private final double normalizedScore;
    private final boolean fired;
    private final Map<String, Double> contributingFeatures;

    private DetectorResult(Builder b) {
        this.detectorKind = Objects.requireNonNull(b.detectorKind, "detectorKind must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        if (Double.isNaN(b.normalizedScore) || b.normalizedScore < 0.0 || b.normalizedScore > 1.0) {
            throw new IllegalArgumentException(
                    "normalizedScore must be in [0, 1], got: " + b.normalizedScore);
        }
        this.value = b.value;
        this.rawScore = b.rawScore;
        this.normalizedScore = b.normalizedScore;
        this.fired = b.normalizedScore > FIRING_LEVEL;
        this.contributingFeatures = b.contributingFeatures.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.contributingFeatures));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DetectorKind detectorKind;
        private Instant timestamp;
        private String metricName;
        private double value;
        private double rawScore;
        private double normalizedScore;
        private Map<String, Double> contributingFeatures = Collections.emptyMap();

        public Builder detectorKind(DetectorKind detectorKind) {
            this.detectorKind = detectorKind;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder rawScore(double rawScore) {
            this.rawScore = rawScore;
            return this;
        }

        public Builder normalizedScore(double normalizedScore) {
            this.normalizedScore = normalizedScore;
            return this;
        }

        /**
         * @param contributingFeatures feature name to weight, in rank order
         * @return this builder
         */
        public Builder contributingFeatures(Map<String, Double> contributingFeatures) {
            this.contributingFeatures = contributingFeatures != null
                    ? contributingFeatures
                    : Collections.emptyMap();
            return this;
        }

        /**
         * @return a new result
         * @throws NullPointerException     if kind, timestamp or metric is missing
         * @throws IllegalArgumentException if the normalised score is outside
         *                                  {@code [0, 1]}
         */
        public DetectorResult build() {
            return new DetectorResult(this);
        }
    }

    public DetectorKind getDetectorKind() {
        return detectorKind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public double getRawScore() {
        return rawScore;
    }

    public double getNormalizedScore() {
        return normalizedScore;
    }

    public boolean isFired() {
        return fired;
    }

    /**
     * @return severity of this single result, from its raw score
     */
    public Severity getSeverity() {
        return Severity.fromScore(rawScore);
    }

    /**
     * @return unmodifiable feature weights in rank order; empty for
     *         univariate detectors
     */
    public Map<String, Double> getContributingFeatures() {
        return contributingFeatures;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorResult that))
            return false;
        return detectorKind == that.detectorKind
                && Double.compare(value, that.value) == 0
                && Double.compare(rawScore, that.rawScore) == 0
                && Double.compare(normalizedScore, that.normalizedScore) == 0
                && timestamp.equals(that.timestamp)
                && metricName.equals(that.metricName)
                && contributingFeatures.equals(that.contributingFeatures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectorKind, timestamp, metricName, value, rawScore, normalizedScore);
    }

    @Override
    public String toString() {
        return "DetectorResult{" +
                "detector=" + detectorKind.getId() +
                ", metric='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", raw=" + rawScore +
                ", normalized=" + normalizedScore +
                ", fired=" + fired +
                '}';
    }
}
