package com.healthsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Learned sensitivity of one detector for one metric.
 *
 * <p>
 * The multiplier divides the detector's normalised score in the ensemble: a
 * value above 1.0 suppresses the detector for this metric. Instances are
 * immutable; every feedback update produces a new one.
 * </p>
 *
 * @since 1.0.0
 */
public final class PersonalThreshold {

    public static final double MIN_MULTIPLIER = 0.1;
    public static final double MAX_MULTIPLIER = 10.0;
    public static final double DEFAULT_MULTIPLIER = 1.0;

    private final String metricName;
    private final DetectorKind detectorKind;
    private final double multiplier;
    private final int falsePositiveCount;
    private final int truePositiveCount;
    private final Instant lastUpdated;

    public PersonalThreshold(String metricName, DetectorKind detectorKind, double multiplier,
            int falsePositiveCount, int truePositiveCount, Instant lastUpdated) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.detectorKind = Objects.requireNonNull(detectorKind, "detectorKind must not be null");
        if (falsePositiveCount < 0 || truePositiveCount < 0) {
            throw new IllegalArgumentException("Feedback counts must be >= 0");
        }
        this.multiplier = clamp(multiplier);
        this.falsePositiveCount = falsePositiveCount;
        this.truePositiveCount = truePositiveCount;
        this.lastUpdated = lastUpdated;
    }

    /**
     * @return a fresh threshold with multiplier 1.0 and no feedback
     */
    public static PersonalThreshold initial(String metricName, DetectorKind detectorKind) {
        return new PersonalThreshold(metricName, detectorKind, DEFAULT_MULTIPLIER, 0, 0, null);
    }

    public static double clamp(double multiplier) {
        if (Double.isNaN(multiplier)) {
            return DEFAULT_MULTIPLIER;
        }
        return Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, multiplier));
    }

    public String getMetricName() {
        return metricName;
    }

    public DetectorKind getDetectorKind() {
        return detectorKind;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public int getFalsePositiveCount() {
        return falsePositiveCount;
    }

    public int getTruePositiveCount() {
        return truePositiveCount;
    }

    /** {@code null} until the first feedback arrives. */
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public int getFeedbackCount() {
        return falsePositiveCount + truePositiveCount;
    }

    /**
     * @return share of true positives among all feedback, 0 without feedback
     */
    public double accuracy() {
        int total = getFeedbackCount();
        return total == 0 ? 0.0 : (double) truePositiveCount / total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PersonalThreshold that))
            return false;
        return Double.compare(multiplier, that.multiplier) == 0
                && falsePositiveCount == that.falsePositiveCount
                && truePositiveCount == that.truePositiveCount
                && metricName.equals(that.metricName)
                && detectorKind == that.detectorKind
                && Objects.equals(lastUpdated, that.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, detectorKind, multiplier, falsePositiveCount, truePositiveCount);
    }

    @Override
    public String toString() {
        return "PersonalThreshold{" + metricName + "/" + detectorKind.getId()
                + " x" + multiplier + " fp=" + falsePositiveCount + " tp=" + truePositiveCount + '}';
    }
}
