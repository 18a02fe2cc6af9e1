package com.healthsentinel.core.preprocess;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluation window for one candidate point.
 *
 * <p>
 * The baseline holds the observed values that precede the candidate inside the
 * history window, oldest first. Statistics are computed over the baseline only,
 * so a result for a point never depends on that point or on anything after it.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionWindow {

    private final String metricName;
    private final Instant timestamp;
    private final double value;
    private final double[] baseline;
    private final FeatureWindow features;

    public DetectionWindow(String metricName, Instant timestamp, double value, double[] baseline,
            FeatureWindow features) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
        this.features = features;
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /** Candidate value. */
    public double getValue() {
        return value;
    }

    /** Baseline values, oldest first. Callers must not modify the array. */
    public double[] getBaseline() {
        return baseline;
    }

    public int baselineSize() {
        return baseline.length;
    }

    /** Window size including the candidate. */
    public int size() {
        return baseline.length + 1;
    }

    /**
     * @return aligned multivariate rows when the candidate has one
     */
    public Optional<FeatureWindow> getFeatures() {
        return Optional.ofNullable(features);
    }

    @Override
    public String toString() {
        return "DetectionWindow{" + metricName + "@" + timestamp + "=" + value + ", baseline=" + baseline.length
                + (features != null ? ", features=" + features.getFeatureNames() : "") + '}';
    }
}
