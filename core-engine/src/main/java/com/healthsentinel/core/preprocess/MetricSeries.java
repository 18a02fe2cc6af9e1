package com.healthsentinel.core.preprocess;

import com.healthsentinel.core.model.MetricSample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cleaned, time-ordered samples of one metric.
 *
 * <p>
 * Keeps every sample including gaps, plus a dense view of the observed
 * (non-null) points. Detection candidates and statistical windows are
 * addressed by their index in the observed view.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String metricName;
    private final List<MetricSample> samples;
    private final List<Instant> observedTimestamps;
    private final double[] observedValues;

    /**
     * @param metricName metric name
     * @param samples    samples sorted by timestamp with unique timestamps
     */
    public MetricSeries(String metricName, List<MetricSample> samples) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));

        List<Instant> timestamps = new ArrayList<>();
        double[] values = new double[samples.size()];
        int n = 0;
        for (MetricSample s : samples) {
            if (!s.isGap()) {
                timestamps.add(s.getTimestamp());
                values[n++] = s.getValue();
            }
        }
        this.observedTimestamps = Collections.unmodifiableList(timestamps);
        this.observedValues = Arrays.copyOf(values, n);
    }

    public String getMetricName() {
        return metricName;
    }

    /** All samples, gaps included, in timestamp order. */
    public List<MetricSample> getSamples() {
        return samples;
    }

    public int observedCount() {
        return observedValues.length;
    }

    public int gapCount() {
        return samples.size() - observedValues.length;
    }

    public Instant observedTimestamp(int index) {
        return observedTimestamps.get(index);
    }

    public double observedValue(int index) {
        return observedValues[index];
    }

    /**
     * @return a copy of the observed values in timestamp order
     */
    public double[] observedValues() {
        return observedValues.clone();
    }

    /**
     * Observed values in {@code [from, to)}.
     */
    public double[] observedValues(int from, int to) {
        return Arrays.copyOfRange(observedValues, from, to);
    }

    /**
     * @param timestamp timestamp of an observed point
     * @return its index in the observed view, or -1
     */
    public int indexOfObserved(Instant timestamp) {
        int idx = Collections.binarySearch(observedTimestamps, timestamp);
        return idx >= 0 ? idx : -1;
    }

    /**
     * @return index of the latest observed point, or -1 when the series holds
     *         only gaps
     */
    public int latestObservedIndex() {
        return observedValues.length - 1;
    }

    @Override
    public String toString() {
        return "MetricSeries{" + metricName + ", samples=" + samples.size() + ", observed=" + observedValues.length + '}';
    }
}
