package com.healthsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthsentinel.core.error.InvalidSampleException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One observation of one metric.
 *
 * <p>
 * A {@code null} value marks a gap in the series: the sample keeps its place
 * in time but never takes part in a statistical window.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSample {

    private final Instant timestamp;
    private final String metricName;
    private final Double value;

    /**
     * @param timestamp  observation time
     * @param metricName metric the observation belongs to
     * @param value      observed value, or {@code null} for a gap
     */
    @JsonCreator
    public MetricSample(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("metricName") String metricName,
            @JsonProperty("value") Double value) {
        this.timestamp = timestamp;
        this.metricName = metricName;
        this.value = value;
    }

    public static MetricSample of(Instant timestamp, String metricName, double value) {
        return new MetricSample(timestamp, metricName, value);
    }

    public static MetricSample gap(Instant timestamp, String metricName) {
        return new MetricSample(timestamp, metricName, null);
    }

    /**
     * Build a sample from an untyped value, coercing common numeric types.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers. A
     * {@code null} raw value becomes a gap.
     * </p>
     *
     * @param timestamp  observation time
     * @param metricName metric name
     * @param raw        untyped value
     * @return a new sample
     * @throws InvalidSampleException if {@code raw} is neither {@code null},
     *                                a number nor a numeric string
     */
    public static MetricSample fromRaw(Instant timestamp, String metricName, Object raw) {
        if (raw == null) {
            return gap(timestamp, metricName);
        }
        if (raw instanceof Number n) {
            return new MetricSample(timestamp, metricName, n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return new MetricSample(timestamp, metricName, Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidSampleException(
                        "Non-numeric value '" + s + "' for metric '" + metricName + "' at " + timestamp, e);
            }
        }
        throw new InvalidSampleException("Unsupported value type " + raw.getClass().getSimpleName()
                + " for metric '" + metricName + "' at " + timestamp);
    }

    /**
     * Check that this sample can enter a series.
     *
     * @throws InvalidSampleException if the timestamp or metric name is
     *                                missing, or the value is NaN or infinite
     */
    public void validate() {
        if (timestamp == null) {
            throw new InvalidSampleException("Sample for metric '" + metricName + "' has no timestamp");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new InvalidSampleException("Sample at " + timestamp + " has no metric name");
        }
        if (value != null && (value.isNaN() || value.isInfinite())) {
            throw new InvalidSampleException(
                    "Value " + value + " for metric '" + metricName + "' at " + timestamp + " is not finite");
        }
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public Double getValue() {
        return value;
    }

    @JsonIgnore
    public Optional<Double> value() {
        return Optional.ofNullable(value);
    }

    @JsonIgnore
    public boolean isGap() {
        return value == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && Objects.equals(metricName, that.metricName)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, metricName, value);
    }

    @Override
    public String toString() {
        return "MetricSample{" + metricName + "@" + timestamp + "=" + value + '}';
    }
}
