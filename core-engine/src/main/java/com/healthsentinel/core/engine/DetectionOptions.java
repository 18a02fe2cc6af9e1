package com.healthsentinel.core.engine;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.model.DetectorKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-request options of
 * {@link AnomalyDetectionEngine#detect(java.util.List, DetectionOptions)}.
 *
 * <p>
 * Unset values fall back to the engine configuration. Use the
 * {@link Builder}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionOptions {

    private final DetectionMode mode;
    private final Set<DetectorKind> enabledDetectors;
    private final Double contamination;
    private final Map<DetectorKind, Double> thresholds;

    private DetectionOptions(Builder b) {
        this.mode = Objects.requireNonNull(b.mode, "mode must not be null");
        this.enabledDetectors = b.enabledDetectors == null
                ? null
                : Collections.unmodifiableSet(b.enabledDetectors.isEmpty()
                        ? EnumSet.noneOf(DetectorKind.class)
                        : EnumSet.copyOf(b.enabledDetectors));
        this.contamination = b.contamination;
        this.thresholds = Collections.unmodifiableMap(new EnumMap<>(b.thresholds));
    }

    public static DetectionOptions batch() {
        return builder().mode(DetectionMode.BATCH).build();
    }

    public static DetectionOptions realtime() {
        return builder().mode(DetectionMode.REALTIME).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DetectionMode mode = DetectionMode.BATCH;
        private Set<DetectorKind> enabledDetectors;
        private Double contamination;
        private final Map<DetectorKind, Double> thresholds = new EnumMap<>(DetectorKind.class);

        public Builder mode(DetectionMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Restrict the request to these detectors (intersected with the
         * configured and available ones).
         */
        public Builder enabledDetectors(Set<DetectorKind> enabledDetectors) {
            this.enabledDetectors = enabledDetectors;
            return this;
        }

        public Builder contamination(double contamination) {
            if (contamination <= 0 || contamination > 0.5) {
                throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
            }
            this.contamination = contamination;
            return this;
        }

        /**
         * Override the firing threshold of one detector, in that detector's
         * raw-score units.
         *
         * @throws IllegalArgumentException for a non-positive value, or for
         *                                  the isolation forest, whose cutoff is
         *                                  set through {@link #contamination}
         */
        public Builder threshold(DetectorKind kind, double value) {
            Objects.requireNonNull(kind, "DetectorKind must not be null");
            if (kind == DetectorKind.ISOLATION_FOREST) {
                throw new IllegalArgumentException("The isolation forest cutoff is set through contamination");
            }
            if (value <= 0 || (kind == DetectorKind.LOCAL_OUTLIER_FACTOR && value <= 1.0)) {
                throw new IllegalArgumentException("Invalid threshold " + value + " for " + kind.getId());
            }
            thresholds.put(kind, value);
            return this;
        }

        public DetectionOptions build() {
            return new DetectionOptions(this);
        }
    }

    public DetectionMode getMode() {
        return mode;
    }

    /** Empty when the configured set applies. */
    public Optional<Set<DetectorKind>> getEnabledDetectors() {
        return Optional.ofNullable(enabledDetectors);
    }

    public Optional<Double> getContamination() {
        return Optional.ofNullable(contamination);
    }

    public Map<DetectorKind, Double> getThresholds() {
        return thresholds;
    }

    /**
     * @return {@code true} when detector parameters differ from the
     *         configuration
     */
    public boolean hasParameterOverrides() {
        return contamination != null || !thresholds.isEmpty();
    }

    /**
     * @return these options in {@code mode}; {@code this} when already in it
     */
    DetectionOptions withMode(DetectionMode mode) {
        if (this.mode == mode) {
            return this;
        }
        Builder b = builder().mode(mode).enabledDetectors(enabledDetectors);
        b.contamination = contamination;
        b.thresholds.putAll(thresholds);
        return b.build();
    }

    /**
     * Apply the overrides to a copy of the configured settings.
     */
    DetectorSettings applyTo(DetectorSettings configured) {
        if (!hasParameterOverrides()) {
            return configured;
        }
        DetectorSettings effective = configured.copy();
        if (contamination != null) {
            effective.setContamination(contamination);
        }
        thresholds.forEach(effective::overrideThreshold);
        return effective;
    }

    @Override
    public String toString() {
        return "DetectionOptions{mode=" + mode.getId() +
                ", detectors=" + (enabledDetectors != null ? enabledDetectors : "configured") +
                ", contamination=" + contamination +
                ", thresholds=" + thresholds +
                '}';
    }
}
