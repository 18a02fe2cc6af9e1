package com.healthsentinel.core.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.DetectorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of one detection request.
 *
 * <p>
 * A {@link DetectionStatus#FAILED} report always carries a
 * {@link FailureReason} and no anomalies, so a failure is never mistaken for
 * "nothing unusual". Anomalies are sorted by timestamp, then metric name.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DetectionReport {

    static final Comparator<Anomaly> ORDER = Comparator.comparing(Anomaly::getTimestamp)
            .thenComparing(Anomaly::getMetricName);

    private final DetectionMode mode;
    private final DetectionStatus status;
    private final FailureReason failureReason;
    private final List<Anomaly> anomalies;
    private final Set<DetectorKind> activeDetectors;
    private final List<String> degradedNotes;
    private final int receivedSamples;
    private final int invalidSamples;
    private final int duplicateSamples;
    private final int gapSamples;
    private final int evaluatedPoints;

    private DetectionReport(Builder b) {
        this.mode = Objects.requireNonNull(b.mode, "mode must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        if (status == DetectionStatus.FAILED && b.failureReason == null) {
            throw new IllegalArgumentException("A failed report needs a failure reason");
        }
        this.failureReason = status == DetectionStatus.FAILED ? b.failureReason : null;
        List<Anomaly> sorted = new ArrayList<>(status == DetectionStatus.FAILED ? List.of() : b.anomalies);
        sorted.sort(ORDER);
        this.anomalies = Collections.unmodifiableList(sorted);
        this.activeDetectors = Collections.unmodifiableSet(b.activeDetectors.isEmpty()
                ? EnumSet.noneOf(DetectorKind.class)
                : EnumSet.copyOf(b.activeDetectors));
        this.degradedNotes = List.copyOf(b.degradedNotes);
        this.receivedSamples = b.receivedSamples;
        this.invalidSamples = b.invalidSamples;
        this.duplicateSamples = b.duplicateSamples;
        this.gapSamples = b.gapSamples;
        this.evaluatedPoints = b.evaluatedPoints;
    }

    public static Builder builder(DetectionMode mode) {
        return new Builder().mode(mode);
    }

    public static class Builder {
        private DetectionMode mode;
        private DetectionStatus status;
        private FailureReason failureReason;
        private List<Anomaly> anomalies = List.of();
        private Set<DetectorKind> activeDetectors = Set.of();
        private final List<String> degradedNotes = new ArrayList<>();
        private int receivedSamples;
        private int invalidSamples;
        private int duplicateSamples;
        private int gapSamples;
        private int evaluatedPoints;

        public Builder mode(DetectionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder status(DetectionStatus status) {
            this.status = status;
            return this;
        }

        /** Marks the report as failed. */
        public Builder failed(FailureReason reason) {
            this.status = DetectionStatus.FAILED;
            this.failureReason = reason;
            return this;
        }

        public Builder anomalies(List<Anomaly> anomalies) {
            this.anomalies = anomalies != null ? anomalies : List.of();
            return this;
        }

        public Builder activeDetectors(Set<DetectorKind> activeDetectors) {
            this.activeDetectors = activeDetectors != null ? activeDetectors : Set.of();
            return this;
        }

        public Builder degradedNote(String note) {
            this.degradedNotes.add(note);
            return this;
        }

        public Builder degradedNotes(List<String> notes) {
            this.degradedNotes.addAll(notes);
            return this;
        }

        public Builder receivedSamples(int receivedSamples) {
            this.receivedSamples = receivedSamples;
            return this;
        }

        public Builder invalidSamples(int invalidSamples) {
            this.invalidSamples = invalidSamples;
            return this;
        }

        public Builder duplicateSamples(int duplicateSamples) {
            this.duplicateSamples = duplicateSamples;
            return this;
        }

        public Builder gapSamples(int gapSamples) {
            this.gapSamples = gapSamples;
            return this;
        }

        public Builder evaluatedPoints(int evaluatedPoints) {
            this.evaluatedPoints = evaluatedPoints;
            return this;
        }

        public DetectionReport build() {
            return new DetectionReport(this);
        }
    }

    public DetectionMode getMode() {
        return mode;
    }

    public DetectionStatus getStatus() {
        return status;
    }

    /** {@code null} unless the status is {@link DetectionStatus#FAILED}. */
    public FailureReason getFailureReason() {
        return failureReason;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public Set<DetectorKind> getActiveDetectors() {
        return activeDetectors;
    }

    /** One line per skipped, timed-out or failed detector run. */
    public List<String> getDegradedNotes() {
        return degradedNotes;
    }

    public int getReceivedSamples() {
        return receivedSamples;
    }

    public int getInvalidSamples() {
        return invalidSamples;
    }

    public int getDuplicateSamples() {
        return duplicateSamples;
    }

    public int getGapSamples() {
        return gapSamples;
    }

    /** Points for which at least one detector produced a result. */
    public int getEvaluatedPoints() {
        return evaluatedPoints;
    }

    public boolean isFailed() {
        return status == DetectionStatus.FAILED;
    }

    @Override
    public String toString() {
        return "DetectionReport{" +
                "mode=" + mode.getId() +
                ", status=" + status.getId() +
                (failureReason != null ? ", reason=" + failureReason.getId() : "") +
                ", anomalies=" + anomalies.size() +
                ", detectors=" + activeDetectors +
                ", degraded=" + degradedNotes.size() +
                ", evaluated=" + evaluatedPoints +
                '}';
    }
}
