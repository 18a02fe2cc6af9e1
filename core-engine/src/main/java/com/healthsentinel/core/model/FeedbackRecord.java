package com.healthsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One user verdict on one anomaly, as stored in the feedback log.
 *
 * <p>
 * Records are append-only. The metric and detector are carried alongside the
 * anomaly id so that thresholds can be rebuilt per (metric, detector) by
 * replaying the log.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeedbackRecord {

    private final String anomalyId;
    private final Verdict verdict;
    private final String metricName;
    private final DetectorKind detectorKind;
    private final Instant timestamp;

    @JsonCreator
    public FeedbackRecord(@JsonProperty("anomalyId") String anomalyId,
            @JsonProperty("verdict") Verdict verdict,
            @JsonProperty("metricName") String metricName,
            @JsonProperty("detectorKind") DetectorKind detectorKind,
            @JsonProperty("timestamp") Instant timestamp) {
        this.anomalyId = Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        this.verdict = Objects.requireNonNull(verdict, "verdict must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.detectorKind = Objects.requireNonNull(detectorKind, "detectorKind must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public String getMetricName() {
        return metricName;
    }

    public DetectorKind getDetectorKind() {
        return detectorKind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeedbackRecord that))
            return false;
        return anomalyId.equals(that.anomalyId)
                && verdict == that.verdict
                && metricName.equals(that.metricName)
                && detectorKind == that.detectorKind
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyId, verdict, metricName, detectorKind, timestamp);
    }

    @Override
    public String toString() {
        return "FeedbackRecord{" + anomalyId + " " + verdict.getId() + " "
                + metricName + "/" + detectorKind.getId() + " @" + timestamp + '}';
    }
}
