package com.healthsentinel.core.feedback;

import com.healthsentinel.core.model.PersonalThreshold;
import com.healthsentinel.core.model.Verdict;

import java.util.Objects;

/**
 * Result of a feedback submission: the stored verdict and the threshold it
 * produced.
 *
 * @since 1.0.0
 */
public final class FeedbackAcknowledgement {

    private final String anomalyId;
    private final Verdict verdict;
    private final PersonalThreshold threshold;
    private final boolean repeated;

    public FeedbackAcknowledgement(String anomalyId, Verdict verdict, PersonalThreshold threshold,
            boolean repeated) {
        this.anomalyId = Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        this.verdict = Objects.requireNonNull(verdict, "verdict must not be null");
        this.threshold = Objects.requireNonNull(threshold, "threshold must not be null");
        this.repeated = repeated;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    /** Threshold of the (metric, detector) key after the update. */
    public PersonalThreshold getThreshold() {
        return threshold;
    }

    /**
     * @return {@code true} when the same verdict had already been recorded for
     *         this anomaly, in which case the threshold did not change
     */
    public boolean isRepeated() {
        return repeated;
    }

    @Override
    public String toString() {
        return "FeedbackAcknowledgement{" + anomalyId + " " + verdict.getId() + " -> " + threshold
                + (repeated ? " (repeated)" : "") + '}';
    }
}
