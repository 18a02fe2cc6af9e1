package com.healthsentinel.core.feedback;

import com.healthsentinel.core.model.DetectorKind;

import java.util.Collections;
import java.util.Map;

/**
 * Aggregate view of the effective feedback (last verdict per anomaly).
 *
 * @since 1.0.0
 */
public final class FeedbackStatistics {

    private final int falsePositives;
    private final int truePositives;
    private final Map<DetectorKind, Counts> detectorBreakdown;
    private final Map<String, Counts> metricBreakdown;
    private final int thresholdCount;
    private final double averageMultiplier;

    FeedbackStatistics(int falsePositives, int truePositives, Map<DetectorKind, Counts> detectorBreakdown,
            Map<String, Counts> metricBreakdown, int thresholdCount, double averageMultiplier) {
        this.falsePositives = falsePositives;
        this.truePositives = truePositives;
        this.detectorBreakdown = Collections.unmodifiableMap(detectorBreakdown);
        this.metricBreakdown = Collections.unmodifiableMap(metricBreakdown);
        this.thresholdCount = thresholdCount;
        this.averageMultiplier = averageMultiplier;
    }

    public int getTotalFeedback() {
        return falsePositives + truePositives;
    }

    public boolean hasData() {
        return getTotalFeedback() > 0;
    }

    public int getFalsePositives() {
        return falsePositives;
    }

    public int getTruePositives() {
        return truePositives;
    }

    public double getAccuracy() {
        return hasData() ? (double) truePositives / getTotalFeedback() : 0.0;
    }

    public double getFalsePositiveRate() {
        return (double) falsePositives / Math.max(getTotalFeedback(), 1);
    }

    public Map<DetectorKind, Counts> getDetectorBreakdown() {
        return detectorBreakdown;
    }

    public Map<String, Counts> getMetricBreakdown() {
        return metricBreakdown;
    }

    public int getThresholdCount() {
        return thresholdCount;
    }

    /** Mean multiplier over stored thresholds, 1.0 when there are none. */
    public double getAverageMultiplier() {
        return averageMultiplier;
    }

    @Override
    public String toString() {
        return "FeedbackStatistics{fp=" + falsePositives + ", tp=" + truePositives
                + ", thresholds=" + thresholdCount + ", avgMultiplier=" + averageMultiplier + '}';
    }

    /**
     * False and true positive counts of one breakdown bucket.
     */
    public static final class Counts {
        private final int falsePositives;
        private final int truePositives;

        Counts(int falsePositives, int truePositives) {
            this.falsePositives = falsePositives;
            this.truePositives = truePositives;
        }

        Counts plus(int fp, int tp) {
            return new Counts(falsePositives + fp, truePositives + tp);
        }

        public int getFalsePositives() {
            return falsePositives;
        }

        public int getTruePositives() {
            return truePositives;
        }

        public int getTotal() {
            return falsePositives + truePositives;
        }

        public double getFalsePositiveRate() {
            return getTotal() == 0 ? 0.0 : (double) falsePositives / getTotal();
        }

        @Override
        public String toString() {
            return "fp=" + falsePositives + ", tp=" + truePositives;
        }
    }
}
