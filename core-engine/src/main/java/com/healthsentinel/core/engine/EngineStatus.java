package com.healthsentinel.core.engine;

import com.healthsentinel.core.feedback.FeedbackStatistics;
import com.healthsentinel.core.model.DetectorKind;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Point-in-time summary of an engine: its detectors, the detection runs so
 * far and the feedback collected.
 *
 * <p>
 * Counters cover every {@code detect} and {@code detectRealtime} call since
 * the engine started, failed runs included. Anomaly counts are per metric.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineStatus {

    private final Set<DetectorKind> enabledDetectors;
    private final Set<DetectorKind> availableDetectors;
    private final long detectionRuns;
    private final long failedRuns;
    private final Map<String, Long> anomaliesByMetric;
    private final Duration lastDetectionTime;
    private final Duration averageDetectionTime;
    private final FeedbackStatistics feedback;

    EngineStatus(Set<DetectorKind> enabledDetectors, Set<DetectorKind> availableDetectors, long detectionRuns,
            long failedRuns, Map<String, Long> anomaliesByMetric, Duration lastDetectionTime,
            Duration averageDetectionTime, FeedbackStatistics feedback) {
        this.enabledDetectors = Collections.unmodifiableSet(copy(enabledDetectors));
        this.availableDetectors = Collections.unmodifiableSet(copy(availableDetectors));
        this.detectionRuns = detectionRuns;
        this.failedRuns = failedRuns;
        this.anomaliesByMetric = Collections.unmodifiableMap(new TreeMap<>(anomaliesByMetric));
        this.lastDetectionTime = lastDetectionTime;
        this.averageDetectionTime = averageDetectionTime;
        this.feedback = feedback;
    }

    private static Set<DetectorKind> copy(Set<DetectorKind> kinds) {
        return kinds.isEmpty() ? EnumSet.noneOf(DetectorKind.class) : EnumSet.copyOf(kinds);
    }

    /** Detectors switched on in the configuration. */
    public Set<DetectorKind> getEnabledDetectors() {
        return enabledDetectors;
    }

    /** Enabled detectors that also passed the start-up capability check. */
    public Set<DetectorKind> getAvailableDetectors() {
        return availableDetectors;
    }

    public long getDetectionRuns() {
        return detectionRuns;
    }

    public long getFailedRuns() {
        return failedRuns;
    }

    public Map<String, Long> getAnomaliesByMetric() {
        return anomaliesByMetric;
    }

    public long getTotalAnomalies() {
        return anomaliesByMetric.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * @return wall time of the latest run, {@link Duration#ZERO} before the
     *         first one
     */
    public Duration getLastDetectionTime() {
        return lastDetectionTime;
    }

    public Duration getAverageDetectionTime() {
        return averageDetectionTime;
    }

    public FeedbackStatistics getFeedback() {
        return feedback;
    }

    @Override
    public String toString() {
        return "EngineStatus{available=" + availableDetectors + ", runs=" + detectionRuns + ", failed=" + failedRuns
                + ", anomalies=" + anomaliesByMetric + ", last=" + lastDetectionTime.toMillis() + "ms, avg="
                + averageDetectionTime.toMillis() + "ms, " + feedback + '}';
    }
}
