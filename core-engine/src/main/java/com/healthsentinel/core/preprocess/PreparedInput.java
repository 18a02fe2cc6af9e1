package com.healthsentinel.core.preprocess;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Output of {@link SignalPreprocessor}: per-metric series, the aligned
 * multivariate frame and the cleaning counters.
 *
 * @since 1.0.0
 */
public final class PreparedInput {

    private final SortedMap<String, MetricSeries> series;
    private final FeatureFrame frame;
    private final int receivedCount;
    private final int invalidCount;
    private final int duplicateCount;

    PreparedInput(Map<String, MetricSeries> series, FeatureFrame frame, int receivedCount, int invalidCount,
            int duplicateCount) {
        this.series = Collections.unmodifiableSortedMap(new TreeMap<>(series));
        this.frame = Objects.requireNonNull(frame, "frame must not be null");
        this.receivedCount = receivedCount;
        this.invalidCount = invalidCount;
        this.duplicateCount = duplicateCount;
    }

    /** Series keyed by metric name, in name order. */
    public SortedMap<String, MetricSeries> getSeries() {
        return series;
    }

    public Optional<MetricSeries> series(String metricName) {
        return Optional.ofNullable(series.get(metricName));
    }

    public FeatureFrame getFrame() {
        return frame;
    }

    public int getReceivedCount() {
        return receivedCount;
    }

    public int getInvalidCount() {
        return invalidCount;
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }

    public int getGapCount() {
        return series.values().stream().mapToInt(MetricSeries::gapCount).sum();
    }

    public int getObservedCount() {
        return series.values().stream().mapToInt(MetricSeries::observedCount).sum();
    }

    public boolean hasObservations() {
        return getObservedCount() > 0;
    }

    /**
     * Build the evaluation window of an observed point.
     *
     * @param metricName    metric of the candidate
     * @param observedIndex index of the candidate in the metric's observed view
     * @param historyWindow maximum window size, candidate included
     * @return the window
     * @throws IllegalArgumentException if the metric is unknown or the index
     *                                  out of range
     */
    public DetectionWindow window(String metricName, int observedIndex, int historyWindow) {
        MetricSeries s = series.get(metricName);
        if (s == null) {
            throw new IllegalArgumentException("Unknown metric: " + metricName);
        }
        if (observedIndex < 0 || observedIndex >= s.observedCount()) {
            throw new IllegalArgumentException("Observed index " + observedIndex + " out of range for "
                    + metricName + " (" + s.observedCount() + " observed)");
        }
        int start = Math.max(0, observedIndex - historyWindow + 1);
        double[] baseline = s.observedValues(start, observedIndex);

        FeatureWindow features = null;
        int row = frame.indexOf(s.observedTimestamp(observedIndex));
        int column = frame.featureIndex(metricName);
        if (row >= 0 && column >= 0) {
            int rowStart = Math.max(0, row - historyWindow + 1);
            double[][] baselineRows = new double[row - rowStart][];
            for (int r = rowStart; r < row; r++) {
                baselineRows[r - rowStart] = frame.row(r);
            }
            features = new FeatureWindow(frame.getFeatureNames(), baselineRows, frame.row(row), column);
        }
        return new DetectionWindow(metricName, s.observedTimestamp(observedIndex), s.observedValue(observedIndex),
                baseline, features);
    }

    @Override
    public String toString() {
        return "PreparedInput{metrics=" + series.keySet() +
                ", received=" + receivedCount +
                ", invalid=" + invalidCount +
                ", duplicates=" + duplicateCount +
                ", gaps=" + getGapCount() +
                ", alignedRows=" + frame.rowCount() +
                '}';
    }
}
