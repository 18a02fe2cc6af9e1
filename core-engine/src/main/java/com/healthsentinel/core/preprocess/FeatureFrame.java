package com.healthsentinel.core.preprocess;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Rows of simultaneous values across metrics.
 *
 * <p>
 * A row exists only for a timestamp at which every metric in
 * {@link #getFeatureNames()} has an observed value. Columns follow the
 * feature name order.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureFrame {

    private static final FeatureFrame EMPTY = new FeatureFrame(List.of(), List.of(), new double[0][]);

    private final List<String> featureNames;
    private final List<Instant> timestamps;
    private final double[][] rows;

    FeatureFrame(List<String> featureNames, List<Instant> timestamps, double[][] rows) {
        this.featureNames = List.copyOf(featureNames);
        this.timestamps = Collections.unmodifiableList(timestamps);
        this.rows = rows;
    }

    public static FeatureFrame empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int rowCount() {
        return rows.length;
    }

    public double[] row(int row) {
        return rows[row].clone();
    }

    /**
     * @return index of the row at {@code timestamp}, or -1
     */
    public int indexOf(Instant timestamp) {
        int idx = Collections.binarySearch(timestamps, timestamp);
        return idx >= 0 ? idx : -1;
    }

    /**
     * @return column index of {@code metricName}, or -1
     */
    public int featureIndex(String metricName) {
        return featureNames.indexOf(metricName);
    }
}
