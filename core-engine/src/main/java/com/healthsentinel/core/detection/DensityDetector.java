package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.preprocess.DetectionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Local outlier factor of the candidate among the values of its window.
 *
 * <p>
 * Because the window is local in time, this catches values that are ordinary
 * for the metric overall but isolated relative to the recent past.
 * {@code k = min(densityNeighbors, baseline size)}; the local reachability
 * density of a point is the inverse of its mean reachability distance to its
 * {@code k} nearest neighbours. The factor is the neighbours' mean density
 * divided by the candidate's density; values well above 1 mean the candidate
 * sits in a sparser region than its neighbours.
 * </p>
 *
 * <p>
 * Mean reachability distances are floored at the baseline's measurement
 * {@link WindowStatistics#resolution resolution}. Health readings are mostly
 * rounded, so a history of repeated integers would otherwise have densities
 * near {@code 1 / MIN_REACH_DISTANCE}, and any value between two of them a
 * factor in the hundreds of millions.
 * </p>
 *
 * @since 1.0.0
 */
public class DensityDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DensityDetector.class);

    /** Floor for the mean reachability distance when the baseline is constant. */
    static final double MIN_REACH_DISTANCE = 1e-9;

    private final int neighbors;
    private final double threshold;
    private final int minimumPoints;

    public DensityDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.neighbors = settings.getDensityNeighbors();
        this.threshold = settings.getDensityThreshold();
        this.minimumPoints = settings.getMinimumPoints();
        if (threshold <= 1.0) {
            throw new IllegalArgumentException("densityThreshold must be > 1.0, got: " + threshold);
        }
    }

    @Override
    public Optional<DetectorResult> evaluate(DetectionWindow window) {
        Objects.requireNonNull(window, "DetectionWindow must not be null");
        if (window.size() < minimumPoints) {
            return Optional.empty();
        }

        double[] baseline = window.getBaseline();
        double[] points = Arrays.copyOf(baseline, baseline.length + 1);
        int candidate = baseline.length;
        points[candidate] = window.getValue();
        int k = Math.min(neighbors, baseline.length);
        double floor = Math.max(WindowStatistics.resolution(baseline), MIN_REACH_DISTANCE);

        int[][] neighbourhoods = new int[points.length][];
        double[] kDistance = new double[points.length];
        for (int p = 0; p < points.length; p++) {
            neighbourhoods[p] = nearest(points, p, k);
            kDistance[p] = Math.abs(points[p] - points[neighbourhoods[p][k - 1]]);
        }

        double candidateDensity = reachabilityDensity(points, candidate, neighbourhoods, kDistance, floor);
        double neighbourDensity = 0.0;
        for (int o : neighbourhoods[candidate]) {
            neighbourDensity += reachabilityDensity(points, o, neighbourhoods, kDistance, floor);
        }
        neighbourDensity /= k;
        double lof = neighbourDensity / candidateDensity;

        DetectorResult result = DetectorResult.builder()
                .detectorKind(DetectorKind.LOCAL_OUTLIER_FACTOR)
                .metricName(window.getMetricName())
                .timestamp(window.getTimestamp())
                .value(window.getValue())
                .rawScore(lof)
                .normalizedScore(normalize(lof))
                .build();
        if (result.isFired()) {
            LOG.debug("lof fired for {}@{}: value={} lof={} k={} floor={}", window.getMetricName(),
                    window.getTimestamp(), window.getValue(), lof, k, floor);
        }
        return Optional.of(result);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.LOCAL_OUTLIER_FACTOR;
    }

    double normalize(double lof) {
        if (!(lof > 1.0)) {
            return 0.0;
        }
        double excess = lof - 1.0;
        return excess / (excess + (threshold - 1.0));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Indices of the k nearest other points; ties keep index order. */
    private static int[] nearest(double[] points, int p, int k) {
        return IntStream.range(0, points.length)
                .filter(i -> i != p)
                .boxed()
                .sorted(Comparator.comparingDouble(i -> Math.abs(points[i] - points[p])))
                .limit(k)
                .mapToInt(Integer::intValue)
                .toArray();
    }

    private static double reachabilityDensity(double[] points, int p, int[][] neighbourhoods, double[] kDistance,
            double floor) {
        double total = 0.0;
        for (int o : neighbourhoods[p]) {
            total += Math.max(kDistance[o], Math.abs(points[p] - points[o]));
        }
        double meanReach = total / neighbourhoods[p].length;
        return 1.0 / Math.max(meanReach, floor);
    }
}
