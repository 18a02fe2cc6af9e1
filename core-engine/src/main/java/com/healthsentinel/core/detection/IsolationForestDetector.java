package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.preprocess.DetectionWindow;
import com.healthsentinel.core.preprocess.FeatureWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Multivariate outlier detector backed by an {@link IsolationForest}.
 *
 * <h3>Feature frame</h3>
 * <p>
 * The forest is trained on the aligned rows of the window when the
 * candidate's timestamp has a row across all metrics of the request. Without
 * such a row the detector abstains: a single rounded metric is mostly repeated
 * values, and any value the history has not hit exactly would isolate at once,
 * however ordinary it is. Single-metric deviations are left to the
 * statistical and density detectors. The candidate row is part of the
 * training set, since a tree can only isolate a point it has seen.
 * </p>
 *
 * <h3>Cutoff</h3>
 * <p>
 * The forest scores the baseline rows. The cutoff is the
 * {@code (1 - contamination)} nearest-rank quantile of those scores, never
 * below 0.5. The detector fires when the candidate scores strictly above the
 * cutoff, so a candidate identical to a baseline row never fires.
 * </p>
 *
 * <h3>Attribution</h3>
 * <p>
 * Features are ranked by {@code |x - mean| / std} over the baseline. A
 * multivariate detection only counts for the candidate metric when that metric
 * is the top-ranked feature; otherwise the score is capped at the firing level.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestDetector.class);

    /** Cutoff floor: scores at or below 0.5 are never anomalous. */
    static final double MIN_CUTOFF = 0.5;

    private final double contamination;
    private final int trees;
    private final int sampleSize;
    private final long seed;
    private final int minimumPoints;

    public IsolationForestDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.contamination = settings.getContamination();
        this.trees = settings.getIsolationTrees();
        this.sampleSize = settings.getIsolationSampleSize();
        this.seed = settings.getIsolationSeed();
        this.minimumPoints = settings.getMinimumPoints();
    }

    @Override
    public Optional<DetectorResult> evaluate(DetectionWindow window) {
        Objects.requireNonNull(window, "DetectionWindow must not be null");
        if (window.size() < minimumPoints) {
            return Optional.empty();
        }

        Optional<FeatureWindow> features = window.getFeatures()
                .filter(FeatureWindow::isMultivariate)
                .filter(f -> f.getBaselineRows().length + 1 >= minimumPoints);
        if (features.isEmpty()) {
            LOG.trace("{}@{}: no aligned multivariate rows, isolation forest abstains",
                    window.getMetricName(), window.getTimestamp());
            return Optional.empty();
        }
        FeatureWindow frame = features.get();

        double[][] baselineRows = frame.getBaselineRows();
        double[][] trainingRows = Arrays.copyOf(baselineRows, baselineRows.length + 1);
        trainingRows[baselineRows.length] = frame.getCandidateRow();
        IsolationForest forest = IsolationForest.train(trainingRows, trees, sampleSize, seed);

        double[] baselineScores = new double[baselineRows.length];
        for (int i = 0; i < baselineRows.length; i++) {
            baselineScores[i] = forest.score(baselineRows[i]);
        }
        double cutoff = Math.max(nearestRank(baselineScores, 1.0 - contamination), MIN_CUTOFF);
        double score = forest.score(frame.getCandidateRow());
        double normalized = normalize(score, cutoff);

        Map<String, Double> contributions = contributions(frame);
        if (normalized > DetectorResult.FIRING_LEVEL && !isTopFeature(contributions, window.getMetricName())) {
            LOG.trace("{}@{}: multivariate outlier driven by another metric - not attributed",
                    window.getMetricName(), window.getTimestamp());
            normalized = DetectorResult.FIRING_LEVEL;
        }

        DetectorResult result = DetectorResult.builder()
                .detectorKind(DetectorKind.ISOLATION_FOREST)
                .metricName(window.getMetricName())
                .timestamp(window.getTimestamp())
                .value(window.getValue())
                .rawScore(score)
                .normalizedScore(normalized)
                .contributingFeatures(contributions)
                .build();
        if (result.isFired()) {
            LOG.debug("isolation_forest fired for {}@{}: score={} cutoff={} features={}",
                    window.getMetricName(), window.getTimestamp(), score, cutoff, contributions.keySet());
        }
        return Optional.of(result);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ISOLATION_FOREST;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static double normalize(double score, double cutoff) {
        if (score <= cutoff) {
            return 0.5 * score / cutoff;
        }
        return Math.min(1.0, 0.5 + 0.5 * (score - cutoff) / (1.0 - cutoff));
    }

    /**
     * Smallest value such that at least {@code q} of the array is at or below
     * it.
     */
    static double nearestRank(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(q * sorted.length);
        rank = Math.max(1, Math.min(sorted.length, rank));
        return sorted[rank - 1];
    }

    /**
     * Per-feature deviation of the candidate from the baseline mean, in
     * baseline standard deviations, strongest first.
     */
    static Map<String, Double> contributions(FeatureWindow frame) {
        double[][] rows = frame.getBaselineRows();
        double[] candidate = frame.getCandidateRow();
        List<Map.Entry<String, Double>> entries = new ArrayList<>(frame.dimensions());
        for (int f = 0; f < frame.dimensions(); f++) {
            double[] column = new double[rows.length];
            for (int r = 0; r < rows.length; r++) {
                column[r] = rows[r][f];
            }
            double mean = WindowStatistics.mean(column);
            double std = WindowStatistics.populationStd(column);
            double deviation = Math.abs(candidate[f] - mean);
            double weight = std > 0 ? deviation / std : deviation;
            entries.add(Map.entry(frame.getFeatureNames().get(f), weight));
        }
        // stable sort keeps feature order for equal weights
        entries.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));

        Map<String, Double> ranked = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : entries) {
            ranked.put(e.getKey(), e.getValue());
        }
        return ranked;
    }

    private static boolean isTopFeature(Map<String, Double> ranked, String metricName) {
        double top = ranked.values().iterator().next();
        return ranked.getOrDefault(metricName, 0.0) >= top;
    }
}
