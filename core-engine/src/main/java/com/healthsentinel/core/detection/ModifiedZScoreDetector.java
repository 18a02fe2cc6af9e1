package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.preprocess.DetectionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Robust z-score based on the median absolute deviation.
 *
 * <p>
 * {@code mz = 0.6745 * (x - median) / MAD}. Abstains when the MAD is zero,
 * which happens whenever more than half of the baseline shares one value.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ModifiedZScoreDetector.class);

    /** Scales the MAD to the standard deviation of a normal distribution. */
    static final double CONSISTENCY_CONSTANT = 0.6745;

    private final double threshold;
    private final int minimumPoints;

    public ModifiedZScoreDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.threshold = settings.getModifiedZscoreThreshold();
        this.minimumPoints = settings.getMinimumPoints();
    }

    @Override
    public Optional<DetectorResult> evaluate(DetectionWindow window) {
        Objects.requireNonNull(window, "DetectionWindow must not be null");
        if (window.size() < minimumPoints) {
            return Optional.empty();
        }

        double[] baseline = window.getBaseline();
        double median = WindowStatistics.median(baseline);
        double[] deviations = new double[baseline.length];
        for (int i = 0; i < baseline.length; i++) {
            deviations[i] = Math.abs(baseline[i] - median);
        }
        double mad = WindowStatistics.median(deviations);
        if (mad == 0.0) {
            LOG.trace("{}@{}: MAD is zero - skipping", window.getMetricName(), window.getTimestamp());
            return Optional.empty();
        }

        double score = CONSISTENCY_CONSTANT * (window.getValue() - median) / mad;
        DetectorResult result = DetectorResult.builder()
                .detectorKind(DetectorKind.MODIFIED_Z_SCORE)
                .metricName(window.getMetricName())
                .timestamp(window.getTimestamp())
                .value(window.getValue())
                .rawScore(score)
                .normalizedScore(WindowStatistics.normalize(score, threshold))
                .build();
        if (result.isFired()) {
            LOG.debug("modified_zscore fired for {}@{}: value={} median={} mad={} score={}",
                    window.getMetricName(), window.getTimestamp(), window.getValue(), median, mad, score);
        }
        return Optional.of(result);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.MODIFIED_Z_SCORE;
    }
}
