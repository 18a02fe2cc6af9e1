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
 * Standard score of the candidate against the baseline.
 *
 * <p>
 * {@code z = (x - mean) / std} with the population standard deviation of the
 * baseline. Fires when {@code |z|} exceeds the configured threshold.
 * </p>
 *
 * <h3>Constant history</h3>
 * <p>
 * A standard deviation of zero means all baseline values are identical, so
 * any different value is an outlier: the score saturates to infinity. A value
 * equal to the constant scores 0.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    private final double threshold;
    private final int minimumPoints;

    public ZScoreDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.threshold = settings.getZscoreThreshold();
        this.minimumPoints = settings.getMinimumPoints();
        if (threshold <= 0) {
            throw new IllegalArgumentException("zscoreThreshold must be > 0, got: " + threshold);
        }
    }

    @Override
    public Optional<DetectorResult> evaluate(DetectionWindow window) {
        Objects.requireNonNull(window, "DetectionWindow must not be null");
        if (window.size() < minimumPoints) {
            LOG.trace("{}: {} point(s) in window, need {} - skipping", window.getMetricName(), window.size(),
                    minimumPoints);
            return Optional.empty();
        }

        double[] baseline = window.getBaseline();
        double mean = WindowStatistics.mean(baseline);
        double std = WindowStatistics.populationStd(baseline);
        double z = WindowStatistics.standardized(window.getValue() - mean, std);

        DetectorResult result = DetectorResult.builder()
                .detectorKind(DetectorKind.Z_SCORE)
                .metricName(window.getMetricName())
                .timestamp(window.getTimestamp())
                .value(window.getValue())
                .rawScore(z)
                .normalizedScore(WindowStatistics.normalize(z, threshold))
                .build();
        if (result.isFired()) {
            LOG.debug("zscore fired for {}@{}: value={} mean={} std={} z={}", window.getMetricName(),
                    window.getTimestamp(), window.getValue(), mean, std, z);
        }
        return Optional.of(result);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.Z_SCORE;
    }
}
