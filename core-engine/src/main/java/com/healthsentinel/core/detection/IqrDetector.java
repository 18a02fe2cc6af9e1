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
 * Tukey fences on the baseline quartiles.
 *
 * <p>
 * The raw score is the signed number of inter-quartile ranges between the
 * candidate and the nearer quartile (0 inside the box), so the detector fires
 * exactly when the candidate lies outside {@code [Q1 - k*IQR, Q3 + k*IQR]}.
 * Abstains when the IQR is zero.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrDetector.class);

    private final double multiplier;
    private final int minimumPoints;

    public IqrDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.multiplier = settings.getIqrMultiplier();
        this.minimumPoints = settings.getMinimumPoints();
    }

    @Override
    public Optional<DetectorResult> evaluate(DetectionWindow window) {
        Objects.requireNonNull(window, "DetectionWindow must not be null");
        if (window.size() < minimumPoints) {
            return Optional.empty();
        }

        double[] baseline = window.getBaseline();
        double q1 = WindowStatistics.percentile(baseline, 25);
        double q3 = WindowStatistics.percentile(baseline, 75);
        double iqr = q3 - q1;
        if (iqr <= 0.0) {
            LOG.trace("{}@{}: IQR is zero - skipping", window.getMetricName(), window.getTimestamp());
            return Optional.empty();
        }

        double x = window.getValue();
        double score;
        if (x > q3) {
            score = (x - q3) / iqr;
        } else if (x < q1) {
            score = -(q1 - x) / iqr;
        } else {
            score = 0.0;
        }

        DetectorResult result = DetectorResult.builder()
                .detectorKind(DetectorKind.IQR)
                .metricName(window.getMetricName())
                .timestamp(window.getTimestamp())
                .value(x)
                .rawScore(score)
                .normalizedScore(WindowStatistics.normalize(score, multiplier))
                .build();
        if (result.isFired()) {
            LOG.debug("iqr fired for {}@{}: value={} q1={} q3={} score={}", window.getMetricName(),
                    window.getTimestamp(), x, q1, q3, score);
        }
        return Optional.of(result);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.IQR;
    }
}
