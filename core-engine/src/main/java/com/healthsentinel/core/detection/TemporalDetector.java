package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.error.DetectorUnavailableException;
import com.healthsentinel.core.error.InsufficientDataException;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.preprocess.DetectionWindow;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Short-horizon autoregressive predictor.
 *
 * <p>
 * Fits {@code x[t] = b0 + b1*x[t-1] + ... + bp*x[t-p]} by ordinary least
 * squares over the last {@code temporalSequenceLength} baseline points,
 * predicts the candidate, and scores the residual in units of the fit's
 * residual standard deviation.
 * </p>
 *
 * <h3>Degradation</h3>
 * <p>
 * This is an optional capability. Availability is decided once, at
 * construction: the detector is disabled by configuration or when the
 * regression backend fails a self-test fit. Per window, too little history or a
 * singular fit raises {@link DetectorUnavailableException}; the engine then
 * proceeds without this detector for that window.
 * </p>
 *
 * @since 1.0.0
 */
public class TemporalDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalDetector.class);

    /** Relative tolerance below which residuals count as an exact fit. */
    static final double EXACT_FIT_TOLERANCE = 1e-9;

    private final int sequenceLength;
    private final int lags;
    private final double threshold;
    private final int minimumPoints;
    private final boolean available;

    public TemporalDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.sequenceLength = settings.getTemporalSequenceLength();
        this.lags = settings.getTemporalLags();
        this.threshold = settings.getTemporalThreshold();
        this.minimumPoints = settings.getMinimumPoints();
        if (!settings.isTemporalEnabled()) {
            LOG.info("Temporal detector disabled by configuration");
            this.available = false;
        } else {
            this.available = selfTest();
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.TEMPORAL;
    }

    @Override
    public Optional<DetectorResult> evaluate(DetectionWindow window) {
        Objects.requireNonNull(window, "DetectionWindow must not be null");
        if (!available) {
            throw new DetectorUnavailableException(DetectorKind.TEMPORAL, "capability not available");
        }
        if (window.size() < minimumPoints) {
            return Optional.empty();
        }
        double[] baseline = window.getBaseline();
        if (baseline.length < sequenceLength) {
            throw new DetectorUnavailableException(DetectorKind.TEMPORAL,
                    "not enough history to train for " + window.getMetricName() + "@" + window.getTimestamp(),
                    new InsufficientDataException(sequenceLength, baseline.length));
        }

        double[] history = Arrays.copyOfRange(baseline, baseline.length - sequenceLength, baseline.length);
        double tolerance = EXACT_FIT_TOLERANCE * Math.max(1.0, maxAbs(history));

        double predicted;
        double spread;
        if (WindowStatistics.isConstant(history)) {
            predicted = history[0];
            spread = 0.0;
        } else {
            Fit fit = fit(history, window);
            predicted = fit.predictNext(history);
            spread = fit.residualStd < tolerance ? 0.0 : fit.residualStd;
        }

        double deviation = window.getValue() - predicted;
        if (Math.abs(deviation) < tolerance) {
            deviation = 0.0;
        }
        double score = WindowStatistics.standardized(deviation, spread);

        DetectorResult result = DetectorResult.builder()
                .detectorKind(DetectorKind.TEMPORAL)
                .metricName(window.getMetricName())
                .timestamp(window.getTimestamp())
                .value(window.getValue())
                .rawScore(score)
                .normalizedScore(WindowStatistics.normalize(score, threshold))
                .build();
        if (result.isFired()) {
            LOG.debug("temporal fired for {}@{}: value={} predicted={} residualStd={} score={}",
                    window.getMetricName(), window.getTimestamp(), window.getValue(), predicted, spread, score);
        }
        return Optional.of(result);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Fit fit(double[] history, DetectionWindow window) {
        int rows = history.length - lags;
        double[] y = new double[rows];
        double[][] x = new double[rows][lags];
        for (int t = lags; t < history.length; t++) {
            y[t - lags] = history[t];
            for (int j = 1; j <= lags; j++) {
                x[t - lags][j - 1] = history[t - j];
            }
        }
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            regression.newSampleData(y, x);
            double[] beta = regression.estimateRegressionParameters();
            double[] residuals = regression.estimateResiduals();
            for (double b : beta) {
                if (!Double.isFinite(b)) {
                    throw new DetectorUnavailableException(DetectorKind.TEMPORAL,
                            "regression produced non-finite coefficients for " + window.getMetricName());
                }
            }
            return new Fit(beta, WindowStatistics.populationStd(residuals));
        } catch (MathIllegalArgumentException e) {
            // includes SingularMatrixException
            throw new DetectorUnavailableException(DetectorKind.TEMPORAL,
                    "regression failed for " + window.getMetricName() + "@" + window.getTimestamp(), e);
        }
    }

    /**
     * Fit a known noiseless AR(1) system and check the recovered slope.
     */
    private boolean selfTest() {
        try {
            double[] series = new double[2 * lags + 8];
            series[0] = 1.0;
            for (int i = 1; i < series.length; i++) {
                series[i] = 2.0 + 0.5 * series[i - 1];
            }
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            int rows = series.length - 1;
            double[] y = Arrays.copyOfRange(series, 1, series.length);
            double[][] x = new double[rows][1];
            for (int i = 0; i < rows; i++) {
                x[i][0] = series[i];
            }
            regression.newSampleData(y, x);
            double[] beta = regression.estimateRegressionParameters();
            boolean ok = beta.length == 2 && Double.isFinite(beta[0]) && Double.isFinite(beta[1]);
            if (ok) {
                LOG.debug("Temporal detector available (AR({}) over {} points)", lags, sequenceLength);
            } else {
                LOG.warn("Temporal detector self-test returned unexpected coefficients {} - disabling",
                        Arrays.toString(beta));
            }
            return ok;
        } catch (RuntimeException | LinkageError e) {
            LOG.warn("Temporal detector unavailable, regression backend failed: {}", e.toString());
            return false;
        }
    }

    private static double maxAbs(double[] values) {
        double max = 0.0;
        for (double v : values) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }

    private static final class Fit {
        private final double[] beta;
        private final double residualStd;

        private Fit(double[] beta, double residualStd) {
            this.beta = beta;
            this.residualStd = residualStd;
        }

        double predictNext(double[] history) {
            double prediction = beta[0];
            for (int j = 1; j < beta.length; j++) {
                prediction += beta[j] * history[history.length - j];
            }
            return prediction;
        }
    }
}
