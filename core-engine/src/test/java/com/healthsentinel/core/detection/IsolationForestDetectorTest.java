package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.preprocess.DetectionWindow;
import com.healthsentinel.core.preprocess.FeatureWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.healthsentinel.core.detection.DetectorTestSupport.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForestDetector} and {@link IsolationForest}.
 */
class IsolationForestDetectorTest {

    private final IsolationForestDetector detector = new IsolationForestDetector(new DetectorSettings());

    private static double[] noisyBaseline(int n, double centre, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = centre + random.nextGaussian() * 2.0;
        }
        return values;
    }

    /** hrv and resting heart rate rows, with the heart rate as the metric under evaluation. */
    private static DetectionWindow paired(double hrvCandidate, double heartCandidate, int n) {
        double[] hrv = noisyBaseline(n, 50, 5);
        double[] heart = noisyBaseline(n, 60, 7);
        double[][] rows = new double[n][];
        for (int i = 0; i < n; i++) {
            rows[i] = new double[] { hrv[i], heart[i] };
        }
        FeatureWindow features = new FeatureWindow(List.of("hrv", "resting_heart_rate"), rows,
                new double[] { hrvCandidate, heartCandidate }, 1);
        return window(heartCandidate, heart, features);
    }

    @Test
    @DisplayName("Should fire for a row far outside the baseline")
    void shouldFireOnIsolatedRow() {
        DetectorResult result = detector.evaluate(paired(50, 300, 50)).orElseThrow();

        assertThat(result.isFired()).isTrue();
        assertThat(result.getRawScore()).isGreaterThan(0.5);
        assertThat(result.getContributingFeatures().keySet()).containsExactly("resting_heart_rate", "hrv");
    }

    @Test
    @DisplayName("Should not fire for a row identical to a baseline row")
    void shouldNotFireForSeenRow() {
        double[] hrv = noisyBaseline(50, 50, 5);
        double[] heart = noisyBaseline(50, 60, 7);

        assertThat(detector.evaluate(paired(hrv[17], heart[17], 50)).orElseThrow().isFired()).isFalse();
        assertThat(detector.evaluate(paired(50, 60, 50)).orElseThrow().isFired()).isFalse();
    }

    @Test
    @DisplayName("Should abstain without aligned multivariate rows")
    void shouldAbstainOnSingleMetric() {
        assertThat(detector.evaluate(window(150, noisyBaseline(50, 60, 7)))).isEmpty();

        double[] rounded = new double[88];
        double[] levels = { 58, 59, 61, 62 };
        for (int i = 0; i < rounded.length; i++) {
            rounded[i] = levels[i % levels.length];
        }
        assertThat(detector.evaluate(window(60, rounded))).isEmpty();
    }

    @Test
    @DisplayName("Should produce identical results for identical input")
    void shouldBeDeterministic() {
        DetectorResult first = detector.evaluate(paired(44, 75, 40)).orElseThrow();
        DetectorResult second = new IsolationForestDetector(new DetectorSettings())
                .evaluate(paired(44, 75, 40)).orElseThrow();

        assertThat(second.getRawScore()).isEqualTo(first.getRawScore());
        assertThat(second.getNormalizedScore()).isEqualTo(first.getNormalizedScore());
        assertThat(second.getContributingFeatures()).isEqualTo(first.getContributingFeatures());
    }

    @Test
    @DisplayName("Should not attribute a multivariate outlier to a metric that did not drive it")
    void shouldCapUnattributedOutliers() {
        double[] hrv = noisyBaseline(30, 50, 11);
        double[] heart = noisyBaseline(30, 60, 13);
        double[][] rows = new double[30][];
        for (int i = 0; i < 30; i++) {
            rows[i] = new double[] { hrv[i], heart[i] };
        }
        // hrv collapses while heart rate stays typical
        FeatureWindow features = new FeatureWindow(List.of("hrv", "resting_heart_rate"), rows,
                new double[] { 5, 60 }, 1);

        DetectorResult result = detector.evaluate(window(60, heart, features)).orElseThrow();

        assertThat(result.isFired()).isFalse();
        assertThat(result.getNormalizedScore()).isLessThanOrEqualTo(DetectorResult.FIRING_LEVEL);
        assertThat(result.getContributingFeatures().keySet()).first().isEqualTo("hrv");
    }

    @Test
    @DisplayName("Should rank feature contributions strongest first")
    void shouldRankContributions() {
        double[][] rows = {
                { 1, 10 }, { 2, 20 }, { 3, 30 }, { 2, 20 }, { 1, 10 }
        };
        FeatureWindow features = new FeatureWindow(List.of("a", "b"), rows, new double[] { 2, 90 }, 0);

        Map<String, Double> ranked = IsolationForestDetector.contributions(features);

        assertThat(ranked.keySet()).containsExactly("b", "a");
    }

    @Test
    @DisplayName("Should use the nearest-rank quantile and map the cutoff to the firing level")
    void shouldComputeCutoffAndNormalisation() {
        double[] scores = { 0.4, 0.45, 0.5, 0.55, 0.6 };

        assertThat(IsolationForestDetector.nearestRank(scores, 0.99)).isEqualTo(0.6);
        assertThat(IsolationForestDetector.nearestRank(scores, 0.5)).isEqualTo(0.5);

        assertThat(IsolationForestDetector.normalize(0.6, 0.6)).isEqualTo(0.5);
        assertThat(IsolationForestDetector.normalize(0.3, 0.6)).isCloseTo(0.25, within(1e-12));
        assertThat(IsolationForestDetector.normalize(0.8, 0.6)).isCloseTo(0.75, within(1e-12));
        assertThat(IsolationForestDetector.normalize(1.0, 0.6)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should follow the binary search tree path length formula")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }
}
