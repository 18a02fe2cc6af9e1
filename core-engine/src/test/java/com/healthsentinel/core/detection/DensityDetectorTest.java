package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.healthsentinel.core.detection.DetectorTestSupport.constant;
import static com.healthsentinel.core.detection.DetectorTestSupport.ramp;
import static com.healthsentinel.core.detection.DetectorTestSupport.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DensityDetector}.
 */
class DensityDetectorTest {

    private static DensityDetector detector(int neighbours) {
        DetectorSettings settings = new DetectorSettings();
        settings.setDensityNeighbors(neighbours);
        return new DensityDetector(settings);
    }

    @Test
    @DisplayName("Should fire for a point in a much sparser region than its neighbours")
    void shouldFireOnSparsePoint() {
        DetectorResult result = detector(5).evaluate(window(100, ramp(20))).orElseThrow();

        assertThat(result.getDetectorKind()).isEqualTo(DetectorKind.LOCAL_OUTLIER_FACTOR);
        assertThat(result.getRawScore()).isGreaterThan(1.5);
        assertThat(result.isFired()).isTrue();
    }

    @Test
    @DisplayName("Should not fire for a point inside a dense region")
    void shouldNotFireInsideCluster() {
        DetectorResult result = detector(5).evaluate(window(10.5, ramp(20))).orElseThrow();

        assertThat(result.isFired()).isFalse();
    }

    @Test
    @DisplayName("Should give a factor of one on a constant series")
    void shouldHandleDuplicates() {
        DetectorResult result = detector(5).evaluate(window(10, constant(10, 20))).orElseThrow();

        assertThat(result.getRawScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getNormalizedScore()).isZero();
    }

    /** {@code count} readings cycling through the given rounded levels. */
    private static double[] rounded(int count, double... levels) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = levels[i % levels.length];
        }
        return values;
    }

    @Test
    @DisplayName("Should not fire for an unseen value between rounded readings")
    void shouldNotFireBetweenRoundedReadings() {
        DetectorResult result = detector(20).evaluate(window(60, rounded(88, 58, 59, 61, 62))).orElseThrow();

        assertThat(result.getRawScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.isFired()).isFalse();
    }

    @Test
    @DisplayName("Should not fire for the next rounded value just past the history")
    void shouldNotFireOneStepBeyondRoundedReadings() {
        DetectorResult result = detector(20).evaluate(window(62, rounded(90, 59, 60, 61))).orElseThrow();

        assertThat(result.getRawScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.isFired()).isFalse();
    }

    @Test
    @DisplayName("Should still fire for a far value among rounded readings")
    void shouldFireFarFromRoundedReadings() {
        DetectorResult result = detector(20).evaluate(window(75, rounded(88, 58, 59, 61, 62))).orElseThrow();

        assertThat(result.getRawScore()).isCloseTo(13.0, within(1e-9));
        assertThat(result.isFired()).isTrue();
    }

    @Test
    @DisplayName("Should take the median gap between distinct values as the resolution")
    void shouldMeasureResolution() {
        assertThat(WindowStatistics.resolution(rounded(40, 58, 59, 61, 62))).isEqualTo(1.0);
        assertThat(WindowStatistics.resolution(new double[] { 7.0, 7.25, 7.5, 8.0, 7.25 })).isEqualTo(0.25);
        assertThat(WindowStatistics.resolution(constant(10, 5))).isZero();
    }

    @Test
    @DisplayName("Should map the threshold to the firing level")
    void shouldNormalise() {
        DensityDetector detector = detector(5);

        assertThat(detector.normalize(1.5)).isCloseTo(0.5, within(1e-12));
        assertThat(detector.normalize(0.8)).isZero();
        assertThat(detector.normalize(3.0)).isCloseTo(0.8, within(1e-12));
    }

    @Test
    @DisplayName("Should reject a threshold that does not exceed one")
    void shouldRejectThreshold() {
        DetectorSettings settings = new DetectorSettings();
        settings.setDensityThreshold(1.0);

        assertThatThrownBy(() -> new DensityDetector(settings)).isInstanceOf(IllegalArgumentException.class);
    }
}
