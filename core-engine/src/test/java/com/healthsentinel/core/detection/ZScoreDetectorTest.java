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
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreDetector}.
 */
class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector(new DetectorSettings());

    @Test
    @DisplayName("Should abstain below the minimum window size")
    void shouldAbstainOnShortWindow() {
        assertThat(detector.evaluate(window(100, constant(10, 6)))).isEmpty();
        assertThat(detector.evaluate(window(100, constant(10, 7)))).isPresent();
    }

    @Test
    @DisplayName("Should saturate when a constant baseline is broken")
    void shouldSaturateOnZeroSpread() {
        DetectorResult result = detector.evaluate(window(100, constant(10, 7))).orElseThrow();

        assertThat(result.getRawScore()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(result.getNormalizedScore()).isEqualTo(1.0);
        assertThat(result.isFired()).isTrue();
        assertThat(result.getDetectorKind()).isEqualTo(DetectorKind.Z_SCORE);
    }

    @Test
    @DisplayName("Should score zero when the candidate matches a constant baseline")
    void shouldNotFireOnConstantSeries() {
        DetectorResult result = detector.evaluate(window(10, constant(10, 20))).orElseThrow();

        assertThat(result.getRawScore()).isZero();
        assertThat(result.isFired()).isFalse();
    }

    @Test
    @DisplayName("Should compute the population z score against the baseline only")
    void shouldComputeLeaveOneOutScore() {
        double std = Math.sqrt(60.0 / 9.0);
        DetectorResult result = detector.evaluate(window(20, ramp(9))).orElseThrow();

        double z = 15.0 / std;
        assertThat(result.getRawScore()).isCloseTo(z, within(1e-9));
        assertThat(result.getNormalizedScore()).isCloseTo(z / (z + 3.0), within(1e-9));
        assertThat(result.isFired()).isTrue();
    }

    @Test
    @DisplayName("Should keep the sign for low values and not fire inside the threshold")
    void shouldKeepSign() {
        DetectorResult result = detector.evaluate(window(0, ramp(9))).orElseThrow();

        assertThat(result.getRawScore()).isNegative();
        assertThat(result.isFired()).isFalse();
    }
}
