package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.error.DetectorUnavailableException;
import com.healthsentinel.core.error.InsufficientDataException;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.healthsentinel.core.detection.DetectorTestSupport.constant;
import static com.healthsentinel.core.detection.DetectorTestSupport.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TemporalDetector}.
 */
class TemporalDetectorTest {

    private final TemporalDetector detector = new TemporalDetector(new DetectorSettings());

    /** Daily cycle with small noise. */
    private static double[] cycle(int n) {
        Random random = new Random(5);
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = 60 + 5 * Math.sin(t / 3.0) + random.nextGaussian() * 0.3;
        }
        return values;
    }

    @Test
    @DisplayName("Should be available with the bundled regression backend")
    void shouldBeAvailable() {
        assertThat(detector.isAvailable()).isTrue();
        assertThat(detector.getKind()).isEqualTo(DetectorKind.TEMPORAL);
    }

    @Test
    @DisplayName("Should fire when a value breaks the learned pattern")
    void shouldFireOnPatternBreak() {
        DetectorResult result = detector.evaluate(window(95, cycle(30))).orElseThrow();

        assertThat(result.isFired()).isTrue();
        assertThat(result.getRawScore()).isGreaterThan(3.0);
    }

    @Test
    @DisplayName("Should predict the constant for a constant history")
    void shouldPredictConstant() {
        assertThat(detector.evaluate(window(42, constant(42, 30))).orElseThrow().getRawScore()).isZero();
        assertThat(detector.evaluate(window(43, constant(42, 30))).orElseThrow().isFired()).isTrue();
    }

    @Test
    @DisplayName("Should report itself unavailable when the history is too short to train")
    void shouldDegradeOnShortHistory() {
        assertThatThrownBy(() -> detector.evaluate(window(60, cycle(12))))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasCauseInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Should abstain below the minimum window size before checking history")
    void shouldAbstainOnTinyWindow() {
        assertThat(detector.evaluate(window(60, cycle(3)))).isEmpty();
    }

    @Test
    @DisplayName("Should be unavailable when disabled by configuration")
    void shouldHonourDisabledFlag() {
        DetectorSettings settings = new DetectorSettings();
        settings.setTemporalEnabled(false);
        TemporalDetector disabled = new TemporalDetector(settings);

        assertThat(disabled.isAvailable()).isFalse();
        assertThatThrownBy(() -> disabled.evaluate(window(42, constant(42, 30))))
                .isInstanceOf(DetectorUnavailableException.class);
    }
}
