package com.healthsentinel.core.detection;

import com.healthsentinel.core.preprocess.DetectionWindow;
import com.healthsentinel.core.preprocess.FeatureWindow;

import java.time.Instant;
import java.util.stream.IntStream;

/**
 * Window fixtures shared by the detector tests.
 */
final class DetectorTestSupport {

    static final Instant TS = Instant.parse("2024-02-01T07:00:00Z");

    private DetectorTestSupport() {
        // utility class
    }

    static DetectionWindow window(double candidate, double... baseline) {
        return new DetectionWindow("resting_heart_rate", TS, candidate, baseline, null);
    }

    static DetectionWindow window(double candidate, double[] baseline, FeatureWindow features) {
        return new DetectionWindow("resting_heart_rate", TS, candidate, baseline, features);
    }

    static double[] constant(double value, int count) {
        return IntStream.range(0, count).mapToDouble(i -> value).toArray();
    }

    /** 1, 2, ..., n */
    static double[] ramp(int n) {
        return IntStream.rangeClosed(1, n).asDoubleStream().toArray();
    }
}
