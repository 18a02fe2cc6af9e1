package com.healthsentinel.core.detection;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Descriptive statistics shared by the detectors and the explanation
 * generator, so that both describe a window with the same numbers.
 *
 * @since 1.0.0
 */
public final class WindowStatistics {

    private WindowStatistics() {
        // utility class
    }

    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    /**
     * Population standard deviation. Exactly 0 for a constant array, so that
     * rounding in the mean cannot produce a spurious tiny spread.
     */
    public static double populationStd(double[] values) {
        if (isConstant(values)) {
            return 0.0;
        }
        return new StandardDeviation(false).evaluate(values);
    }

    public static double median(double[] values) {
        return new Median().withEstimationType(Percentile.EstimationType.R_7).evaluate(values);
    }

    /**
     * @param p percentile in {@code (0, 100]}
     */
    public static double percentile(double[] values, double p) {
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, p);
    }

    public static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Measurement resolution of a set of readings: the median gap between
     * consecutive distinct values. Integer heart rates give 1, readings
     * rounded to a quarter hour give 0.25. Zero when there are fewer than two
     * distinct values.
     */
    public static double resolution(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double[] gaps = new double[sorted.length];
        int count = 0;
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] > sorted[i - 1]) {
                gaps[count++] = sorted[i] - sorted[i - 1];
            }
        }
        return count == 0 ? 0.0 : median(Arrays.copyOf(gaps, count));
    }

    /**
     * Map a raw score onto {@code [0, 1]} so that {@code |raw| == threshold}
     * lands on 0.5.
     */
    public static double normalize(double raw, double threshold) {
        double abs = Math.abs(raw);
        if (Double.isInfinite(abs)) {
            return 1.0;
        }
        return abs / (abs + threshold);
    }

    /**
     * Score of a deviation measured in units of {@code spread}. A zero spread
     * saturates to infinity unless the deviation is also zero.
     */
    public static double standardized(double deviation, double spread) {
        if (spread == 0.0) {
            return deviation == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, deviation);
        }
        return deviation / spread;
    }
}
