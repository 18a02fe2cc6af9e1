package com.healthsentinel.core.engine;

import com.healthsentinel.core.config.EngineConfig;
import com.healthsentinel.core.model.MetricSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Series and configuration fixtures for the engine tests.
 */
final class EngineTestSupport {

    static final Instant START = Instant.parse("2024-01-01T07:00:00Z");
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

    /** Small, repeating day-to-day wobble around the resting level. */
    private static final double[] WOBBLE = { 0, 1, -1, 2, -2, 1, 0, -1, 1, -1, 2, 0, -2, 1 };

    private EngineTestSupport() {
        // utility class
    }

    static Instant day(int n) {
        return START.plus(Duration.ofDays(n));
    }

    /**
     * Defaults with generous real-time budgets, so a cold JVM does not turn
     * into timeouts.
     */
    static EngineConfig relaxedConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.getRealtime().setLatencyBudgetMs(60_000);
        config.getRealtime().setTemporalBudgetMs(30_000);
        config.getBatch().setWorkerThreads(4);
        config.getBatch().setChunkSize(8);
        return config;
    }

    /** {@code days} typical days of a metric followed by one spike. */
    static List<MetricSample> withSpike(String metric, double level, int days, double spike) {
        List<MetricSample> samples = typical(metric, level, days);
        samples.add(MetricSample.of(day(days), metric, spike));
        return samples;
    }

    static List<MetricSample> typical(String metric, double level, int days) {
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            samples.add(MetricSample.of(day(i), metric, level + WOBBLE[i % WOBBLE.length]));
        }
        return samples;
    }

    static List<MetricSample> constant(String metric, double value, int days) {
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            samples.add(MetricSample.of(day(i), metric, value));
        }
        return samples;
    }

    /** Gaussian readings rounded to one decimal, reproducible per seed. */
    static List<MetricSample> noisy(String metric, double level, double spread, int days, long seed) {
        Random random = new Random(seed);
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            double value = Math.round((level + spread * random.nextGaussian()) * 10) / 10.0;
            samples.add(MetricSample.of(day(i), metric, value));
        }
        return samples;
    }

    /** Readings drawn from a few discrete levels, as whole-number devices report them. */
    static List<MetricSample> rounded(String metric, int days, long seed, double... levels) {
        Random random = new Random(seed);
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            samples.add(MetricSample.of(day(i), metric, levels[random.nextInt(levels.length)]));
        }
        return samples;
    }
}
