package com.healthsentinel.core.preprocess;

import com.healthsentinel.core.error.InvalidSampleException;
import com.healthsentinel.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cleans raw samples into per-metric series.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>Null samples and samples failing {@link MetricSample#validate()} are
 * dropped and counted; a bad sample never fails the request.</li>
 * <li>Each series is stably sorted by timestamp. For a duplicated timestamp the
 * first sample in input order wins.</li>
 * <li>Null values are kept as gaps.</li>
 * <li>With two or more metrics, timestamps at which every metric has a value
 * become rows of the aligned {@link FeatureFrame}.</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class SignalPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(SignalPreprocessor.class);

    /**
     * @param samples raw samples in any order; must not be {@code null}
     * @return the prepared input
     * @throws NullPointerException if {@code samples} is {@code null}
     */
    public PreparedInput prepare(List<MetricSample> samples) {
        Objects.requireNonNull(samples, "Samples must not be null");

        int invalid = 0;
        Map<String, List<MetricSample>> byMetric = new TreeMap<>();
        for (MetricSample sample : samples) {
            if (sample == null) {
                invalid++;
                LOG.warn("Skipping null sample");
                continue;
            }
            try {
                sample.validate();
            } catch (InvalidSampleException e) {
                invalid++;
                LOG.warn("Skipping invalid sample: {}", e.getMessage());
                continue;
            }
            byMetric.computeIfAbsent(sample.getMetricName(), k -> new ArrayList<>()).add(sample);
        }

        int duplicates = 0;
        Map<String, MetricSeries> series = new LinkedHashMap<>();
        for (Map.Entry<String, List<MetricSample>> e : byMetric.entrySet()) {
            List<MetricSample> sorted = new ArrayList<>(e.getValue());
            // List.sort is stable, so the first of equal timestamps stays first
            sorted.sort(Comparator.comparing(MetricSample::getTimestamp));

            List<MetricSample> unique = new ArrayList<>(sorted.size());
            Instant previous = null;
            for (MetricSample s : sorted) {
                if (s.getTimestamp().equals(previous)) {
                    duplicates++;
                    LOG.trace("Dropping duplicate timestamp {} for metric '{}'", previous, e.getKey());
                    continue;
                }
                unique.add(s);
                previous = s.getTimestamp();
            }
            series.put(e.getKey(), new MetricSeries(e.getKey(), unique));
        }
        if (duplicates > 0) {
            LOG.warn("Dropped {} sample(s) with duplicate timestamps", duplicates);
        }

        FeatureFrame frame = align(series);
        PreparedInput prepared = new PreparedInput(series, frame, samples.size(), invalid, duplicates);
        LOG.debug("Prepared {}", prepared);
        return prepared;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static FeatureFrame align(Map<String, MetricSeries> series) {
        if (series.size() < 2) {
            return FeatureFrame.empty();
        }
        List<String> names = new ArrayList<>(series.keySet());
        MetricSeries first = series.get(names.get(0));

        List<Instant> timestamps = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < first.observedCount(); i++) {
            Instant ts = first.observedTimestamp(i);
            double[] row = new double[names.size()];
            boolean complete = true;
            for (int c = 0; c < names.size() && complete; c++) {
                MetricSeries s = series.get(names.get(c));
                int idx = s.indexOfObserved(ts);
                if (idx < 0) {
                    complete = false;
                } else {
                    row[c] = s.observedValue(idx);
                }
            }
            if (complete) {
                timestamps.add(ts);
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            return FeatureFrame.empty();
        }
        return new FeatureFrame(names, timestamps, rows.toArray(new double[0][]));
    }
}
